package com.finhelm.reconcile.model;

import java.math.BigDecimal;

public record FinancialBalances(
        BigDecimal currentAssets,
        BigDecimal currentLiabilities,
        BigDecimal totalDebt,
        BigDecimal totalEquity,
        BigDecimal revenue,
        BigDecimal costOfGoodsSold,
        BigDecimal netIncome
) {
}
