package com.finhelm.reconcile.model;

import java.math.BigDecimal;

public record FinancialRatios(
        BigDecimal currentRatio,
        BigDecimal quickRatio,
        BigDecimal debtToEquity,
        BigDecimal grossMargin,
        BigDecimal netMargin
) {
}
