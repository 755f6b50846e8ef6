package com.finhelm.reconcile.analytics;

import com.finhelm.reconcile.model.FinancialBalances;
import com.finhelm.reconcile.model.FinancialRatios;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

@Component
public class FinancialRatioCalculator {

    private static final int SCALE = 4;
    // inventory is not broken out in the balances; assume it is a fifth of current assets
    private static final BigDecimal QUICK_ASSET_FACTOR = new BigDecimal("0.8");

    public FinancialRatios calculate(FinancialBalances balances) {
        if (balances == null) {
            return new FinancialRatios(zero(), zero(), zero(), zero(), zero());
        }
        BigDecimal currentAssets = orZero(balances.currentAssets());
        BigDecimal currentLiabilities = orZero(balances.currentLiabilities());
        BigDecimal revenue = orZero(balances.revenue());
        return new FinancialRatios(
                divideSafe(currentAssets, currentLiabilities),
                divideSafe(currentAssets.multiply(QUICK_ASSET_FACTOR), currentLiabilities),
                divideSafe(orZero(balances.totalDebt()), orZero(balances.totalEquity())),
                divideSafe(revenue.subtract(orZero(balances.costOfGoodsSold())), revenue),
                divideSafe(orZero(balances.netIncome()), revenue));
    }

    private static BigDecimal divideSafe(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return zero();
        }
        return numerator.divide(denominator, SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
