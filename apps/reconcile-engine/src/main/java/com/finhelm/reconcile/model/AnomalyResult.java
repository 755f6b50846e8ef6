package com.finhelm.reconcile.model;

public record AnomalyResult(
        String transactionId,
        String groupKey,
        boolean isAnomaly,
        double zScore,
        double confidence,
        StatisticalData statisticalData,
        Baseline baseline,
        String explanation,
        Severity severity
) {
    public enum Baseline {
        IN_BATCH,
        HISTORICAL
    }

    public record StatisticalData(double mean, double standardDeviation, double threshold) {
    }
}
