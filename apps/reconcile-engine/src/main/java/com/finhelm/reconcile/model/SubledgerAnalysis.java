package com.finhelm.reconcile.model;

import java.util.List;

public record SubledgerAnalysis(
        String category,
        AccountType accountType,
        Patterns patterns,
        List<AnomalyResult> anomalies
) {
    public record Patterns(double averageAmount, int frequency, double seasonality) {
    }
}
