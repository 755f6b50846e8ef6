package com.finhelm.reconcile.model;

/**
 * Externally aggregated baseline for one account.
 */
public record HistoricalStats(String accountCode, double avgAmount, double stdDev, long frequency) {
}
