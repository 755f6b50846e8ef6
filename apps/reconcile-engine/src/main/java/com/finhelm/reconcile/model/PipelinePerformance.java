package com.finhelm.reconcile.model;

public record PipelinePerformance(int processedTransactions, long processingTimeMs, boolean confidenceThresholdMet) {
}
