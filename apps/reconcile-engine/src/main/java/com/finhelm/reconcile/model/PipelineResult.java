package com.finhelm.reconcile.model;

import java.util.List;

public record PipelineResult(
        List<AnomalyResult> outliers,
        List<SubledgerAnalysis> subledgerAnalysis,
        List<Explanation> explanations,
        PipelinePerformance performance,
        List<String> failedStages
) {
    public static PipelineResult empty() {
        return new PipelineResult(List.of(), List.of(), List.of(), new PipelinePerformance(0, 0L, false), List.of());
    }
}
