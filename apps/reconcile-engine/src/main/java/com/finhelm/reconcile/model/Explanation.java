package com.finhelm.reconcile.model;

import java.time.Instant;
import java.util.List;

public record Explanation(
        String transactionId,
        String summary,
        List<String> reasoning,
        double confidence,
        RiskLevel riskLevel,
        List<String> recommendations,
        Instant generatedAt,
        Source source
) {
    public enum RiskLevel {
        LOW,
        MEDIUM,
        HIGH
    }

    public enum Source {
        TEMPLATE,
        LANGUAGE_MODEL
    }
}
