package com.finhelm.reconcile.model;

public enum MatchTier {
    EXACT,
    STRONG,
    MODERATE,
    WEAK;

    private static final double EXACT_THRESHOLD = 0.999d;
    private static final double STRONG_THRESHOLD = 0.85d;
    private static final double MODERATE_THRESHOLD = 0.70d;

    public static MatchTier of(double score) {
        if (score >= EXACT_THRESHOLD) {
            return EXACT;
        }
        if (score >= STRONG_THRESHOLD) {
            return STRONG;
        }
        if (score >= MODERATE_THRESHOLD) {
            return MODERATE;
        }
        return WEAK;
    }
}
