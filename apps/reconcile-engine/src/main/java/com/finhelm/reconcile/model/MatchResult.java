package com.finhelm.reconcile.model;

public record MatchResult(
        AccountRecord source,
        AccountRecord target,
        double score,
        MatchFactors matchFactors,
        MatchTier tier
) {
    public MatchResult(AccountRecord source, AccountRecord target, double score, MatchFactors matchFactors) {
        this(source, target, score, matchFactors, MatchTier.of(score));
    }

    public record MatchFactors(double codeScore, double nameScore, double hierarchyScore, double typeScore) {
    }
}
