package com.finhelm.reconcile.model;

import java.util.List;
import java.util.Map;

public record ReconciliationReport(
        List<MatchResult> matches,
        List<AccountRecord> unmatchedSources,
        List<AccountRecord> unmatchedTargets,
        double matchRate,
        Map<MatchTier, Integer> tierCounts
) {
}
