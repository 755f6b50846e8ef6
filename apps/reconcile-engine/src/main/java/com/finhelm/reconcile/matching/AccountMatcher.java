package com.finhelm.reconcile.matching;

import com.finhelm.reconcile.config.InvalidConfigurationException;
import com.finhelm.reconcile.model.AccountRecord;
import com.finhelm.reconcile.model.MatchResult;
import com.finhelm.reconcile.model.MatchTier;
import com.finhelm.reconcile.model.ReconciliationReport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AccountMatcher {

    private static final Logger log = LoggerFactory.getLogger(AccountMatcher.class);

    public static final double DEFAULT_THRESHOLD = 0.9d;

    private static final Pattern PATH_SEPARATOR = Pattern.compile("[:/]");

    public List<MatchResult> findBestAccountMatches(List<AccountRecord> sources, List<AccountRecord> targets) {
        return findBestAccountMatches(sources, targets, MatchWeights.DEFAULT, DEFAULT_THRESHOLD);
    }

    /**
     * Pairs every source account with its best scoring target and keeps the pairs scoring at
     * least {@code threshold}, highest score first.
     */
    public List<MatchResult> findBestAccountMatches(
            List<AccountRecord> sources,
            List<AccountRecord> targets,
            MatchWeights weights,
            double threshold) {
        return match(sources, targets, weights, threshold).stream()
                .map(IndexedMatch::result)
                .toList();
    }

    public ReconciliationReport reconcile(
            List<AccountRecord> sources,
            List<AccountRecord> targets,
            MatchWeights weights,
            double threshold) {
        List<IndexedMatch> matches = match(sources, targets, weights, threshold);
        List<AccountRecord> sourceList = nonNull(sources);
        List<AccountRecord> targetList = nonNull(targets);

        boolean[] sourceMatched = new boolean[sourceList.size()];
        boolean[] targetMatched = new boolean[targetList.size()];
        Map<MatchTier, Integer> tierCounts = new EnumMap<>(MatchTier.class);
        for (MatchTier tier : MatchTier.values()) {
            tierCounts.put(tier, 0);
        }
        for (IndexedMatch match : matches) {
            sourceMatched[match.sourceIndex()] = true;
            targetMatched[match.targetIndex()] = true;
            tierCounts.merge(match.result().tier(), 1, Integer::sum);
        }

        List<AccountRecord> unmatchedSources = new ArrayList<>();
        for (int i = 0; i < sourceList.size(); i++) {
            if (!sourceMatched[i]) {
                unmatchedSources.add(sourceList.get(i));
            }
        }
        List<AccountRecord> unmatchedTargets = new ArrayList<>();
        for (int i = 0; i < targetList.size(); i++) {
            if (!targetMatched[i]) {
                unmatchedTargets.add(targetList.get(i));
            }
        }
        double matchRate = sourceList.isEmpty() ? 0d : (double) matches.size() / sourceList.size();
        return new ReconciliationReport(
                matches.stream().map(IndexedMatch::result).toList(),
                List.copyOf(unmatchedSources),
                List.copyOf(unmatchedTargets),
                matchRate,
                Collections.unmodifiableMap(tierCounts));
    }

    private List<IndexedMatch> match(
            List<AccountRecord> sources,
            List<AccountRecord> targets,
            MatchWeights weights,
            double threshold) {
        if (weights == null) {
            throw new InvalidConfigurationException("match weights must be provided");
        }
        MatchWeights.requireThreshold(threshold);
        List<IndexedAccount> sourceIndex = index(nonNull(sources));
        List<IndexedAccount> targetIndex = index(nonNull(targets));
        if (sourceIndex.isEmpty() || targetIndex.isEmpty()) {
            return List.of();
        }

        long started = System.nanoTime();
        List<IndexedMatch> matches = new ArrayList<>();
        for (int s = 0; s < sourceIndex.size(); s++) {
            IndexedAccount source = sourceIndex.get(s);
            MatchResult best = null;
            int bestTarget = -1;
            for (int t = 0; t < targetIndex.size(); t++) {
                MatchResult candidate = score(source, targetIndex.get(t), weights);
                if (best == null || candidate.score() > best.score()) {
                    best = candidate;
                    bestTarget = t;
                }
            }
            if (best != null && best.score() >= threshold) {
                matches.add(new IndexedMatch(s, bestTarget, best));
            }
        }
        matches.sort(Comparator.comparingDouble((IndexedMatch match) -> match.result().score()).reversed());
        log.debug("Account matching: sources={}, targets={}, matches={}, threshold={}, elapsedMs={}",
                sourceIndex.size(), targetIndex.size(), matches.size(), threshold,
                (System.nanoTime() - started) / 1_000_000);
        return matches;
    }

    private MatchResult score(IndexedAccount source, IndexedAccount target, MatchWeights weights) {
        boolean exactCode = !source.normalizedCode().isEmpty()
                && source.normalizedCode().equals(target.normalizedCode());
        double codeScore = exactCode
                ? 1.0d
                : SimilarityScorer.foldedSimilarity(source.normalizedCode(), target.normalizedCode());
        double nameScore = SimilarityScorer.foldedSimilarity(source.foldedName(), target.foldedName());
        double hierarchyScore = hierarchyScore(source.foldedParents(), target.foldedParents());
        double typeScore = typeScore(source.account(), target.account(), weights);

        double composite = codeScore * weights.codeWeight()
                + nameScore * weights.nameWeight()
                + hierarchyScore * weights.hierarchyWeight()
                + typeScore * weights.typeWeight();
        if (exactCode) {
            composite = Math.max(composite, weights.exactCodeFloor());
        }
        return new MatchResult(
                source.account(),
                target.account(),
                SimilarityScorer.clamp(composite),
                new MatchResult.MatchFactors(codeScore, nameScore, hierarchyScore, typeScore));
    }

    private static double hierarchyScore(List<String> sourceParents, List<String> targetParents) {
        int depth = Math.max(sourceParents.size(), targetParents.size());
        if (depth == 0) {
            return 1.0d;
        }
        int shared = Math.min(sourceParents.size(), targetParents.size());
        double total = 0d;
        for (int level = 0; level < shared; level++) {
            total += SimilarityScorer.foldedSimilarity(sourceParents.get(level), targetParents.get(level));
        }
        return SimilarityScorer.clamp(total / depth);
    }

    private static double typeScore(AccountRecord source, AccountRecord target, MatchWeights weights) {
        if (source.type() == target.type()) {
            return 1.0d;
        }
        return source.type().isRelatedTo(target.type()) ? weights.relatedTypeCredit() : 0d;
    }

    private static List<IndexedAccount> index(List<AccountRecord> accounts) {
        if (accounts.isEmpty()) {
            return List.of();
        }
        AccountHierarchy hierarchy = AccountHierarchy.of(accounts);
        List<IndexedAccount> indexed = new ArrayList<>(accounts.size());
        for (AccountRecord account : accounts) {
            List<String> parents = account.fullName().isBlank()
                    ? hierarchy.ancestorNames(account.code())
                    : parentSegments(account.fullName());
            indexed.add(new IndexedAccount(
                    account,
                    AccountCodeNormalizer.normalize(account.code()),
                    SimilarityScorer.fold(account.name()),
                    parents.stream().map(SimilarityScorer::fold).toList()));
        }
        return indexed;
    }

    static List<String> parentSegments(String fullName) {
        List<String> segments = new ArrayList<>();
        for (String part : PATH_SEPARATOR.split(fullName)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                segments.add(trimmed);
            }
        }
        return segments.isEmpty() ? segments : segments.subList(0, segments.size() - 1);
    }

    private static List<AccountRecord> nonNull(List<AccountRecord> accounts) {
        if (accounts == null) {
            return List.of();
        }
        return accounts.stream().filter(Objects::nonNull).toList();
    }

    private record IndexedAccount(
            AccountRecord account,
            String normalizedCode,
            String foldedName,
            List<String> foldedParents) {
    }

    private record IndexedMatch(int sourceIndex, int targetIndex, MatchResult result) {
    }
}
