package com.finhelm.reconcile.analytics;

import com.finhelm.reconcile.config.InvalidConfigurationException;
import com.finhelm.reconcile.model.AnomalyResult;
import com.finhelm.reconcile.model.HistoricalStats;
import com.finhelm.reconcile.model.Severity;
import com.finhelm.reconcile.model.TransactionRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Three-sigma outlier detection over transaction magnitudes.
 * <p>
 * Without history each transaction is measured against the other members of its group
 * (leave-one-out), so one extreme value cannot inflate the deviation it is judged by.
 */
@Component
public class OutlierDetector {

    private static final double MAX_CONFIDENCE = 0.99d;
    private static final double CONFIDENCE_SOFTENING = 0.5d;
    private static final double HIGH_SEVERITY_Z_SCORE = 5.0d;

    public List<AnomalyResult> detectOutliers(List<TransactionRecord> transactions) {
        return detectOutliers(transactions, TransactionRecord::accountCode, Map.of(), DetectionSettings.DEFAULT);
    }

    public List<AnomalyResult> detectOutliers(
            List<TransactionRecord> transactions,
            Function<TransactionRecord, String> groupKey,
            Map<String, HistoricalStats> historicalStats,
            DetectionSettings settings) {
        if (settings == null) {
            throw new InvalidConfigurationException("detection settings must be provided");
        }
        if (transactions == null || transactions.isEmpty()) {
            return List.of();
        }
        Function<TransactionRecord, String> keyFunction = groupKey != null ? groupKey : TransactionRecord::accountCode;
        Map<String, HistoricalStats> history = historicalStats != null ? historicalStats : Map.of();

        Map<String, List<TransactionRecord>> groups = new LinkedHashMap<>();
        for (TransactionRecord tx : transactions) {
            if (tx == null) {
                continue;
            }
            String key = Objects.requireNonNullElse(keyFunction.apply(tx), "");
            groups.computeIfAbsent(key, ignored -> new ArrayList<>()).add(tx);
        }

        List<AnomalyResult> results = new ArrayList<>();
        groups.forEach((key, members) -> {
            HistoricalStats stats = history.get(key);
            if (stats != null && stats.frequency() >= settings.minSampleSize()) {
                scoreAgainstHistory(key, members, stats, settings, results);
            } else if (members.size() >= settings.minSampleSize()) {
                scoreLeaveOneOut(key, members, settings, results);
            }
        });
        results.sort(Comparator.comparingDouble(AnomalyResult::zScore).reversed()
                .thenComparing(AnomalyResult::transactionId, Comparator.nullsLast(Comparator.naturalOrder())));
        return List.copyOf(results);
    }

    private void scoreAgainstHistory(
            String key,
            List<TransactionRecord> members,
            HistoricalStats stats,
            DetectionSettings settings,
            List<AnomalyResult> sink) {
        for (TransactionRecord tx : members) {
            sink.add(score(key, tx, stats.avgAmount(), stats.stdDev(), AnomalyResult.Baseline.HISTORICAL, settings));
        }
    }

    private void scoreLeaveOneOut(
            String key,
            List<TransactionRecord> members,
            DetectionSettings settings,
            List<AnomalyResult> sink) {
        int size = members.size();
        // prefix[i] covers members [0, i), suffix[i] covers members [i, size)
        RunningStats[] prefix = new RunningStats[size + 1];
        RunningStats[] suffix = new RunningStats[size + 1];
        prefix[0] = RunningStats.EMPTY;
        suffix[size] = RunningStats.EMPTY;
        for (int i = 0; i < size; i++) {
            prefix[i + 1] = prefix[i].add(members.get(i).magnitude());
        }
        for (int i = size - 1; i >= 0; i--) {
            suffix[i] = suffix[i + 1].add(members.get(i).magnitude());
        }
        for (int i = 0; i < size; i++) {
            RunningStats others = prefix[i].merge(suffix[i + 1]);
            sink.add(score(key, members.get(i), others.mean(), others.standardDeviation(),
                    AnomalyResult.Baseline.IN_BATCH, settings));
        }
    }

    private AnomalyResult score(
            String key,
            TransactionRecord tx,
            double mean,
            double standardDeviation,
            AnomalyResult.Baseline baseline,
            DetectionSettings settings) {
        double divisor = standardDeviation > settings.minimumStandardDeviation()
                ? standardDeviation
                : settings.minimumStandardDeviation();
        double zScore = Math.abs(tx.magnitude() - mean) / divisor;
        if (Double.isNaN(zScore)) {
            zScore = 0d;
        }
        boolean anomaly = zScore > settings.sigmaThreshold();
        return new AnomalyResult(
                tx.id(),
                key,
                anomaly,
                zScore,
                confidenceFor(zScore),
                new AnomalyResult.StatisticalData(mean, standardDeviation, settings.sigmaThreshold()),
                baseline,
                describe(tx, key, zScore, mean, anomaly, baseline),
                severityFor(zScore, anomaly));
    }

    /**
     * Monotonic, bounded mapping: 3 sigma gives about 0.86, 6.4 sigma reaches 0.927.
     */
    static double confidenceFor(double zScore) {
        if (!(zScore > 0d)) {
            return 0d;
        }
        if (Double.isInfinite(zScore)) {
            return MAX_CONFIDENCE;
        }
        return Math.min(MAX_CONFIDENCE, zScore / (zScore + CONFIDENCE_SOFTENING));
    }

    private static Severity severityFor(double zScore, boolean anomaly) {
        if (!anomaly) {
            return Severity.LOW;
        }
        return zScore > HIGH_SEVERITY_Z_SCORE ? Severity.HIGH : Severity.MEDIUM;
    }

    private static String describe(
            TransactionRecord tx,
            String key,
            double zScore,
            double mean,
            boolean anomaly,
            AnomalyResult.Baseline baseline) {
        if (!anomaly) {
            return "Transaction amount is within normal range";
        }
        String reference = baseline == AnomalyResult.Baseline.HISTORICAL ? "historical average" : "average";
        return String.format(Locale.ROOT,
                "Transaction amount %s is %.1f standard deviations from the %s of %.2f for %s",
                tx.amount().toPlainString(), zScore, reference, mean, key.isEmpty() ? "unassigned account" : key);
    }

    /**
     * Welford accumulator; {@code m2} is the sum of squared deviations from {@code mean}.
     */
    private record RunningStats(long count, double mean, double m2) {

        static final RunningStats EMPTY = new RunningStats(0L, 0d, 0d);

        RunningStats add(double value) {
            long n = count + 1;
            double delta = value - mean;
            double nextMean = mean + delta / n;
            return new RunningStats(n, nextMean, m2 + delta * (value - nextMean));
        }

        RunningStats merge(RunningStats other) {
            if (other.count == 0) {
                return this;
            }
            if (count == 0) {
                return other;
            }
            long n = count + other.count;
            double delta = other.mean - mean;
            return new RunningStats(
                    n,
                    mean + delta * other.count / n,
                    m2 + other.m2 + delta * delta * ((double) count * other.count / n));
        }

        double standardDeviation() {
            return count == 0 ? 0d : Math.sqrt(Math.max(0d, m2 / count));
        }
    }
}
