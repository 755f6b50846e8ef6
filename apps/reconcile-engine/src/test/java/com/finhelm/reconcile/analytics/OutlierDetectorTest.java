package com.finhelm.reconcile.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.finhelm.reconcile.config.InvalidConfigurationException;
import com.finhelm.reconcile.model.AnomalyResult;
import com.finhelm.reconcile.model.HistoricalStats;
import com.finhelm.reconcile.model.Severity;
import com.finhelm.reconcile.model.TransactionRecord;
import com.finhelm.reconcile.model.TransactionType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class OutlierDetectorTest {

    private final OutlierDetector detector = new OutlierDetector();

    @Test
    void flagsSingleLargePaymentInSmallGroup() {
        List<TransactionRecord> transactions = group("6000", 1000, 1100, 900, 1050, 950, 10000);

        List<AnomalyResult> results = detector.detectOutliers(transactions);

        assertThat(results).hasSize(6);
        assertThat(results).filteredOn(AnomalyResult::isAnomaly)
                .singleElement()
                .satisfies(anomaly -> {
                    assertThat(anomaly.transactionId()).isEqualTo("6000-5");
                    assertThat(anomaly.zScore()).isGreaterThan(3.0d);
                    assertThat(anomaly.confidence()).isGreaterThan(0.9d).isLessThanOrEqualTo(0.99d);
                    assertThat(anomaly.severity()).isEqualTo(Severity.HIGH);
                    assertThat(anomaly.baseline()).isEqualTo(AnomalyResult.Baseline.IN_BATCH);
                    assertThat(anomaly.statisticalData().mean()).isCloseTo(1000.0d, within(1e-6));
                    assertThat(anomaly.statisticalData().threshold()).isEqualTo(3.0d);
                    assertThat(anomaly.explanation())
                            .contains("10000")
                            .contains("standard deviations from the average")
                            .contains("6000");
                });
        assertThat(results.get(0).transactionId()).isEqualTo("6000-5");
        assertThat(results).extracting(AnomalyResult::zScore).isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(results).filteredOn(result -> !result.isAnomaly())
                .allSatisfy(result -> {
                    assertThat(result.severity()).isEqualTo(Severity.LOW);
                    assertThat(result.explanation()).isEqualTo("Transaction amount is within normal range");
                });
    }

    @Test
    void skipsGroupsBelowMinimumSampleSize() {
        List<TransactionRecord> transactions = new ArrayList<>(group("6000", 100, 100000));
        transactions.addAll(group("7000", 50, 55, 60));

        List<AnomalyResult> results = detector.detectOutliers(transactions);

        assertThat(results).hasSize(3).allSatisfy(result -> assertThat(result.groupKey()).isEqualTo("7000"));
    }

    @Test
    void groupsDoNotInfluenceEachOther() {
        List<TransactionRecord> transactions = new ArrayList<>(group("6000", 1000, 1100, 900, 1050, 950));
        transactions.addAll(group("4000", 50000, 51000, 49000, 50500, 49500));

        List<AnomalyResult> results = detector.detectOutliers(transactions);

        assertThat(results).hasSize(10).noneMatch(AnomalyResult::isAnomaly);
    }

    @Test
    void historicalBaselineTakesPrecedenceWhenItHasEnoughSamples() {
        List<TransactionRecord> transactions = group("4000", 100, 105, 250);
        Map<String, HistoricalStats> history = Map.of("4000", new HistoricalStats("4000", 100d, 10d, 12));

        List<AnomalyResult> results = detector.detectOutliers(
                transactions, TransactionRecord::accountCode, history, DetectionSettings.DEFAULT);

        assertThat(results).allSatisfy(result -> assertThat(result.baseline()).isEqualTo(AnomalyResult.Baseline.HISTORICAL));
        assertThat(results.get(0)).satisfies(anomaly -> {
            assertThat(anomaly.transactionId()).isEqualTo("4000-2");
            assertThat(anomaly.zScore()).isCloseTo(15.0d, within(1e-9));
            assertThat(anomaly.isAnomaly()).isTrue();
            assertThat(anomaly.explanation()).contains("historical average");
        });
        assertThat(results).filteredOn(AnomalyResult::isAnomaly).hasSize(1);
    }

    @Test
    void sparseHistoryFallsBackToInBatchBaseline() {
        List<TransactionRecord> transactions = group("4000", 100, 110, 90, 105, 95);
        Map<String, HistoricalStats> history = Map.of("4000", new HistoricalStats("4000", 1d, 1d, 2));

        List<AnomalyResult> results = detector.detectOutliers(
                transactions, TransactionRecord::accountCode, history, DetectionSettings.DEFAULT);

        assertThat(results).hasSize(5)
                .allSatisfy(result -> assertThat(result.baseline()).isEqualTo(AnomalyResult.Baseline.IN_BATCH))
                .noneMatch(AnomalyResult::isAnomaly);
    }

    @Test
    void largeAmountsKeepTheirSpread() {
        double base = 1e10;
        List<AnomalyResult> results = detector.detectOutliers(
                group("1000", base, base + 10, base + 20, base + 30, base + 40, base + 50));

        assertThat(results).hasSize(6).noneMatch(AnomalyResult::isAnomaly);
        assertThat(results).filteredOn(result -> result.transactionId().equals("1000-0"))
                .singleElement()
                .satisfies(result -> {
                    assertThat(result.statisticalData().mean()).isCloseTo(base + 30, within(1e-3));
                    assertThat(result.statisticalData().standardDeviation()).isCloseTo(Math.sqrt(200d), within(1e-3));
                    assertThat(result.zScore()).isCloseTo(30d / Math.sqrt(200d), within(1e-3));
                });
    }

    @Test
    void identicalAmountsUseMinimumDeviation() {
        List<AnomalyResult> results = detector.detectOutliers(group("6000", 500, 500, 500));

        assertThat(results).hasSize(3).allSatisfy(result -> {
            assertThat(result.zScore()).isZero();
            assertThat(result.isAnomaly()).isFalse();
        });
    }

    @Test
    void scoresMagnitudeOfNegativeAmounts() {
        List<AnomalyResult> results = detector.detectOutliers(group("6000", -1000, -1100, -900, -1050, -950, -10000));

        assertThat(results.get(0).transactionId()).isEqualTo("6000-5");
        assertThat(results.get(0).isAnomaly()).isTrue();
    }

    @Test
    void confidenceGrowsWithZScoreAndIsBounded() {
        assertThat(OutlierDetector.confidenceFor(0d)).isZero();
        assertThat(OutlierDetector.confidenceFor(3d)).isCloseTo(3d / 3.5d, within(1e-9));
        assertThat(OutlierDetector.confidenceFor(7d)).isGreaterThan(OutlierDetector.confidenceFor(3d));
        assertThat(OutlierDetector.confidenceFor(1_000d)).isEqualTo(0.99d);
        assertThat(OutlierDetector.confidenceFor(Double.POSITIVE_INFINITY)).isEqualTo(0.99d);
    }

    @Test
    void emptyInputYieldsNoResults() {
        assertThat(detector.detectOutliers(List.of())).isEmpty();
        assertThat(detector.detectOutliers(null)).isEmpty();
    }

    @Test
    void rejectsMissingOrInvalidSettings() {
        assertThatThrownBy(() -> detector.detectOutliers(List.of(), TransactionRecord::accountCode, Map.of(), null))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new DetectionSettings(2, 3d, 0.9d, 1d))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("minSampleSize");
        assertThatThrownBy(() -> new DetectionSettings(3, 0d, 0.9d, 1d))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    static List<TransactionRecord> group(String accountCode, double... amounts) {
        List<TransactionRecord> transactions = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            transactions.add(new TransactionRecord(
                    accountCode + "-" + i,
                    accountCode,
                    BigDecimal.valueOf(amounts[i]),
                    Instant.parse("2024-03-01T10:00:00Z").plusSeconds(3600L * i),
                    amounts[i] < 0 ? TransactionType.WITHDRAWAL : TransactionType.DEPOSIT,
                    Optional.empty()));
        }
        return transactions;
    }
}
