package com.finhelm.reconcile.pipeline;

import com.finhelm.reconcile.analytics.DetectionSettings;
import com.finhelm.reconcile.analytics.OutlierDetector;
import com.finhelm.reconcile.analytics.SubledgerAnalyzer;
import com.finhelm.reconcile.config.InvalidConfigurationException;
import com.finhelm.reconcile.config.ReconcileProperties;
import com.finhelm.reconcile.explanation.ExplanationGenerator;
import com.finhelm.reconcile.matching.AccountMatcher;
import com.finhelm.reconcile.model.AccountRecord;
import com.finhelm.reconcile.model.AnomalyResult;
import com.finhelm.reconcile.model.Explanation;
import com.finhelm.reconcile.model.HistoricalStats;
import com.finhelm.reconcile.model.PipelinePerformance;
import com.finhelm.reconcile.model.PipelineResult;
import com.finhelm.reconcile.model.ReconciliationReport;
import com.finhelm.reconcile.model.SubledgerAnalysis;
import com.finhelm.reconcile.model.TransactionRecord;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs outlier detection, subledger analysis and explanation over one batch. Stages are isolated
 * from each other: a stage that throws is logged, listed in {@link PipelineResult#failedStages()}
 * and contributes an empty result while the others still report.
 */
@Service
public class AnomalyPipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnomalyPipelineOrchestrator.class);

    static final String STAGE_OUTLIERS = "outliers";
    static final String STAGE_SUBLEDGER = "subledger";
    static final String STAGE_EXPLANATIONS = "explanations";

    private final OutlierDetector outlierDetector;
    private final SubledgerAnalyzer subledgerAnalyzer;
    private final ExplanationGenerator explanationGenerator;
    private final AccountMatcher accountMatcher;
    private final ReconcileProperties properties;

    public AnomalyPipelineOrchestrator(
            OutlierDetector outlierDetector,
            SubledgerAnalyzer subledgerAnalyzer,
            ExplanationGenerator explanationGenerator,
            AccountMatcher accountMatcher,
            ReconcileProperties properties) {
        this.outlierDetector = outlierDetector;
        this.subledgerAnalyzer = subledgerAnalyzer;
        this.explanationGenerator = explanationGenerator;
        this.accountMatcher = accountMatcher;
        this.properties = properties;
    }

    public PipelineResult process(List<TransactionRecord> transactions, List<AccountRecord> accounts) {
        return process(transactions, accounts, Map.of(), properties.detection().toSettings());
    }

    public PipelineResult process(
            List<TransactionRecord> transactions,
            List<AccountRecord> accounts,
            Map<String, HistoricalStats> historicalStats,
            DetectionSettings settings) {
        if (settings == null) {
            throw new InvalidConfigurationException("detection settings must be provided");
        }
        long started = System.nanoTime();
        List<TransactionRecord> txs = transactions == null
                ? List.of()
                : transactions.stream().filter(Objects::nonNull).toList();
        List<AccountRecord> accountList = accounts == null
                ? List.of()
                : accounts.stream().filter(Objects::nonNull).toList();
        if (txs.isEmpty()) {
            return PipelineResult.empty();
        }
        Map<String, HistoricalStats> history = historicalStats != null ? historicalStats : Map.of();
        List<String> failedStages = new ArrayList<>();

        List<AnomalyResult> outliers = List.of();
        try {
            outliers = outlierDetector.detectOutliers(txs, TransactionRecord::accountCode, history, settings);
        } catch (RuntimeException ex) {
            log.warn("Anomaly pipeline: outlier stage failed, continuing without outliers", ex);
            failedStages.add(STAGE_OUTLIERS);
        }

        List<SubledgerAnalysis> subledger = List.of();
        try {
            subledger = subledgerAnalyzer.analyzeSubledger(txs, accountList, settings);
        } catch (RuntimeException ex) {
            log.warn("Anomaly pipeline: subledger stage failed, continuing without subledger analysis", ex);
            failedStages.add(STAGE_SUBLEDGER);
        }

        List<Explanation> explanations = explain(outliers, txs, failedStages);

        boolean confidenceThresholdMet = outliers.stream()
                .anyMatch(result -> result.isAnomaly() && result.confidence() >= settings.confidenceTarget());
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        log.debug("Anomaly pipeline: transactions={}, outliers={}, anomalies={}, subledgers={}, elapsedMs={}",
                txs.size(), outliers.size(), explanations.size(), subledger.size(), elapsedMs);

        return new PipelineResult(
                outliers,
                subledger,
                explanations,
                new PipelinePerformance(transactions.size(), elapsedMs, confidenceThresholdMet),
                List.copyOf(failedStages));
    }

    public ReconciliationReport reconcile(List<AccountRecord> sourceAccounts, List<AccountRecord> targetAccounts) {
        ReconcileProperties.Matching matching = properties.matching();
        return accountMatcher.reconcile(sourceAccounts, targetAccounts, matching.toWeights(), matching.threshold());
    }

    private List<Explanation> explain(
            List<AnomalyResult> outliers,
            List<TransactionRecord> transactions,
            List<String> failedStages) {
        // one budget for the whole stage so a slow model cannot stretch a run per anomaly
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(properties.ai().timeoutMs());
        Map<String, TransactionRecord> byId = new HashMap<>();
        for (TransactionRecord tx : transactions) {
            if (tx.id() != null) {
                byId.putIfAbsent(tx.id(), tx);
            }
        }
        List<Explanation> explanations = new ArrayList<>();
        boolean failed = false;
        for (AnomalyResult outlier : outliers) {
            if (!outlier.isAnomaly()) {
                continue;
            }
            try {
                Duration remaining = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
                explanations.add(explanationGenerator.explain(outlier, byId.get(outlier.transactionId()), remaining));
            } catch (RuntimeException ex) {
                log.warn("Anomaly pipeline: explanation failed for transaction {}", outlier.transactionId(), ex);
                failed = true;
            }
        }
        if (failed) {
            failedStages.add(STAGE_EXPLANATIONS);
        }
        return List.copyOf(explanations);
    }
}
