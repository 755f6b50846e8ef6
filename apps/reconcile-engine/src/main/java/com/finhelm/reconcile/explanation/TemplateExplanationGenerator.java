package com.finhelm.reconcile.explanation;

import com.finhelm.reconcile.model.AnomalyResult;
import com.finhelm.reconcile.model.Explanation;
import com.finhelm.reconcile.model.Explanation.RiskLevel;
import com.finhelm.reconcile.model.TransactionRecord;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Deterministic explanations built from fixed templates; the fallback whenever a language model
 * is absent or slow.
 */
@Component
public class TemplateExplanationGenerator implements ExplanationGenerator {

    private static final double HIGH_CONFIDENCE = 0.95d;
    private static final double MEDIUM_CONFIDENCE = 0.85d;
    private static final double HIGH_Z_SCORE = 4.0d;
    private static final double MEDIUM_Z_SCORE = 3.5d;
    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final Clock clock;

    public TemplateExplanationGenerator(Clock clock) {
        this.clock = clock;
    }

    public static RiskLevel riskLevelFor(AnomalyResult anomaly) {
        if (anomaly.confidence() >= HIGH_CONFIDENCE || anomaly.zScore() > HIGH_Z_SCORE) {
            return RiskLevel.HIGH;
        }
        if (anomaly.confidence() >= MEDIUM_CONFIDENCE || anomaly.zScore() > MEDIUM_Z_SCORE) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    @Override
    public Explanation explain(AnomalyResult anomaly, TransactionRecord transaction) {
        Objects.requireNonNull(anomaly, "anomaly");
        Facts facts = Facts.of(anomaly, transaction);
        RiskLevel riskLevel = riskLevelFor(anomaly);
        return switch (riskLevel) {
            case HIGH -> build(anomaly, riskLevel,
                    format("Significant anomaly on account %s: %s is %.1f standard deviations from its baseline and needs immediate attention",
                            facts.account(), facts.amount(), anomaly.zScore()),
                    List.of(
                            format("Amount %s far exceeds the %s of %.2f for this account",
                                    facts.amount(), facts.baselineLabel(), anomaly.statisticalData().mean()),
                            format("Statistical analysis shows a %.2f sigma deviation against a %.1f sigma threshold",
                                    anomaly.zScore(), anomaly.statisticalData().threshold()),
                            format("The amount is unusual for the %s category", facts.category()),
                            "A deviation of this size points to possible fraud or a data entry error"),
                    List.of(
                            "Verify the transaction with the account holder or originating system",
                            format("Review transactions on account %s over the past 30 days", facts.account()),
                            "Confirm the amount against source documents before the period is closed",
                            "Monitor the account for further unusual activity"));
            case MEDIUM -> build(anomaly, riskLevel,
                    format("Moderate irregularity detected in %s transaction %s", facts.category(), facts.transactionId()),
                    List.of(
                            format("Amount %s deviates from typical %s activity averaging %.2f",
                                    facts.amount(), facts.category(), anomaly.statisticalData().mean()),
                            format("Anomaly classification confidence is %.0f%%", anomaly.confidence() * 100),
                            "The value falls outside normal bounds but within a plausible range"),
                    List.of(
                            "Monitor whether the pattern continues",
                            format("Review account activity around %s", facts.date()),
                            "Check for seasonal or one-off business changes"));
            case LOW -> build(anomaly, riskLevel,
                    format("Minor deviation detected in transaction %s", facts.transactionId()),
                    List.of(
                            format("Amount differs slightly from the typical pattern (%.1f sigma)", anomaly.zScore()),
                            "Statistical significance is low"),
                    List.of(
                            "Continue monitoring",
                            "No immediate action required"));
        };
    }

    private Explanation build(
            AnomalyResult anomaly,
            RiskLevel riskLevel,
            String summary,
            List<String> reasoning,
            List<String> recommendations) {
        return new Explanation(
                anomaly.transactionId(),
                summary,
                reasoning,
                Math.max(0d, Math.min(1d, anomaly.confidence())),
                riskLevel,
                recommendations,
                clock.instant(),
                Explanation.Source.TEMPLATE);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    private record Facts(String transactionId, String account, String amount, String category, String date,
                         String baselineLabel) {

        static Facts of(AnomalyResult anomaly, TransactionRecord transaction) {
            String baselineLabel = anomaly.baseline() == AnomalyResult.Baseline.HISTORICAL ? "historical average" : "average";
            String id = anomaly.transactionId() != null ? anomaly.transactionId() : "(unknown)";
            if (transaction == null) {
                return new Facts(id, "(unknown)", "(unknown amount)", "uncategorized", "the posting date", baselineLabel);
            }
            return new Facts(
                    id,
                    transaction.accountCode().isBlank() ? "(unassigned)" : transaction.accountCode(),
                    transaction.amount().toPlainString(),
                    transaction.category().orElse("uncategorized"),
                    transaction.timestamp() != null ? DATE_FMT.format(transaction.timestamp()) : "the posting date",
                    baselineLabel);
        }
    }
}
