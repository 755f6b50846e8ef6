package com.finhelm.reconcile.analytics;

import com.finhelm.reconcile.config.InvalidConfigurationException;
import com.finhelm.reconcile.matching.AccountCodeNormalizer;
import com.finhelm.reconcile.model.AccountRecord;
import com.finhelm.reconcile.model.AccountType;
import com.finhelm.reconcile.model.AnomalyResult;
import com.finhelm.reconcile.model.SubledgerAnalysis;
import com.finhelm.reconcile.model.TransactionRecord;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

@Component
public class SubledgerAnalyzer {

    static final String UNCATEGORIZED = "uncategorized";

    private final OutlierDetector outlierDetector;

    public SubledgerAnalyzer(OutlierDetector outlierDetector) {
        this.outlierDetector = outlierDetector;
    }

    public List<SubledgerAnalysis> analyzeSubledger(List<TransactionRecord> transactions, List<AccountRecord> accounts) {
        return analyzeSubledger(transactions, accounts, DetectionSettings.DEFAULT);
    }

    public List<SubledgerAnalysis> analyzeSubledger(
            List<TransactionRecord> transactions,
            List<AccountRecord> accounts,
            DetectionSettings settings) {
        if (settings == null) {
            throw new InvalidConfigurationException("detection settings must be provided");
        }
        if (transactions == null || transactions.isEmpty() || accounts == null || accounts.isEmpty()) {
            return List.of();
        }
        Map<String, AccountRecord> accountsByCode = new LinkedHashMap<>();
        for (AccountRecord account : accounts) {
            if (account != null) {
                accountsByCode.putIfAbsent(AccountCodeNormalizer.normalize(account.code()), account);
            }
        }

        Map<GroupKey, List<TransactionRecord>> groups = new LinkedHashMap<>();
        for (TransactionRecord tx : transactions) {
            if (tx == null) {
                continue;
            }
            AccountRecord account = accountsByCode.get(AccountCodeNormalizer.normalize(tx.accountCode()));
            if (account == null) {
                continue;
            }
            GroupKey key = new GroupKey(tx.category().map(String::trim).orElse(UNCATEGORIZED), account.type());
            groups.computeIfAbsent(key, ignored -> new ArrayList<>()).add(tx);
        }

        List<SubledgerAnalysis> analyses = new ArrayList<>(groups.size());
        groups.forEach((key, members) -> {
            double averageAmount = members.stream()
                    .mapToDouble(TransactionRecord::magnitude)
                    .average()
                    .orElse(0d);
            List<AnomalyResult> anomalies = outlierDetector.detectOutliers(members, tx -> key.label(), Map.of(), settings);
            analyses.add(new SubledgerAnalysis(
                    key.category(),
                    key.accountType(),
                    new SubledgerAnalysis.Patterns(averageAmount, members.size(), seasonality(members)),
                    anomalies));
        });
        return List.copyOf(analyses);
    }

    /**
     * Coefficient of variation of monthly magnitude totals, clamped to [0,1]. A group spanning a
     * single month has no measurable seasonality.
     */
    static double seasonality(List<TransactionRecord> members) {
        Map<YearMonth, Double> totals = new TreeMap<>();
        for (TransactionRecord tx : members) {
            if (tx.timestamp() == null) {
                continue;
            }
            totals.merge(YearMonth.from(tx.timestamp().atZone(ZoneOffset.UTC)), tx.magnitude(), Double::sum);
        }
        if (totals.size() < 2) {
            return 0d;
        }
        double mean = totals.values().stream().mapToDouble(Double::doubleValue).average().orElse(0d);
        if (mean <= 0d) {
            return 0d;
        }
        double variance = totals.values().stream()
                .mapToDouble(value -> Math.pow(value - mean, 2))
                .average()
                .orElse(0d);
        return Math.max(0d, Math.min(1d, Math.sqrt(variance) / mean));
    }

    private record GroupKey(String category, AccountType accountType) {
        String label() {
            return category + "/" + accountType.name().toLowerCase(Locale.ROOT);
        }
    }
}
