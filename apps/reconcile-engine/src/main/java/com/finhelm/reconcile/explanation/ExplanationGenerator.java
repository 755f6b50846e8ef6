package com.finhelm.reconcile.explanation;

import com.finhelm.reconcile.model.AnomalyResult;
import com.finhelm.reconcile.model.Explanation;
import com.finhelm.reconcile.model.TransactionRecord;
import java.time.Duration;

/**
 * Turns a scored transaction into a reader-facing explanation.
 * Implementations must not throw for well-formed input and must return quickly.
 */
public interface ExplanationGenerator {

    Explanation explain(AnomalyResult anomaly, TransactionRecord transaction);

    /**
     * Explains within {@code budget}. Generators that wait on another process must return their
     * deterministic answer once the budget is spent; local generators may ignore it.
     */
    default Explanation explain(AnomalyResult anomaly, TransactionRecord transaction, Duration budget) {
        return explain(anomaly, transaction);
    }
}
