package com.finhelm.reconcile.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

public record TransactionRecord(
        String id,
        String accountCode,
        BigDecimal amount,
        Instant timestamp,
        TransactionType type,
        Optional<String> category
) {
    public TransactionRecord {
        accountCode = accountCode == null ? "" : accountCode;
        amount = amount == null ? BigDecimal.ZERO : amount;
        type = type == null ? TransactionType.EXPENSE : type;
        category = category == null ? Optional.empty() : category.filter(value -> !value.isBlank());
    }

    public double magnitude() {
        return amount.abs().doubleValue();
    }
}
