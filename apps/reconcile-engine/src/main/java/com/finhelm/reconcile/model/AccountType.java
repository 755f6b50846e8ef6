package com.finhelm.reconcile.model;

import java.util.Locale;

public enum AccountType {
    BANK(Family.ASSET),
    ACCOUNTS_RECEIVABLE(Family.ASSET),
    ACCOUNTS_PAYABLE(Family.LIABILITY),
    REVENUE(Family.INCOME_STATEMENT),
    EXPENSE(Family.INCOME_STATEMENT),
    OTHER(Family.OTHER);

    public enum Family {
        ASSET,
        LIABILITY,
        INCOME_STATEMENT,
        OTHER
    }

    private final Family family;

    AccountType(Family family) {
        this.family = family;
    }

    public Family family() {
        return family;
    }

    /**
     * Two distinct types are related when they sit in the same statement family.
     * {@link #OTHER} is related to nothing.
     */
    public boolean isRelatedTo(AccountType other) {
        if (other == null || other == this) {
            return false;
        }
        return family != Family.OTHER && family == other.family;
    }

    /**
     * Parses external labels such as {@code bank} or {@code accounts_receivable}; hyphens and
     * spaces are accepted as separators. Blank or unknown labels map to {@link #OTHER}.
     */
    public static AccountType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (AccountType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
