package com.finhelm.reconcile.model;

public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    INCOME,
    EXPENSE
}
