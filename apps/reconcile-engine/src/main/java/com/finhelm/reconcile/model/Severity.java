package com.finhelm.reconcile.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
