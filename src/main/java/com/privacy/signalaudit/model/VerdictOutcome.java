package com.privacy.signalaudit.model;

public enum VerdictOutcome {
    COMPLIANT,
    NON_COMPLIANT,
    INSUFFICIENT_DATA
}
