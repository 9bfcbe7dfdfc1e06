package com.privacy.signalaudit.model;

public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
