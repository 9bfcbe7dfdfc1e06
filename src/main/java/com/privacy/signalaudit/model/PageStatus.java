package com.privacy.signalaudit.model;

public enum PageStatus {
    LOADED,
    FAILED
}
