package com.privacy.signalaudit.model;

public enum EventLevel {
    INFO,
    WARNING,
    ERROR,
    SUCCESS
}
