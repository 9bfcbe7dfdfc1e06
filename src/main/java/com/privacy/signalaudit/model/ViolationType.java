package com.privacy.signalaudit.model;

public enum ViolationType {
    SIGNAL_NOT_HONORED,
    TEMPORAL_LEAK,
    MISSING_OPT_OUT_LINK,
    MISSING_CONSENT_BANNER,
    PII_IN_TRACKING_REQUEST
}
