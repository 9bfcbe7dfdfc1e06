package com.privacy.signalaudit.model;

/**
 * Top-level outcome of a report. Keeps "nothing found" apart from "could not tell".
 */
public enum ReportOutcome {
    VIOLATIONS_FOUND,
    NO_VIOLATIONS,
    INSUFFICIENT_DATA
}
