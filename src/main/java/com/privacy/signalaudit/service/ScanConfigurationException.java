package com.privacy.signalaudit.service;

/**
 * The scan cannot start: missing rule dataset, empty classification tables
 * or an invalid request. Raised before any browser is launched.
 */
public class ScanConfigurationException extends RuntimeException {

    public ScanConfigurationException(String message) {
        super(message);
    }
}
