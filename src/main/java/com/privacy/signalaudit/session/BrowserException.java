package com.privacy.signalaudit.session;

/**
 * The browser or its context could not be started or crashed. Fatal for the session.
 */
public class BrowserException extends RuntimeException {

    public BrowserException(String message) {
        super(message);
    }

    public BrowserException(String message, Throwable cause) {
        super(message, cause);
    }
}
