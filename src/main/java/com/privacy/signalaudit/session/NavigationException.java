package com.privacy.signalaudit.session;

/**
 * A single navigation failed or timed out. The session stays usable.
 */
public class NavigationException extends Exception {

    private final boolean timeout;

    public NavigationException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
