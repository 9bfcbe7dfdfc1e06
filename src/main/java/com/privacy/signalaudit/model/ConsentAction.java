package com.privacy.signalaudit.model;

/**
 * Outcome of trying to click a consent "reject" control on a page.
 */
public enum ConsentAction {
    NOT_ATTEMPTED,
    REJECTED,
    NOT_FOUND
}
