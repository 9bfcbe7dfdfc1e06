package com.privacy.signalaudit.session;

import java.time.Duration;

/**
 * One isolated browsing context: own cookies, storage and cache.
 * Used by a single thread; pages are visited one at a time.
 */
public interface BrowsingSession extends AutoCloseable {

    /**
     * Navigate to the URL, let the page settle and inspect it.
     *
     * @throws NavigationException the page failed to load within the timeout
     * @throws BrowserException    the context died; no further visits are possible
     */
    PageObservation visit(String url, Duration timeout) throws NavigationException;

    @Override
    void close();
}
