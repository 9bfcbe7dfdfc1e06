package com.privacy.signalaudit.session;

import com.privacy.signalaudit.model.SignalConfig;

/**
 * Opens browsing sessions that assert a given privacy signal.
 */
public interface BrowserEngine {

    /**
     * Open a fresh context. Headers of the config apply to every request and
     * its scripts run before any page script, for this context only.
     * Every outbound request is reported to the listener.
     *
     * @throws BrowserException the browser could not be launched
     */
    BrowsingSession open(SignalConfig config, RequestListener listener);
}
