package com.privacy.signalaudit.session;

/**
 * Receives every outbound request issued by a browsing session.
 */
@FunctionalInterface
public interface RequestListener {

    void onRequest(String url, String method, String resourceType);
}
