package com.privacy.signalaudit.engine.detectors;

import java.util.List;

final class EvidenceSamples {

    static final int URL_LIMIT = 150;

    private EvidenceSamples() {}

    static String abbreviate(String url) {
        if (url == null || url.length() <= URL_LIMIT) {
            return url;
        }
        return url.substring(0, URL_LIMIT);
    }

    static <T> List<T> first(List<T> values, int limit) {
        return values.size() <= limit ? List.copyOf(values) : List.copyOf(values.subList(0, limit));
    }
}
