package com.privacy.signalaudit.session;

import java.util.function.LongSupplier;

/**
 * Session-local monotonic millisecond clock. Readings are only comparable
 * within the session that owns the clock.
 */
public final class SessionClock {

    private final LongSupplier millis;

    private SessionClock(LongSupplier millis) {
        this.millis = millis;
    }

    public static SessionClock monotonic() {
        long origin = System.nanoTime();
        return new SessionClock(() -> (System.nanoTime() - origin) / 1_000_000L);
    }

    public static SessionClock of(LongSupplier millis) {
        return new SessionClock(millis);
    }

    public long nowMs() {
        return millis.getAsLong();
    }
}
