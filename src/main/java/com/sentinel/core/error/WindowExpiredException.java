package com.sentinel.core.error;

import java.time.Instant;

/**
 * Thrown when a change is executed outside its approved window.
 */
public class WindowExpiredException extends GovernanceException {

    private final Instant windowStart;
    private final Instant windowEnd;
    private final Instant attemptedAt;

    public WindowExpiredException(String message, Instant windowStart, Instant windowEnd, Instant attemptedAt) {
        super(message);
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.attemptedAt = attemptedAt;
    }

    public Instant windowStart() {
        return windowStart;
    }

    public Instant windowEnd() {
        return windowEnd;
    }

    public Instant attemptedAt() {
        return attemptedAt;
    }
}
