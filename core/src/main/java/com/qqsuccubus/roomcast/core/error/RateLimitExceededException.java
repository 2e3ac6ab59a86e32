package com.qqsuccubus.roomcast.core.error;

import lombok.Getter;

import java.time.Duration;

/**
 * Action denied by the rate limiter; the underlying side effect was not performed.
 */
@Getter
public class RateLimitExceededException extends RoomcastException {
    private final String action;
    private final Duration retryAfter;

    public RateLimitExceededException(String action, Duration retryAfter) {
        super(ErrorCode.RATE_LIMITED, "Rate limit exceeded for " + action);
        this.action = action;
        this.retryAfter = retryAfter;
    }

    /**
     * Retry hint rounded up to whole seconds, never below one.
     */
    public long getRetryAfterSeconds() {
        if (retryAfter == null) {
            return 1;
        }
        long millis = retryAfter.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
