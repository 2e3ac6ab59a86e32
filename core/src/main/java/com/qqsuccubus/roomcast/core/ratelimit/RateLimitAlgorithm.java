package com.qqsuccubus.roomcast.core.ratelimit;

/**
 * Windowing strategies supported by {@link RateLimiter}.
 */
public enum RateLimitAlgorithm {
    /**
     * Timestamps of admitted events within the trailing window.
     */
    SLIDING_WINDOW,

    /**
     * Continuously refilled bucket of up to {@code burstLimit} tokens.
     */
    TOKEN_BUCKET,

    /**
     * Counter per epoch-aligned window bucket.
     */
    FIXED_WINDOW;

    public static RateLimitAlgorithm fromString(String value) {
        return switch (value.trim().toLowerCase()) {
            case "sliding_window", "sliding" -> SLIDING_WINDOW;
            case "token_bucket", "bucket" -> TOKEN_BUCKET;
            case "fixed_window", "fixed" -> FIXED_WINDOW;
            default -> throw new IllegalArgumentException("Unknown rate limit algorithm: " + value);
        };
    }
}
