package com.qqsuccubus.roomcast.core.ratelimit;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * One limit: an algorithm, a limit, a window, and for token buckets a burst capacity.
 * <p>
 * Token buckets refill at {@code limit / window} tokens per second and hold at most
 * {@code burstLimit} tokens (defaults to {@code limit}).
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class RateLimitRule {
    RateLimitAlgorithm algorithm;
    int limit;
    Duration window;
    int burstLimit;

    public RateLimitRule(RateLimitAlgorithm algorithm, int limit, Duration window, int burstLimit) {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm must be set");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (window == null || window.toMillis() <= 0) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.algorithm = algorithm;
        this.limit = limit;
        this.window = window;
        this.burstLimit = burstLimit > 0 ? burstLimit : limit;
    }

    public static RateLimitRule slidingWindow(int limit, Duration window) {
        return new RateLimitRule(RateLimitAlgorithm.SLIDING_WINDOW, limit, window, limit);
    }

    public static RateLimitRule tokenBucket(int limit, Duration window, int burstLimit) {
        return new RateLimitRule(RateLimitAlgorithm.TOKEN_BUCKET, limit, window, burstLimit);
    }

    public static RateLimitRule fixedWindow(int limit, Duration window) {
        return new RateLimitRule(RateLimitAlgorithm.FIXED_WINDOW, limit, window, limit);
    }

    public static RateLimitRule perSecond(int limit) {
        return fixedWindow(limit, Duration.ofSeconds(1));
    }

    public static RateLimitRule perMinute(int limit) {
        return fixedWindow(limit, Duration.ofMinutes(1));
    }

    public static RateLimitRule perHour(int limit) {
        return fixedWindow(limit, Duration.ofHours(1));
    }

    public static RateLimitRule perDay(int limit) {
        return fixedWindow(limit, Duration.ofDays(1));
    }

    /**
     * Parses {@code <limit>/<seconds>s/<algorithm>[/<burst>]}, e.g. {@code 30/60s/sliding_window}
     * or {@code 20/60s/token_bucket/50}.
     */
    public static RateLimitRule parse(String text) {
        String[] parts = text.trim().split("/");
        if (parts.length < 3 || parts.length > 4) {
            throw new IllegalArgumentException("Malformed rate limit rule: " + text);
        }
        try {
            int limit = Integer.parseInt(parts[0].trim());
            String windowPart = parts[1].trim();
            if (windowPart.endsWith("s")) {
                windowPart = windowPart.substring(0, windowPart.length() - 1);
            }
            Duration window = Duration.ofSeconds(Long.parseLong(windowPart));
            RateLimitAlgorithm algorithm = RateLimitAlgorithm.fromString(parts[2]);
            int burst = parts.length == 4 ? Integer.parseInt(parts[3].trim()) : limit;
            return new RateLimitRule(algorithm, limit, window, burst);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed rate limit rule: " + text, e);
        }
    }

    /**
     * Stable identifier used to scope per-key state to this rule.
     */
    public String id() {
        String base = algorithm.name().toLowerCase() + ":" + limit + "/" + window.toMillis();
        return algorithm == RateLimitAlgorithm.TOKEN_BUCKET ? base + "/" + burstLimit : base;
    }
}
