package com.qqsuccubus.roomcast.core.ratelimit;

import lombok.Value;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Outcome of a rate-limit check.
 */
@Value
public class Decision {
    private static final Decision UNLIMITED = new Decision(true, Integer.MAX_VALUE, Integer.MAX_VALUE, null);

    boolean allowed;

    /**
     * Events still admissible in the current window (tokens left for buckets).
     */
    int remaining;

    int limit;

    /**
     * Time until the next event would be admitted; only set on denial.
     */
    @Nullable
    Duration retryAfter;

    public static Decision allow(int remaining, int limit) {
        return new Decision(true, remaining, limit, null);
    }

    public static Decision deny(int limit, Duration retryAfter) {
        return new Decision(false, 0, limit, retryAfter);
    }

    /**
     * Decision for an action with no rules configured.
     */
    public static Decision unlimited() {
        return UNLIMITED;
    }

    /**
     * Combines two decisions: any denial wins, the smaller {@code remaining} wins, and among denials
     * the longer {@code retryAfter} wins.
     */
    public Decision mostRestrictive(Decision other) {
        boolean combinedAllowed = allowed && other.allowed;
        Decision tighter = other.remaining < remaining ? other : this;
        Duration combinedRetry = longer(retryAfter, other.retryAfter);
        return new Decision(combinedAllowed, tighter.remaining, tighter.limit, combinedAllowed ? null : combinedRetry);
    }

    private static Duration longer(Duration a, Duration b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }
}
