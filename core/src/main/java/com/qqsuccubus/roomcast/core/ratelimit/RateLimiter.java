package com.qqsuccubus.roomcast.core.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * In-process rate limiter keyed by (actor, action class) and rule.
 * <p>
 * <b>Locking:</b> a rule's state is created and mutated only inside {@link ConcurrentHashMap#compute}
 * for its state key. A multi-rule check holds a lock stripe of its {@link RateLimitKey} between the
 * evaluate and commit phases, so two checks on one key never both commit past a limit.
 * </p>
 * <p>
 * <b>Clock:</b> each key remembers the latest time it observed; a check never evaluates at an
 * earlier time even if the wall clock steps back.
 * </p>
 * <p>
 * <b>Denied checks</b> do not consume quota: no timestamp is recorded, no token is spent and the
 * fixed-window counter is not incremented. They still advance the key's observed time and purge or
 * refill its state.
 * </p>
 * <p>
 * <b>Boundary:</b> both window algorithms admit at most {@code limit} events per window.
 * </p>
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final int LOCK_STRIPES = 64;

    private final Clock clock;
    private final Map<String, KeyState> states = new ConcurrentHashMap<>();
    private final Object[] stripes = new Object[LOCK_STRIPES];

    public RateLimiter(Clock clock) {
        this.clock = clock;
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new Object();
        }
    }

    /**
     * Checks one rule for a key and records the event if admitted.
     */
    public Decision check(RateLimitKey key, RateLimitRule rule) {
        return checkAll(key, List.of(rule));
    }

    /**
     * Checks every rule (even after one denies) and returns the most restrictive decision. The event
     * is recorded against every rule only when all of them admit it; a denial leaves no rule charged.
     */
    public Decision checkAll(RateLimitKey key, List<RateLimitRule> rules) {
        if (rules.isEmpty()) {
            return Decision.unlimited();
        }
        Decision combined = null;
        synchronized (stripes[Math.floorMod(key.hashCode(), stripes.length)]) {
            for (RateLimitRule rule : rules) {
                Decision decision = withState(key, rule, (state, now) -> state.evaluate(now));
                combined = combined == null ? decision : combined.mostRestrictive(decision);
            }
            if (combined.isAllowed()) {
                for (RateLimitRule rule : rules) {
                    withState(key, rule, (state, now) -> {
                        state.commit(now);
                        return null;
                    });
                }
            }
        }
        if (!combined.isAllowed()) {
            log.debug("Rate limit denied for {} (retryAfter={})", key, combined.getRetryAfter());
        }
        return combined;
    }

    private <T> T withState(RateLimitKey key, RateLimitRule rule, BiFunction<KeyState, Long, T> action) {
        List<T> result = new ArrayList<>(1);
        states.compute(key.stateKey(rule), (stateKey, existing) -> {
            KeyState state = existing != null ? existing : KeyState.create(rule);
            result.add(action.apply(state, state.observe(clock.millis())));
            return state;
        });
        return result.get(0);
    }

    /**
     * Drops states whose window or bucket has fully drained, i.e. that are indistinguishable from a
     * fresh state.
     *
     * @return number of states removed
     */
    public int evictExpired() {
        long wallNow = clock.millis();
        AtomicInteger removed = new AtomicInteger();
        for (String stateKey : states.keySet()) {
            states.computeIfPresent(stateKey, (k, state) -> {
                if (state.isDrained(state.observe(wallNow))) {
                    removed.incrementAndGet();
                    return null;
                }
                return state;
            });
        }
        if (removed.get() > 0) {
            log.debug("Evicted {} drained rate limit states, {} remaining", removed.get(), states.size());
        }
        return removed.get();
    }

    public int size() {
        return states.size();
    }

    /**
     * Mutable per-key state. Only ever touched inside a map compute block for its key.
     */
    private abstract static class KeyState {
        final RateLimitRule rule;
        final long windowMs;
        private long lastObservedMs = Long.MIN_VALUE;

        KeyState(RateLimitRule rule) {
            this.rule = rule;
            this.windowMs = rule.getWindow().toMillis();
        }

        static KeyState create(RateLimitRule rule) {
            return switch (rule.getAlgorithm()) {
                case SLIDING_WINDOW -> new SlidingWindowState(rule);
                case TOKEN_BUCKET -> new TokenBucketState(rule);
                case FIXED_WINDOW -> new FixedWindowState(rule);
            };
        }

        long observe(long clockMs) {
            lastObservedMs = Math.max(lastObservedMs, clockMs);
            return lastObservedMs;
        }

        /**
         * Decision for one more event at {@code now}, without recording it.
         */
        abstract Decision evaluate(long now);

        /**
         * Records an event at {@code now}. Only called after {@link #evaluate} admitted it.
         */
        abstract void commit(long now);

        abstract boolean isDrained(long now);
    }

    private static final class SlidingWindowState extends KeyState {
        private final Deque<Long> events = new ArrayDeque<>();

        SlidingWindowState(RateLimitRule rule) {
            super(rule);
        }

        @Override
        Decision evaluate(long now) {
            purge(now);
            int count = events.size();
            if (count < rule.getLimit()) {
                return Decision.allow(rule.getLimit() - count - 1, rule.getLimit());
            }
            long oldest = events.peekFirst();
            return Decision.deny(rule.getLimit(), Duration.ofMillis(oldest + windowMs - now));
        }

        @Override
        void commit(long now) {
            purge(now);
            events.addLast(now);
        }

        @Override
        boolean isDrained(long now) {
            purge(now);
            return events.isEmpty();
        }

        // An event at t is inside the window while t > now - window.
        private void purge(long now) {
            long cutoff = now - windowMs;
            while (!events.isEmpty() && events.peekFirst() <= cutoff) {
                events.pollFirst();
            }
        }
    }

    private static final class TokenBucketState extends KeyState {
        private double tokens;
        private long lastRefillMs = Long.MIN_VALUE;

        TokenBucketState(RateLimitRule rule) {
            super(rule);
            this.tokens = rule.getBurstLimit();
        }

        @Override
        Decision evaluate(long now) {
            refill(now);
            if (tokens >= 1) {
                return Decision.allow((int) Math.floor(tokens - 1), rule.getLimit());
            }
            long retryMs = (long) Math.ceil((1 - tokens) * windowMs / rule.getLimit());
            return Decision.deny(rule.getLimit(), Duration.ofMillis(retryMs));
        }

        @Override
        void commit(long now) {
            refill(now);
            tokens = Math.max(0, tokens - 1);
        }

        @Override
        boolean isDrained(long now) {
            refill(now);
            return tokens >= rule.getBurstLimit();
        }

        private void refill(long now) {
            if (lastRefillMs != Long.MIN_VALUE) {
                long elapsed = now - lastRefillMs;
                tokens = Math.min(rule.getBurstLimit(), tokens + (double) elapsed * rule.getLimit() / windowMs);
            }
            lastRefillMs = now;
        }
    }

    private static final class FixedWindowState extends KeyState {
        private long bucket = Long.MIN_VALUE;
        private int count;

        FixedWindowState(RateLimitRule rule) {
            super(rule);
        }

        @Override
        Decision evaluate(long now) {
            long current = roll(now);
            // count after admitting this event must stay <= limit
            if (count + 1 <= rule.getLimit()) {
                return Decision.allow(rule.getLimit() - count - 1, rule.getLimit());
            }
            return Decision.deny(rule.getLimit(), Duration.ofMillis((current + 1) * windowMs - now));
        }

        @Override
        void commit(long now) {
            roll(now);
            count++;
        }

        private long roll(long now) {
            long current = Math.floorDiv(now, windowMs);
            if (current != bucket) {
                bucket = current;
                count = 0;
            }
            return current;
        }

        @Override
        boolean isDrained(long now) {
            return Math.floorDiv(now, windowMs) != bucket;
        }
    }
}
