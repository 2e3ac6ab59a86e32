package com.qqsuccubus.roomcast.core.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private static final RateLimitKey KEY = RateLimitKey.of("wallet-a", "chat_message");

    private MutableClock clock;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        limiter = new RateLimiter(clock);
    }

    @Test
    @DisplayName("Sliding window: 5 in the same second pass, the 6th is denied with retry_after <= 60s")
    void testSlidingWindowScenario() {
        RateLimitRule rule = RateLimitRule.slidingWindow(5, Duration.ofSeconds(60));

        for (int i = 0; i < 5; i++) {
            Decision decision = limiter.check(KEY, rule);
            assertTrue(decision.isAllowed(), "check " + i + " should pass");
            assertEquals(4 - i, decision.getRemaining());
            clock.advance(Duration.ofMillis(100));
        }

        Decision denied = limiter.check(KEY, rule);
        assertFalse(denied.isAllowed());
        assertEquals(0, denied.getRemaining());
        assertNotNull(denied.getRetryAfter());
        assertTrue(denied.getRetryAfter().compareTo(Duration.ofSeconds(60)) <= 0);
        assertEquals(Duration.ofMillis(60_000 - 500), denied.getRetryAfter());
    }

    @Test
    @DisplayName("Sliding window never admits more than L events in any W span")
    void testSlidingWindowPropertyUnderRandomArrivals() {
        int limit = 7;
        long windowMs = 10_000;
        RateLimitRule rule = RateLimitRule.slidingWindow(limit, Duration.ofMillis(windowMs));
        Random random = new Random(42);
        Deque<Long> admitted = new ArrayDeque<>();

        for (int i = 0; i < 2_000; i++) {
            clock.advance(Duration.ofMillis(random.nextInt(900)));
            long now = clock.millis();
            if (limiter.check(KEY, rule).isAllowed()) {
                admitted.addLast(now);
            }
            while (!admitted.isEmpty() && admitted.peekFirst() <= now - windowMs) {
                admitted.pollFirst();
            }
            assertTrue(admitted.size() <= limit, "window at " + now + " admitted " + admitted.size());
        }
    }

    @Test
    @DisplayName("Sliding window frees a slot once the oldest event leaves the window")
    void testSlidingWindowRecovery() {
        RateLimitRule rule = RateLimitRule.slidingWindow(2, Duration.ofSeconds(10));

        assertTrue(limiter.check(KEY, rule).isAllowed());
        clock.advance(Duration.ofSeconds(4));
        assertTrue(limiter.check(KEY, rule).isAllowed());

        Decision denied = limiter.check(KEY, rule);
        assertFalse(denied.isAllowed());
        assertEquals(Duration.ofSeconds(6), denied.getRetryAfter());

        clock.advance(Duration.ofSeconds(6));
        assertTrue(limiter.check(KEY, rule).isAllowed());
        assertFalse(limiter.check(KEY, rule).isAllowed());
    }

    @Test
    @DisplayName("Denied checks do not consume quota")
    void testDeniedChecksDoNotConsume() {
        RateLimitRule rule = RateLimitRule.slidingWindow(3, Duration.ofSeconds(10));

        // Given: quota exhausted at t0
        for (int i = 0; i < 3; i++) {
            assertTrue(limiter.check(KEY, rule).isAllowed());
        }

        // When: the client keeps hammering for the rest of the window
        for (int i = 0; i < 9; i++) {
            clock.advance(Duration.ofSeconds(1));
            assertFalse(limiter.check(KEY, rule).isAllowed());
        }

        // Then: as soon as the admitted events age out, the full quota is back
        clock.advance(Duration.ofSeconds(1));
        for (int i = 0; i < 3; i++) {
            assertTrue(limiter.check(KEY, rule).isAllowed(), "check " + i + " after recovery");
        }
    }

    @Test
    @DisplayName("Token bucket: burst passes, next fails, one more after window/limit")
    void testTokenBucketBurstAndRefill() {
        RateLimitRule rule = RateLimitRule.tokenBucket(6, Duration.ofSeconds(60), 4);

        for (int i = 0; i < 4; i++) {
            assertTrue(limiter.check(KEY, rule).isAllowed(), "burst check " + i);
        }
        Decision denied = limiter.check(KEY, rule);
        assertFalse(denied.isAllowed());
        assertEquals(Duration.ofSeconds(10), denied.getRetryAfter());

        // window/limit = 10s refills exactly one token
        clock.advance(Duration.ofSeconds(10));
        assertTrue(limiter.check(KEY, rule).isAllowed());
        assertFalse(limiter.check(KEY, rule).isAllowed());
    }

    @Test
    @DisplayName("Token bucket never exceeds its burst capacity")
    void testTokenBucketCapped() {
        RateLimitRule rule = RateLimitRule.tokenBucket(10, Duration.ofSeconds(10), 3);

        assertTrue(limiter.check(KEY, rule).isAllowed());
        clock.advance(Duration.ofHours(1));

        int allowed = 0;
        for (int i = 0; i < 10; i++) {
            if (limiter.check(KEY, rule).isAllowed()) {
                allowed++;
            }
        }
        assertEquals(3, allowed);
    }

    @Test
    @DisplayName("Fixed window admits exactly limit events per bucket")
    void testFixedWindowBoundary() {
        RateLimitRule rule = RateLimitRule.perMinute(3);
        clock.set(1_700_000_020_000L); // 40s into a minute bucket

        assertTrue(limiter.check(KEY, rule).isAllowed());
        assertTrue(limiter.check(KEY, rule).isAllowed());
        Decision last = limiter.check(KEY, rule);
        assertTrue(last.isAllowed());
        assertEquals(0, last.getRemaining());

        Decision denied = limiter.check(KEY, rule);
        assertFalse(denied.isAllowed());
        assertEquals(Duration.ofSeconds(20), denied.getRetryAfter());

        // next calendar minute resets the counter
        clock.advance(Duration.ofSeconds(20));
        assertTrue(limiter.check(KEY, rule).isAllowed());
    }

    @Test
    @DisplayName("checkAll evaluates every rule and returns the most restrictive decision")
    void testCheckAllMostRestrictive() {
        RateLimitRule loose = RateLimitRule.slidingWindow(100, Duration.ofSeconds(60));
        RateLimitRule tight = RateLimitRule.fixedWindow(2, Duration.ofSeconds(60));
        List<RateLimitRule> rules = List.of(loose, tight);

        Decision first = limiter.checkAll(KEY, rules);
        assertTrue(first.isAllowed());
        assertEquals(1, first.getRemaining());

        limiter.checkAll(KEY, rules);
        Decision denied = limiter.checkAll(KEY, rules);
        assertFalse(denied.isAllowed());
        assertNotNull(denied.getRetryAfter());

        // the loose rule was charged for the two admitted calls only
        assertEquals(97, limiter.check(KEY, loose).getRemaining());
    }

    @Test
    @DisplayName("A burst denied by the token bucket leaves the sliding window uncharged")
    void testCheckAllDeniedChargesNoRule() {
        // Given: default chat rules, sliding 30/60s plus token bucket with burst 10
        List<RateLimitRule> rules = RateLimitPolicy.defaults().rulesFor(ActionClass.CHAT_MESSAGE);

        // When: 30 messages in the same instant
        int allowed = 0;
        for (int i = 0; i < 30; i++) {
            if (limiter.checkAll(KEY, rules).isAllowed()) {
                allowed++;
            }
        }

        // Then: only the burst passes, and one refilled token admits the next message
        assertEquals(10, allowed);
        clock.advance(Duration.ofSeconds(2));
        Decision next = limiter.checkAll(KEY, rules);
        assertTrue(next.isAllowed(), "denied checks must not fill the sliding window");

        // the sliding window holds exactly the 11 admitted events
        RateLimitRule sliding = rules.get(0);
        assertEquals(30 - 11 - 1, limiter.check(KEY, sliding).getRemaining());
    }

    @Test
    @DisplayName("checkAll with no rules is unlimited")
    void testCheckAllNoRules() {
        assertTrue(limiter.checkAll(KEY, List.of()).isAllowed());
    }

    @Test
    @DisplayName("A clock stepping backwards never rewinds a key's observed time")
    void testMonotonicObservedTime() {
        RateLimitRule rule = RateLimitRule.slidingWindow(2, Duration.ofSeconds(10));

        assertTrue(limiter.check(KEY, rule).isAllowed());
        clock.advance(Duration.ofSeconds(9));
        assertTrue(limiter.check(KEY, rule).isAllowed());

        // Clock jumps back 1h: events must not become "future" and escape purging
        clock.advance(Duration.ofHours(-1));
        Decision denied = limiter.check(KEY, rule);
        assertFalse(denied.isAllowed());
        assertEquals(Duration.ofSeconds(1), denied.getRetryAfter());
    }

    @Test
    @DisplayName("Keys are isolated by actor and action")
    void testKeyIsolation() {
        RateLimitRule rule = RateLimitRule.slidingWindow(1, Duration.ofSeconds(60));

        assertTrue(limiter.check(KEY, rule).isAllowed());
        assertFalse(limiter.check(KEY, rule).isAllowed());
        assertTrue(limiter.check(RateLimitKey.of("wallet-b", "chat_message"), rule).isAllowed());
        assertTrue(limiter.check(RateLimitKey.of("wallet-a", "query"), rule).isAllowed());
    }

    @Test
    @DisplayName("evictExpired drops only fully drained states")
    void testEvictExpired() {
        RateLimitRule sliding = RateLimitRule.slidingWindow(5, Duration.ofSeconds(10));
        RateLimitRule bucket = RateLimitRule.tokenBucket(1, Duration.ofSeconds(10), 10);
        RateLimitRule fixed = RateLimitRule.fixedWindow(5, Duration.ofSeconds(60));
        clock.set(1_700_000_000_000L);

        limiter.check(KEY, sliding);
        limiter.check(KEY, bucket);
        limiter.check(KEY, fixed);
        assertEquals(3, limiter.size());

        clock.advance(Duration.ofSeconds(5));
        assertEquals(0, limiter.evictExpired());

        // sliding window empty and bucket refilled after 10s; fixed minute bucket still current
        clock.advance(Duration.ofSeconds(6));
        assertEquals(2, limiter.evictExpired());
        assertEquals(1, limiter.size());

        clock.advance(Duration.ofSeconds(60));
        assertEquals(1, limiter.evictExpired());
        assertEquals(0, limiter.size());
    }
}
