package com.qqsuccubus.roomcast.core.ratelimit;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Rules applied per {@link ActionClass}. Immutable once built.
 */
public final class RateLimitPolicy {
    private final Map<ActionClass, List<RateLimitRule>> rules;

    private RateLimitPolicy(Map<ActionClass, List<RateLimitRule>> rules) {
        this.rules = rules;
    }

    public static RateLimitPolicy defaults() {
        Map<ActionClass, List<RateLimitRule>> rules = new EnumMap<>(ActionClass.class);
        rules.put(ActionClass.CHAT_MESSAGE, List.of(
            RateLimitRule.slidingWindow(30, Duration.ofSeconds(60)),
            RateLimitRule.tokenBucket(30, Duration.ofSeconds(60), 10)
        ));
        rules.put(ActionClass.PRIVATE_MESSAGE, List.of(RateLimitRule.slidingWindow(10, Duration.ofSeconds(60))));
        rules.put(ActionClass.JOIN_CHANNEL, List.of(RateLimitRule.slidingWindow(20, Duration.ofSeconds(60))));
        rules.put(ActionClass.QUERY, List.of(RateLimitRule.slidingWindow(60, Duration.ofSeconds(60))));
        rules.put(ActionClass.HEARTBEAT, List.of(RateLimitRule.slidingWindow(12, Duration.ofSeconds(60))));
        rules.put(ActionClass.GENERIC, List.of(RateLimitRule.slidingWindow(20, Duration.ofSeconds(60))));
        rules.put(ActionClass.AUTH, List.of(RateLimitRule.slidingWindow(10, Duration.ofSeconds(60))));
        return new RateLimitPolicy(rules);
    }

    /**
     * Defaults overridden by {@code RATE_LIMIT_<ACTION>} variables. A variable holds one or more
     * rules separated by {@code ;}, each in {@link RateLimitRule#parse} format.
     */
    public static RateLimitPolicy fromEnv(Function<String, String> env) {
        RateLimitPolicy policy = defaults();
        for (ActionClass action : ActionClass.values()) {
            String value = env.apply(action.envName());
            if (value == null || value.isBlank()) {
                continue;
            }
            List<RateLimitRule> parsed = new ArrayList<>();
            for (String part : value.split(";")) {
                if (!part.isBlank()) {
                    parsed.add(RateLimitRule.parse(part));
                }
            }
            policy = policy.with(action, parsed);
        }
        return policy;
    }

    /**
     * Copy with the rules of one action replaced. An empty list leaves the action unlimited.
     */
    public RateLimitPolicy with(ActionClass action, List<RateLimitRule> actionRules) {
        Map<ActionClass, List<RateLimitRule>> copy = new EnumMap<>(ActionClass.class);
        copy.putAll(rules);
        copy.put(action, List.copyOf(actionRules));
        return new RateLimitPolicy(copy);
    }

    public List<RateLimitRule> rulesFor(ActionClass action) {
        return rules.getOrDefault(action, Collections.emptyList());
    }

    @Override
    public String toString() {
        return "RateLimitPolicy" + rules;
    }
}
