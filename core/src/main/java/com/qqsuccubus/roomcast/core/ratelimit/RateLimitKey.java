package com.qqsuccubus.roomcast.core.ratelimit;

import lombok.Value;

/**
 * Actor identity plus action class, e.g. {@code (7xKX…, chat_message)}.
 */
@Value
public class RateLimitKey {
    String actorId;
    String action;

    public static RateLimitKey of(String actorId, String action) {
        return new RateLimitKey(actorId, action);
    }

    /**
     * State key for one rule: {@code rl:{actor}:{action}:{ruleId}}.
     */
    public String stateKey(RateLimitRule rule) {
        return "rl:" + actorId + ":" + action + ":" + rule.id();
    }
}
