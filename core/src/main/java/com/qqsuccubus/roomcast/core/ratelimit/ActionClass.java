package com.qqsuccubus.roomcast.core.ratelimit;

/**
 * Classes of client actions that are rate-limited independently.
 */
public enum ActionClass {
    CHAT_MESSAGE("chat_message"),
    PRIVATE_MESSAGE("private_message"),
    JOIN_CHANNEL("join_channel"),
    QUERY("query"),
    HEARTBEAT("heartbeat"),
    /**
     * Unknown or malformed frames.
     */
    GENERIC("generic"),
    /**
     * Frames received before authentication, keyed by connection id.
     */
    AUTH("auth");

    private final String key;

    ActionClass(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Environment variable that overrides this action's rules, e.g. {@code RATE_LIMIT_CHAT_MESSAGE}.
     */
    public String envName() {
        return "RATE_LIMIT_" + name();
    }
}
