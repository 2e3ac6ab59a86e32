package com.qqsuccubus.roomcast.core.msg;

/**
 * Broadcast scope kinds. The string prefix is the channel key namespace.
 */
public enum ChannelKind {
    /**
     * Room channel, named by room id.
     */
    ROOM("room"),

    /**
     * Attribute-gated channel, named by its sorted required attribute set.
     */
    GATED("gated"),

    /**
     * One-to-one delivery to every connection of a single wallet.
     */
    DIRECT("direct"),

    /**
     * Presence notifications (online/offline).
     */
    STATUS("status");

    private final String prefix;

    ChannelKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public static ChannelKind fromPrefix(String prefix) {
        for (ChannelKind kind : values()) {
            if (kind.prefix.equals(prefix)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown channel kind: " + prefix);
    }
}
