package com.qqsuccubus.roomcast.core.redis;

import com.qqsuccubus.roomcast.core.msg.ChannelId;

/**
 * Redis keyspace used by the optional Redis-backed stores.
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Presence hash: {@code presence}
     * <p>
     * <b>Type:</b> Hash, field = wallet address, value = last heartbeat (epoch millis).
     * </p>
     */
    public static String presence() {
        return "presence";
    }

    /**
     * Message history for a channel: {@code hist:{channel}}
     * <p>
     * <b>Type:</b> Stream (XADD with MAXLEN ~ N); the stream entry id is the message id.
     * <br>
     * <b>Fields:</b> {@code from}, {@code payload}, {@code ts}
     * </p>
     *
     * @param channel channel the history belongs to
     * @return Redis key
     */
    public static String history(ChannelId channel) {
        return "hist:" + channel.key();
    }
}
