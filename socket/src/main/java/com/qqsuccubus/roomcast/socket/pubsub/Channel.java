package com.qqsuccubus.roomcast.socket.pubsub;

import com.qqsuccubus.roomcast.core.msg.ChannelId;
import com.qqsuccubus.roomcast.core.msg.Envelope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Subscribers and recent-envelope ring buffer of one channel.
 * <p>
 * Every field is guarded by the channel's own monitor.
 * </p>
 */
final class Channel {
    final ChannelId id;
    final int capacity;
    final List<Subscription> subscribers = new ArrayList<>();
    final Deque<Envelope> recent;

    /**
     * Set once the store history has been loaded (or found empty).
     */
    boolean seeded;

    /**
     * Set when the channel was evicted; holders of a stale reference must look it up again.
     */
    boolean retired;

    long lastActivityMs;

    Channel(ChannelId id, int capacity, long nowMs) {
        this.id = id;
        this.capacity = capacity;
        this.recent = new ArrayDeque<>(capacity);
        this.lastActivityMs = nowMs;
    }

    void append(Envelope envelope) {
        if (recent.size() == capacity) {
            recent.pollFirst();
        }
        recent.addLast(envelope);
    }

    List<Envelope> tail(int limit) {
        int n = Math.min(Math.max(limit, 0), recent.size());
        List<Envelope> result = new ArrayList<>(n);
        int skip = recent.size() - n;
        for (Envelope envelope : recent) {
            if (skip > 0) {
                skip--;
                continue;
            }
            result.add(envelope);
        }
        return result;
    }
}
