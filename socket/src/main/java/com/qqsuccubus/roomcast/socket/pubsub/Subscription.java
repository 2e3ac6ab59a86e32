package com.qqsuccubus.roomcast.socket.pubsub;

import com.qqsuccubus.roomcast.core.msg.ChannelId;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned by {@link PubSubBroker#subscribe}; pass it to {@link PubSubBroker#unsubscribe}.
 */
public final class Subscription {
    @Getter
    private final ChannelId channelId;
    @Getter
    private final Subscriber subscriber;

    final Channel channel;
    final AtomicBoolean active = new AtomicBoolean(true);

    Subscription(Channel channel, Subscriber subscriber) {
        this.channel = channel;
        this.channelId = channel.id;
        this.subscriber = subscriber;
    }

    public boolean isActive() {
        return active.get();
    }

    @Override
    public String toString() {
        return "Subscription{" + channelId + ", active=" + active.get() + "}";
    }
}
