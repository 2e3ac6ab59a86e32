package com.qqsuccubus.roomcast.socket.pubsub;

import com.qqsuccubus.roomcast.core.msg.Envelope;

/**
 * Receives envelopes published to a channel.
 * <p>
 * Invoked under the channel's lock, so implementations must only enqueue (never block or call back
 * into the broker).
 * </p>
 */
@FunctionalInterface
public interface Subscriber {
    void onEnvelope(Envelope envelope);
}
