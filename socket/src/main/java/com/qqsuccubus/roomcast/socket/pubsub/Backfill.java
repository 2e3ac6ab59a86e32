package com.qqsuccubus.roomcast.socket.pubsub;

import com.qqsuccubus.roomcast.core.msg.Envelope;
import lombok.Value;

import java.util.List;

/**
 * Result of {@link PubSubBroker#subscribeWithRecent}: the new subscription plus the envelopes that
 * were buffered at the moment it was registered.
 */
@Value
public class Backfill {
    Subscription subscription;
    List<Envelope> recent;
}
