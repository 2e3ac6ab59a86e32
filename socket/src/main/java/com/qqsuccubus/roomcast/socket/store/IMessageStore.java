package com.qqsuccubus.roomcast.socket.store;

import com.qqsuccubus.roomcast.core.msg.ChannelId;
import com.qqsuccubus.roomcast.core.msg.Envelope;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable message history.
 */
public interface IMessageStore {

    /**
     * Stores a message and returns its canonical envelope (store-assigned id and timestamp).
     */
    Mono<Envelope> persist(ChannelId channel, String from, String payloadJson);

    /**
     * Up to {@code limit} most recent messages of a channel, oldest first.
     */
    Flux<Envelope> recentHistory(ChannelId channel, int limit);
}
