package com.qqsuccubus.roomcast.socket.ws;

import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Bidirectional text-frame channel of one client connection.
 */
public interface Transport {

    /**
     * Inbound text frames; completes when the peer closes.
     */
    Flux<String> receive();

    /**
     * Writes every frame of {@code frames} in order; completes when {@code frames} completes.
     */
    Mono<Void> send(Publisher<String> frames);

    /**
     * Sends a close frame with the given status code.
     */
    Mono<Void> close(int code, String reason);
}
