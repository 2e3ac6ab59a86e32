package com.qqsuccubus.roomcast.socket.ws;

import com.qqsuccubus.roomcast.socket.config.SocketConfig;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * {@link Transport} over a Reactor Netty WebSocket.
 * <p>
 * Pings the peer after {@code PING_INTERVAL} seconds without writes and closes the socket after
 * {@code IDLE_TIMEOUT} seconds without reads.
 * </p>
 */
public class WebSocketTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private final WebsocketInbound inbound;
    private final WebsocketOutbound outbound;

    public WebSocketTransport(WebsocketInbound inbound, WebsocketOutbound outbound, SocketConfig config) {
        this.inbound = inbound;
        this.outbound = outbound;

        inbound.withConnection(connection -> {
            long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
            long pingTimeoutInMillis = config.getPingInterval() * 1000L;

            connection.onWriteIdle(pingTimeoutInMillis, () -> connection.outbound()
                    .sendObject(Mono.just(new PingWebSocketFrame()))
                    .then()
                    .subscribe())
                .onReadIdle(idleTimeoutInMillis, () -> {
                    log.debug("No reads for {}ms, closing {}", idleTimeoutInMillis, connection.channel().id());
                    outbound.sendClose().subscribe();
                });
        });
    }

    @Override
    public Flux<String> receive() {
        return inbound.aggregateFrames()
            .receive()
            .asString();
    }

    @Override
    public Mono<Void> send(Publisher<String> frames) {
        return outbound.sendString(frames).then();
    }

    @Override
    public Mono<Void> close(int code, String reason) {
        return outbound.sendClose(code, reason);
    }
}
