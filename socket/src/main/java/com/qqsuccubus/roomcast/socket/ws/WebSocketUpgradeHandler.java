package com.qqsuccubus.roomcast.socket.ws;

import com.qqsuccubus.roomcast.socket.config.SocketConfig;
import com.qqsuccubus.roomcast.socket.drain.DrainService;
import com.qqsuccubus.roomcast.socket.router.MessageRouter;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Collection;
import java.util.stream.Stream;

/**
 * Upgrades HTTP requests to WebSocket connections served by the {@link MessageRouter}.
 * <p>
 * An optional {@code token} query parameter authenticates the connection right after the upgrade;
 * otherwise the client must send an {@code auth} frame.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final SocketConfig config;
    private final MessageRouter router;
    private final DrainService drainService;

    public WebSocketUpgradeHandler(SocketConfig config, MessageRouter router, DrainService drainService) {
        this.config = config;
        this.router = router;
        this.drainService = drainService;
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        // Reject new connections if node is draining
        if (drainService.isDraining()) {
            log.warn("Rejecting new WebSocket connection - node is draining");
            return res.status(503)
                .sendString(Mono.just("Service unavailable - node is draining"))
                .then();
        }

        String token = extractToken(req.uri());

        return res.sendWebsocket((inbound, outbound) ->
            router.serve(new WebSocketTransport(inbound, outbound, config), token)
        );
    }

    static String extractToken(String uri) {
        QueryStringDecoder decoder = new QueryStringDecoder(uri);
        return Stream.ofNullable(decoder.parameters().get("token"))
            .flatMap(Collection::stream)
            .filter(value -> !value.isBlank())
            .findFirst()
            .orElse(null);
    }
}
