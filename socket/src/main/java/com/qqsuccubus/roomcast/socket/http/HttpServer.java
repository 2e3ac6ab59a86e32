package com.qqsuccubus.roomcast.socket.http;

import com.qqsuccubus.roomcast.core.util.JsonUtils;
import com.qqsuccubus.roomcast.socket.config.SocketConfig;
import com.qqsuccubus.roomcast.socket.drain.DrainService;
import com.qqsuccubus.roomcast.socket.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.roomcast.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, drain endpoint, and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String WS_PATH = "/ws";

    private final SocketConfig config;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final PrometheusMetricsExporter metricsExporter;
    private final DrainService drainService;
    private DisposableServer server;

    /**
     * Binds the server and blocks until it listens.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Liveness - fails if draining
                .get("/healthz", (req, res) -> {
                    if (drainService.isDraining()) {
                        return res.status(503).sendString(Mono.just("Draining"));
                    }
                    return res.status(200).sendString(Mono.just("OK"));
                })
                .get("/readyz", (req, res) -> {
                    if (drainService.isDraining()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Draining"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .post("/drain", (req, res) -> {
                    log.warn("Drain endpoint called - starting graceful connection draining");
                    boolean started = drainService.startDrain();
                    return res.status(started ? 202 : 409).sendString(Mono.just(String.format(
                        started ? "Drain started - %d connections to drain" : "Drain already in progress - %d remaining",
                        drainService.getRemainingConnections()
                    )));
                })
                .get("/drain/status", (req, res) -> {
                    Map<String, Object> status = new LinkedHashMap<>();
                    status.put("draining", drainService.isDraining());
                    status.put("complete", drainService.isDrainComplete());
                    status.put("remaining", drainService.getRemainingConnections());
                    return res.status(200)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(JsonUtils.writeValueAsString(status)));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get(WS_PATH, upgradeHandler::handle)
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
            log.info("HTTP server stopped");
        }
    }
}
