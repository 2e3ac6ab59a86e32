package com.qqsuccubus.roomcast.socket;

import com.qqsuccubus.roomcast.socket.config.SocketConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Main entry point for a socket node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at /ws (optional query: token)</li>
 *   <li>Room, gated and direct channels with an in-process broker</li>
 *   <li>Presence tracking and status notifications</li>
 *   <li>Per-actor rate limiting</li>
 *   <li>Expose /healthz, /readyz, /drain and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class SocketApp {
    private static final Logger log = LoggerFactory.getLogger(SocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        if (config.isUseVirtualThreads()) {
            System.setProperty("reactor.schedulers.defaultBoundedElasticOnVirtualThreads", "true");
            log.info("reactor.schedulers.defaultBoundedElasticOnVirtualThreads = true");
        }

        log.info("Starting socket node: {}", config.getNodeId());
        log.info("  Message store: {}, presence store: {}", config.getMessageStore(), config.getPresenceStore());
        log.info("  Identity service: {}", config.getIdentityUrl());
        log.info("  Rate limits: {}", config.getRateLimitPolicy());

        SocketContext context = SocketContext.create(config);
        context.start();

        log.info("Socket node {} is ready", config.getNodeId());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");
            context.shutdown();
        }));

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }
}
