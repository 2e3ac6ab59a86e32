package com.qqsuccubus.roomcast.socket.session;

import com.qqsuccubus.roomcast.socket.config.SocketConfig;
import com.qqsuccubus.roomcast.socket.metrics.MetricsService;
import com.qqsuccubus.roomcast.socket.ws.Transport;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.UUID;

/**
 * Creates connections with their bounded outbound queue.
 */
public class ConnectionFactory {
    private final SocketConfig config;
    private final MetricsService metricsService;
    private final Clock clock;

    public ConnectionFactory(SocketConfig config, MetricsService metricsService, Clock clock) {
        this.config = config;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Creates a connection in {@link ConnectionState#CONNECTING} with a fresh id.
     *
     * @param transport transport the connection writes to
     * @return Connection instance
     */
    public Connection create(Transport transport) {
        // Create outbound sink with backpressure buffer
        Sinks.Many<String> sink = Sinks.many().multicast().onBackpressureBuffer(
            config.getPerConnBufferSize(), false
        );
        return new Connection(UUID.randomUUID().toString(), transport, sink, metricsService, clock.millis());
    }
}
