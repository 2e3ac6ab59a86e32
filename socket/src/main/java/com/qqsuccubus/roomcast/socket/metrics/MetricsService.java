package com.qqsuccubus.roomcast.socket.metrics;

import com.qqsuccubus.roomcast.core.metrics.MetricsNames;
import com.qqsuccubus.roomcast.core.metrics.MetricsTags;
import com.qqsuccubus.roomcast.socket.config.SocketConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics service for a socket node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    private final Counter connectionsOpened;
    private final Counter connectionsClosed;
    private final Counter authFailures;
    private final Counter delivered;
    private final Counter subscriberFailures;
    private final Counter dropsBufferFull;
    private final Counter dropsClosed;
    private final Counter presenceEvictions;

    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;
    private final DistributionSummary messageSizeInbound;

    private final Timer frameLatency;
    private final Timer storePersistLatency;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        connectionsOpened = lifecycleCounter("opened");
        connectionsClosed = lifecycleCounter("closed");
        authFailures = lifecycleCounter("auth_failed");

        delivered = Counter.builder(MetricsNames.DELIVERED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Envelopes handed to subscriber queues")
            .register(registry);

        subscriberFailures = Counter.builder(MetricsNames.SUBSCRIBER_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Subscriber callbacks that threw during fan-out")
            .register(registry);

        dropsBufferFull = Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "buffer_full")
            .description("Outbound frames dropped due to full connection queue")
            .register(registry);

        dropsClosed = Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "closed")
            .description("Outbound frames dropped because the connection was closing")
            .register(registry);

        presenceEvictions = Counter.builder(MetricsNames.PRESENCE_EVICTIONS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Actors reported offline by the presence sweep")
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        messageSizeInbound = DistributionSummary.builder(MetricsNames.MESSAGE_SIZE_INBOUND)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Inbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);

        frameLatency = Timer.builder(MetricsNames.FRAME_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Inbound frame handling latency")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(1),
                Duration.ofMillis(5),
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500)
            )
            .register(registry);

        storePersistLatency = Timer.builder(MetricsNames.STORE_PERSIST_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Message store persist latency")
            .publishPercentileHistogram()
            .register(registry);
    }

    /**
     * Registers the gauges backed by live node state.
     */
    public void bindGauges(Supplier<Number> connections, Supplier<Number> channels, Supplier<Number> online) {
        Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, connections)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Live authenticated connections")
            .register(registry);
        Gauge.builder(MetricsNames.CHANNELS_ACTIVE, channels)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Channels held by the broker")
            .register(registry);
        Gauge.builder(MetricsNames.PRESENCE_ONLINE, online)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Actors tracked as online")
            .register(registry);
    }

    public void recordConnectionOpened() {
        connectionsOpened.increment();
    }

    public void recordConnectionClosed() {
        connectionsClosed.increment();
    }

    public void recordAuthFailure() {
        authFailures.increment();
    }

    public void recordInboundFrame(String type) {
        Counter.builder(MetricsNames.FRAMES_INBOUND_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, type == null ? "none" : type)
            .register(registry)
            .increment();
    }

    public void recordError(String code) {
        Counter.builder(MetricsNames.ERRORS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, code)
            .register(registry)
            .increment();
    }

    public void recordRateLimited(String action) {
        Counter.builder(MetricsNames.RATE_LIMITED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, action)
            .register(registry)
            .increment();
    }

    public void recordPublished(String channelKind) {
        Counter.builder(MetricsNames.PUBLISHED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, channelKind)
            .register(registry)
            .increment();
    }

    public void recordDelivered(int count) {
        delivered.increment(count);
    }

    public void recordSubscriberFailure() {
        subscriberFailures.increment();
    }

    public void recordDropBufferFull() {
        dropsBufferFull.increment();
    }

    public void recordDropClosed() {
        dropsClosed.increment();
    }

    public void recordPresenceEviction() {
        presenceEvictions.increment();
    }

    /**
     * Records inbound frame handling time.
     *
     * @param startNanos {@link System#nanoTime()} at frame receipt
     */
    public void recordFrameLatency(long startNanos) {
        frameLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordStorePersistLatency(long startNanos) {
        storePersistLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Records bytes received from a WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
        messageSizeInbound.record(bytes);
    }

    /**
     * Records bytes sent to a WebSocket client.
     *
     * @param bytes number of bytes sent
     */
    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }

    private Counter lifecycleCounter(String event) {
        return Counter.builder(MetricsNames.CONNECTIONS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, event)
            .description("Connection lifecycle events")
            .register(registry);
    }
}
