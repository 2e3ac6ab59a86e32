package com.qqsuccubus.roomcast.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code roomcast.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Live authenticated connections.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String CONNECTIONS_ACTIVE = "roomcast.socket.connections.active";

    /**
     * Counter: Connection lifecycle events.
     * <p>
     * Tags: nodeId, type (opened/closed/auth_failed)
     * </p>
     */
    public static final String CONNECTIONS_TOTAL = "roomcast.socket.connections.total";

    /**
     * Counter: Inbound frames by type.
     * <p>
     * Tags: nodeId, type
     * </p>
     */
    public static final String FRAMES_INBOUND_TOTAL = "roomcast.router.frames.inbound.total";

    /**
     * Counter: Error replies sent to clients.
     * <p>
     * Tags: nodeId, reason (error code)
     * </p>
     */
    public static final String ERRORS_TOTAL = "roomcast.router.errors.total";

    /**
     * Counter: Rate-limit denials.
     * <p>
     * Tags: nodeId, type (action class)
     * </p>
     */
    public static final String RATE_LIMITED_TOTAL = "roomcast.ratelimit.denied.total";

    /**
     * Timer: Frame handling latency from receipt to reply.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String FRAME_LATENCY = "roomcast.router.frame.latency";

    /**
     * Timer: Message store persist latency.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String STORE_PERSIST_LATENCY = "roomcast.store.persist.latency";

    /**
     * Counter: Envelopes published to the broker.
     * <p>
     * Tags: nodeId, type (channel kind)
     * </p>
     */
    public static final String PUBLISHED_TOTAL = "roomcast.broker.published.total";

    /**
     * Counter: Envelopes delivered to subscribers.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String DELIVERED_TOTAL = "roomcast.broker.delivered.total";

    /**
     * Counter: Subscriber callbacks that threw during fan-out.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String SUBSCRIBER_FAILURES_TOTAL = "roomcast.broker.subscriber.failures.total";

    /**
     * Gauge: Channels currently held by the broker.
     */
    public static final String CHANNELS_ACTIVE = "roomcast.broker.channels.active";

    /**
     * Counter: Outbound frames dropped.
     * <p>
     * Tags: nodeId, reason (buffer_full/closed)
     * </p>
     */
    public static final String DROPS_TOTAL = "roomcast.socket.drops.total";

    /**
     * Counter: Actors reported offline by the presence sweep.
     */
    public static final String PRESENCE_EVICTIONS_TOTAL = "roomcast.presence.evictions.total";

    /**
     * Gauge: Actors currently tracked as online.
     */
    public static final String PRESENCE_ONLINE = "roomcast.presence.online";

    /**
     * Counter: Network traffic inbound from WebSocket (bytes).
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "roomcast.socket.network.inbound.ws.bytes";

    /**
     * Counter: Network traffic outbound to WebSocket (bytes).
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "roomcast.socket.network.outbound.ws.bytes";

    /**
     * Distribution Summary: Inbound frame size distribution (bytes).
     */
    public static final String MESSAGE_SIZE_INBOUND = "roomcast.socket.message.size.inbound";
}
