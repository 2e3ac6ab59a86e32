package com.qqsuccubus.roomcast.socket.session;

import com.qqsuccubus.roomcast.core.model.Actor;
import com.qqsuccubus.roomcast.core.msg.ChannelId;
import com.qqsuccubus.roomcast.core.msg.Envelope;
import com.qqsuccubus.roomcast.core.msg.OutboundFrames;
import com.qqsuccubus.roomcast.core.msg.OutboundFrames.OutboundFrame;
import com.qqsuccubus.roomcast.socket.metrics.MetricsService;
import com.qqsuccubus.roomcast.socket.pubsub.Subscriber;
import com.qqsuccubus.roomcast.socket.pubsub.Subscription;
import com.qqsuccubus.roomcast.socket.ws.Transport;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One client connection: its transport, its outbound queue and the channels it joined.
 * <p>
 * The actor is attached once authentication succeeds; connections in the registry always have one.
 * Only this class emits into the outbound queue, which the transport writer drains, so broker
 * deliveries never write to the socket from the publisher's thread.
 * </p>
 */
public class Connection implements Subscriber {
    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    @Getter
    private final String id;
    @Getter
    private final Transport transport;
    @Getter
    private final long createdAt;

    private final Sinks.Many<String> outbound;
    private final Sinks.Empty<Void> closeRequested = Sinks.empty();
    private final MetricsService metricsService;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final Map<ChannelId, Subscription> subscriptions = new LinkedHashMap<>();

    @Nullable
    private volatile Actor actor;
    private volatile int closeCode;
    @Nullable
    private volatile String closeReason;

    Connection(String id, Transport transport, Sinks.Many<String> outbound, MetricsService metricsService, long createdAt) {
        this.id = id;
        this.transport = transport;
        this.outbound = outbound;
        this.metricsService = metricsService;
        this.createdAt = createdAt;
    }

    @Nullable
    public Actor getActor() {
        return actor;
    }

    /**
     * Wallet of the owning actor, or {@code null} before authentication.
     */
    @Nullable
    public String getWallet() {
        Actor current = actor;
        return current != null ? current.getWalletAddress() : null;
    }

    public ConnectionState getState() {
        return state.get();
    }

    /**
     * CONNECTING → AUTHENTICATED with the verified actor.
     *
     * @return {@code false} if the connection was no longer connecting
     */
    public boolean admit(Actor verified) {
        if (state.get() != ConnectionState.CONNECTING) {
            return false;
        }
        this.actor = verified;
        return state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.AUTHENTICATED);
    }

    public boolean beginProcessing() {
        return state.compareAndSet(ConnectionState.AUTHENTICATED, ConnectionState.PROCESSING);
    }

    public void endProcessing() {
        state.compareAndSet(ConnectionState.PROCESSING, ConnectionState.AUTHENTICATED);
    }

    /**
     * Moves to CLOSED and hands back every subscription still held. Later calls get an empty list.
     */
    public synchronized List<Subscription> markClosed() {
        if (state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) {
            return List.of();
        }
        List<Subscription> held = new ArrayList<>(subscriptions.values());
        subscriptions.clear();
        return held;
    }

    public boolean isClosed() {
        return state.get() == ConnectionState.CLOSED;
    }

    /**
     * Records a subscription. Refused once the connection is closed, in which case the caller must
     * unsubscribe it.
     */
    public synchronized boolean addSubscription(Subscription subscription) {
        if (state.get() == ConnectionState.CLOSED) {
            return false;
        }
        subscriptions.put(subscription.getChannelId(), subscription);
        return true;
    }

    @Nullable
    public synchronized Subscription removeSubscription(ChannelId channelId) {
        return subscriptions.remove(channelId);
    }

    public synchronized boolean isSubscribed(ChannelId channelId) {
        return subscriptions.containsKey(channelId);
    }

    public synchronized List<ChannelId> joinedChannels() {
        return new ArrayList<>(subscriptions.keySet());
    }

    @Override
    public void onEnvelope(Envelope envelope) {
        send(OutboundFrames.fromEnvelope(envelope));
    }

    public boolean send(OutboundFrame frame) {
        return emit(frame.toJson());
    }

    /**
     * Queues a serialized frame for the transport writer.
     *
     * @return {@code false} if the frame was dropped
     */
    public synchronized boolean emit(String json) {
        Sinks.EmitResult result = outbound.tryEmitNext(json);
        if (result.isSuccess()) {
            return true;
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            metricsService.recordDropBufferFull();
            log.warn("Outbound queue full for connection {}, dropping frame", id);
        } else {
            metricsService.recordDropClosed();
            log.debug("Dropping frame for connection {}: {}", id, result);
        }
        return false;
    }

    /**
     * Frames queued for the transport writer; completes once the connection is cleaned up.
     */
    public Flux<String> outboundFrames() {
        return outbound.asFlux();
    }

    public synchronized void completeOutbound() {
        outbound.tryEmitComplete();
    }

    /**
     * Asks the router to stop reading and close the transport with {@code code} once queued frames
     * are flushed. The first request wins.
     */
    public void requestClose(int code, String reason) {
        synchronized (closeRequested) {
            if (closeReason == null) {
                closeCode = code;
                closeReason = reason;
            }
        }
        closeRequested.tryEmitEmpty();
    }

    public Mono<Void> onCloseRequested() {
        return closeRequested.asMono();
    }

    public int getCloseCode() {
        return closeCode;
    }

    @Nullable
    public String getCloseReason() {
        return closeReason;
    }

    @Override
    public String toString() {
        return "Connection{" + id + ", wallet=" + getWallet() + ", state=" + state.get() + "}";
    }
}
