package com.qqsuccubus.roomcast.socket.pubsub;

import com.qqsuccubus.roomcast.core.msg.ChannelId;
import com.qqsuccubus.roomcast.core.msg.Envelope;
import com.qqsuccubus.roomcast.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-process channel broker with ordered fan-out and a bounded recent buffer per channel.
 * <p>
 * <b>Locking:</b> one monitor per channel. Publish, subscribe and unsubscribe on the same channel
 * are serialized; unrelated channels never contend. Subscribers run under that monitor, which is
 * what makes per-channel delivery order equal publish order.
 * </p>
 * <p>
 * <b>Races:</b> a subscribe concurrent with a publish may or may not see that publish. Use
 * {@link #subscribeWithRecent} to join without a gap between backfill and live delivery.
 * </p>
 * <p>
 * <b>Lifecycle:</b> channels are created lazily and removed by {@link #evictIdle()} once they have
 * no subscribers and no activity for the idle TTL. A retired channel is never written again;
 * callers that raced with eviction retry on a fresh channel.
 * </p>
 */
public class PubSubBroker {
    private static final Logger log = LoggerFactory.getLogger(PubSubBroker.class);

    private final Map<ChannelId, Channel> channels = new ConcurrentHashMap<>();
    private final int capacity;
    private final Duration idleTtl;
    private final Clock clock;
    private final MetricsService metricsService;

    public PubSubBroker(int capacity, Duration idleTtl, Clock clock, MetricsService metricsService) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.idleTtl = idleTtl;
        this.clock = clock;
        this.metricsService = metricsService;
    }

    /**
     * Appends the envelope to the channel's recent buffer, then hands it to every current subscriber
     * in subscription order. A throwing subscriber is logged and skipped; it stays subscribed.
     *
     * @return number of subscribers that accepted the envelope
     */
    public int publish(ChannelId channelId, Envelope envelope) {
        int delivered = withChannel(channelId, channel -> {
            channel.append(envelope);
            channel.lastActivityMs = clock.millis();
            int ok = 0;
            for (Subscription subscription : channel.subscribers) {
                try {
                    subscription.getSubscriber().onEnvelope(envelope);
                    ok++;
                } catch (RuntimeException e) {
                    metricsService.recordSubscriberFailure();
                    log.warn("Subscriber failed on {} for msgId {}: {}",
                        channelId, envelope.getMsgId(), e.toString());
                }
            }
            return ok;
        });
        metricsService.recordPublished(channelId.getKind().prefix());
        metricsService.recordDelivered(delivered);
        log.debug("Published {} on {} to {} subscribers", envelope.getMsgId(), channelId, delivered);
        return delivered;
    }

    public Subscription subscribe(ChannelId channelId, Subscriber subscriber) {
        return withChannel(channelId, channel -> register(channel, subscriber));
    }

    /**
     * Registers the subscriber and snapshots the recent buffer under one lock, so the subscriber
     * sees every envelope exactly once across backfill and live delivery.
     */
    public Backfill subscribeWithRecent(ChannelId channelId, Subscriber subscriber, int limit) {
        return withChannel(channelId, channel -> {
            List<Envelope> recent = channel.tail(limit);
            return new Backfill(register(channel, subscriber), recent);
        });
    }

    /**
     * Up to {@code limit} most recent envelopes, oldest first.
     */
    public List<Envelope> recent(ChannelId channelId, int limit) {
        Channel channel = channels.get(channelId);
        if (channel == null) {
            return Collections.emptyList();
        }
        synchronized (channel) {
            return channel.tail(limit);
        }
    }

    /**
     * Removes the subscription. Idempotent; once this returns the subscriber is never invoked again.
     *
     * @return {@code true} if this call removed it
     */
    public boolean unsubscribe(Subscription subscription) {
        if (!subscription.active.compareAndSet(true, false)) {
            return false;
        }
        Channel channel = subscription.channel;
        synchronized (channel) {
            channel.subscribers.remove(subscription);
            channel.lastActivityMs = clock.millis();
        }
        log.debug("Unsubscribed from {}", subscription.getChannelId());
        return true;
    }

    /**
     * Whether the channel still needs its history loaded from the store.
     */
    public boolean isCold(ChannelId channelId) {
        Channel channel = channels.get(channelId);
        if (channel == null) {
            return true;
        }
        synchronized (channel) {
            return !channel.seeded;
        }
    }

    /**
     * Loads store history into a channel that has not been seeded yet. Envelopes already buffered
     * (published while the history was being fetched) are kept after the history and not duplicated.
     *
     * @param history oldest first
     * @return {@code true} if this call seeded the channel
     */
    public boolean seedIfCold(ChannelId channelId, List<Envelope> history) {
        return withChannel(channelId, channel -> {
            if (channel.seeded) {
                return false;
            }
            channel.seeded = true;
            List<Envelope> live = new ArrayList<>(channel.recent);
            Set<String> liveIds = new HashSet<>();
            for (Envelope envelope : live) {
                liveIds.add(envelope.getMsgId());
            }
            channel.recent.clear();
            for (Envelope envelope : history) {
                if (!liveIds.contains(envelope.getMsgId())) {
                    channel.append(envelope);
                }
            }
            for (Envelope envelope : live) {
                channel.append(envelope);
            }
            log.debug("Seeded {} with {} stored envelopes", channelId, history.size());
            return true;
        });
    }

    /**
     * Drops channels with no subscribers and no activity for the idle TTL.
     *
     * @return number of channels evicted
     */
    public int evictIdle() {
        long now = clock.millis();
        int evicted = 0;
        for (Channel channel : channels.values()) {
            synchronized (channel) {
                if (channel.subscribers.isEmpty() && now - channel.lastActivityMs >= idleTtl.toMillis()) {
                    channel.retired = true;
                    channels.remove(channel.id, channel);
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} idle channels, {} remaining", evicted, channels.size());
        }
        return evicted;
    }

    public int channelCount() {
        return channels.size();
    }

    public int subscriberCount(ChannelId channelId) {
        Channel channel = channels.get(channelId);
        if (channel == null) {
            return 0;
        }
        synchronized (channel) {
            return channel.subscribers.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    private Subscription register(Channel channel, Subscriber subscriber) {
        Subscription subscription = new Subscription(channel, subscriber);
        channel.subscribers.add(subscription);
        channel.lastActivityMs = clock.millis();
        return subscription;
    }

    private <T> T withChannel(ChannelId channelId, Function<Channel, T> action) {
        while (true) {
            Channel channel = channels.computeIfAbsent(channelId, id -> new Channel(id, capacity, clock.millis()));
            synchronized (channel) {
                if (!channel.retired) {
                    return action.apply(channel);
                }
            }
        }
    }
}
