package com.qqsuccubus.roomcast.socket.store;

import com.qqsuccubus.roomcast.core.msg.ChannelId;
import com.qqsuccubus.roomcast.core.msg.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Process-local history capped at {@code maxLen} messages per channel and {@code maxChannels}
 * channels. The least recently used channel is dropped first. Lost on restart; meant for
 * development and single-node deployments.
 */
public class InMemoryMessageStore implements IMessageStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageStore.class);

    public static final int DEFAULT_MAX_CHANNELS = 10_000;

    private final Map<ChannelId, Deque<Envelope>> history;
    private final Clock clock;
    private final int maxLen;

    public InMemoryMessageStore(Clock clock, int maxLen) {
        this(clock, maxLen, DEFAULT_MAX_CHANNELS);
    }

    public InMemoryMessageStore(Clock clock, int maxLen, int maxChannels) {
        if (maxChannels <= 0) {
            throw new IllegalArgumentException("maxChannels must be positive: " + maxChannels);
        }
        this.clock = clock;
        this.maxLen = maxLen;
        // access order: reads and writes both count as use
        this.history = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<ChannelId, Deque<Envelope>> eldest) {
                if (size() > maxChannels) {
                    log.debug("Dropping history of {} ({} channels cap)", eldest.getKey(), maxChannels);
                    return true;
                }
                return false;
            }
        };
    }

    @Override
    public Mono<Envelope> persist(ChannelId channel, String from, String payloadJson) {
        return Mono.fromSupplier(() -> {
            Envelope envelope = new Envelope(UUID.randomUUID().toString(), channel, from, payloadJson, clock.millis());
            synchronized (history) {
                Deque<Envelope> entries = history.computeIfAbsent(channel, id -> new ArrayDeque<>());
                if (entries.size() == maxLen) {
                    entries.pollFirst();
                }
                entries.addLast(envelope);
            }
            return envelope;
        });
    }

    @Override
    public Flux<Envelope> recentHistory(ChannelId channel, int limit) {
        return Flux.defer(() -> {
            List<Envelope> snapshot;
            synchronized (history) {
                Deque<Envelope> entries = history.get(channel);
                if (entries == null) {
                    return Flux.empty();
                }
                snapshot = new ArrayList<>(entries);
            }
            int from = Math.max(0, snapshot.size() - Math.max(limit, 0));
            return Flux.fromIterable(snapshot.subList(from, snapshot.size()));
        });
    }

    public int channelCount() {
        synchronized (history) {
            return history.size();
        }
    }
}
