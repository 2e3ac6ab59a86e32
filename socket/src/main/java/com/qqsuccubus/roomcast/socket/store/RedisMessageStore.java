package com.qqsuccubus.roomcast.socket.store;

import com.qqsuccubus.roomcast.core.error.DependencyException;
import com.qqsuccubus.roomcast.core.msg.ChannelId;
import com.qqsuccubus.roomcast.core.msg.Envelope;
import com.qqsuccubus.roomcast.core.redis.Keys;
import com.qqsuccubus.roomcast.socket.redis.IRedisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * History in one Redis stream per channel ({@link Keys#history}). The stream entry id is the
 * message id, so ids are ordered and survive restarts.
 */
public class RedisMessageStore implements IMessageStore {
    private static final Logger log = LoggerFactory.getLogger(RedisMessageStore.class);

    static final String FIELD_FROM = "from";
    static final String FIELD_PAYLOAD = "payload";
    static final String FIELD_TS = "ts";

    private final IRedisService redisService;
    private final Clock clock;
    private final int maxLen;

    public RedisMessageStore(IRedisService redisService, Clock clock, int maxLen) {
        this.redisService = redisService;
        this.clock = clock;
        this.maxLen = maxLen;
    }

    @Override
    public Mono<Envelope> persist(ChannelId channel, String from, String payloadJson) {
        return Mono.defer(() -> {
            long ts = clock.millis();
            Map<String, String> fields = Map.of(
                FIELD_FROM, from,
                FIELD_PAYLOAD, payloadJson,
                FIELD_TS, String.valueOf(ts)
            );
            return redisService.appendToStream(Keys.history(channel), fields, maxLen)
                .map(id -> new Envelope(id, channel, from, payloadJson, ts));
        }).onErrorMap(err -> !(err instanceof DependencyException),
            err -> new DependencyException("Failed to persist message on " + channel, err));
    }

    @Override
    public Flux<Envelope> recentHistory(ChannelId channel, int limit) {
        return redisService.readLatest(Keys.history(channel), limit)
            .collectList()
            .flatMapMany(entries -> {
                List<Envelope> envelopes = new ArrayList<>(entries.size());
                for (IRedisService.StreamEntry entry : entries) {
                    Envelope envelope = toEnvelope(channel, entry);
                    if (envelope != null) {
                        envelopes.add(envelope);
                    }
                }
                Collections.reverse(envelopes);
                return Flux.fromIterable(envelopes);
            })
            .onErrorMap(err -> !(err instanceof DependencyException),
                err -> new DependencyException("Failed to read history of " + channel, err));
    }

    private Envelope toEnvelope(ChannelId channel, IRedisService.StreamEntry entry) {
        Map<String, String> fields = entry.fields();
        String from = fields.get(FIELD_FROM);
        String payload = fields.get(FIELD_PAYLOAD);
        if (from == null || payload == null) {
            log.warn("Skipping malformed history entry {} on {}", entry.id(), channel);
            return null;
        }
        return new Envelope(entry.id(), channel, from, payload, timestamp(channel, entry));
    }

    private static long timestamp(ChannelId channel, IRedisService.StreamEntry entry) {
        String ts = entry.fields().get(FIELD_TS);
        if (ts == null) {
            return streamIdMillis(entry.id());
        }
        try {
            return Long.parseLong(ts);
        } catch (NumberFormatException e) {
            log.warn("Entry {} on {} has malformed ts '{}', using its stream id", entry.id(), channel, ts);
            return streamIdMillis(entry.id());
        }
    }

    // Stream ids are <millis>-<seq>
    private static long streamIdMillis(String id) {
        int dash = id.indexOf('-');
        return Long.parseLong(dash > 0 ? id.substring(0, dash) : id);
    }
}
