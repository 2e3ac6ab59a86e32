package com.qqsuccubus.roomcast.socket.support;

import com.qqsuccubus.roomcast.socket.redis.IRedisService;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory stand-in for Redis streams and hashes. Trimming is exact.
 */
public class FakeRedisService implements IRedisService {
    private final Map<String, List<StreamEntry>> streams = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> hashes = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean failing;
    private volatile boolean closed;

    /**
     * Makes every subsequent call fail with a connection error.
     */
    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Adds a raw entry, bypassing the store.
     */
    public void addRaw(String key, String id, Map<String, String> fields) {
        streams.computeIfAbsent(key, k -> new ArrayList<>()).add(new StreamEntry(id, fields));
    }

    public int streamLength(String key) {
        List<StreamEntry> entries = streams.get(key);
        return entries == null ? 0 : entries.size();
    }

    @Override
    public synchronized Mono<String> appendToStream(String key, Map<String, String> fields, long maxLen) {
        if (failing) {
            return Mono.error(new IllegalStateException("Connection refused"));
        }
        String id = (1_700_000_000_000L + sequence.incrementAndGet()) + "-0";
        List<StreamEntry> entries = streams.computeIfAbsent(key, k -> new ArrayList<>());
        entries.add(new StreamEntry(id, new LinkedHashMap<>(fields)));
        while (entries.size() > maxLen) {
            entries.remove(0);
        }
        return Mono.just(id);
    }

    @Override
    public synchronized Flux<StreamEntry> readLatest(String key, int count) {
        if (failing) {
            return Flux.error(new IllegalStateException("Connection refused"));
        }
        List<StreamEntry> entries = new ArrayList<>(streams.getOrDefault(key, List.of()));
        List<StreamEntry> latest = new ArrayList<>();
        for (int i = entries.size() - 1; i >= 0 && latest.size() < count; i--) {
            latest.add(entries.get(i));
        }
        return Flux.fromIterable(latest);
    }

    @Override
    public Mono<Boolean> hashSet(String key, String field, String value) {
        if (failing) {
            return Mono.error(new IllegalStateException("Connection refused"));
        }
        return Mono.fromSupplier(() -> hashes.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).put(field, value) == null);
    }

    @Override
    public Mono<String> hashGet(String key, String field) {
        return Mono.justOrEmpty(hashes.getOrDefault(key, Map.of()).get(field));
    }

    @Override
    public Mono<Map<String, String>> hashGetAll(String key) {
        if (failing) {
            return Mono.error(new IllegalStateException("Connection refused"));
        }
        return Mono.fromSupplier(() -> new HashMap<>(hashes.getOrDefault(key, Map.of())));
    }

    @Override
    public Mono<Boolean> hashDeleteIfEquals(String key, String field, String expected) {
        return Mono.fromSupplier(() -> {
            Map<String, String> hash = hashes.get(key);
            if (hash == null) {
                return false;
            }
            return hash.remove(field, expected);
        });
    }

    /**
     * Raw hash write, bypassing the store.
     */
    public void putHash(String key, String field, String value) {
        hashes.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).put(field, value);
    }

    public String getHash(String key, String field) {
        return hashes.getOrDefault(key, Map.of()).get(field);
    }

    @Override
    public void close() {
        closed = true;
    }
}
