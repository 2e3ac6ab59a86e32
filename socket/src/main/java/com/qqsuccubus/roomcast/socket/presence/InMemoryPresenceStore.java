package com.qqsuccubus.roomcast.socket.presence;

import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPresenceStore implements IPresenceStore {
    private final Map<String, Long> lastSeen = new ConcurrentHashMap<>();

    @Override
    public Mono<Boolean> touch(String wallet, long nowMs) {
        return Mono.fromSupplier(() -> lastSeen.put(wallet, nowMs) == null);
    }

    @Override
    public Mono<Long> lastSeen(String wallet) {
        return Mono.justOrEmpty(lastSeen.get(wallet));
    }

    @Override
    public Mono<Map<String, Long>> snapshot() {
        return Mono.fromSupplier(() -> new HashMap<>(lastSeen));
    }

    @Override
    public Mono<Boolean> removeIfUnchanged(String wallet, long expectedMs) {
        return Mono.fromSupplier(() -> lastSeen.remove(wallet, expectedMs));
    }
}
