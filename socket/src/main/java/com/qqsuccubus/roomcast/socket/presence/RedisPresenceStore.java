package com.qqsuccubus.roomcast.socket.presence;

import com.qqsuccubus.roomcast.core.redis.Keys;
import com.qqsuccubus.roomcast.socket.redis.IRedisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Presence in the Redis hash {@link Keys#presence()}, shared by every node using the same Redis.
 */
public class RedisPresenceStore implements IPresenceStore {
    private static final Logger log = LoggerFactory.getLogger(RedisPresenceStore.class);

    private final IRedisService redisService;

    public RedisPresenceStore(IRedisService redisService) {
        this.redisService = redisService;
    }

    @Override
    public Mono<Boolean> touch(String wallet, long nowMs) {
        return redisService.hashSet(Keys.presence(), wallet, String.valueOf(nowMs));
    }

    @Override
    public Mono<Long> lastSeen(String wallet) {
        return redisService.hashGet(Keys.presence(), wallet).map(Long::parseLong);
    }

    @Override
    public Mono<Map<String, Long>> snapshot() {
        return redisService.hashGetAll(Keys.presence()).map(raw -> {
            Map<String, Long> result = new HashMap<>(raw.size());
            raw.forEach((wallet, value) -> {
                try {
                    result.put(wallet, Long.parseLong(value));
                } catch (NumberFormatException e) {
                    log.warn("Ignoring malformed presence value for {}: {}", wallet, value);
                }
            });
            return result;
        });
    }

    @Override
    public Mono<Boolean> removeIfUnchanged(String wallet, long expectedMs) {
        return redisService.hashDeleteIfEquals(Keys.presence(), wallet, String.valueOf(expectedMs));
    }
}
