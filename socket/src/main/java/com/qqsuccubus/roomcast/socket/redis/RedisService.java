package com.qqsuccubus.roomcast.socket.redis;

import com.qqsuccubus.roomcast.socket.config.SocketConfig;
import io.lettuce.core.KeyValue;
import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.Value;
import io.lettuce.core.XAddArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Reactive Redis service backing the optional Redis stores.
 * <p>
 * All operations are non-blocking using the Lettuce reactive API.
 * </p>
 */
public class RedisService implements IRedisService {
    private static final Logger log = LoggerFactory.getLogger(RedisService.class);

    /**
     * Deletes KEYS[1].ARGV[1] only if it equals ARGV[2]; returns the number of fields removed.
     */
    private static final String HDEL_IF_EQUALS =
        "if redis.call('HGET', KEYS[1], ARGV[1]) == ARGV[2] then "
            + "return redis.call('HDEL', KEYS[1], ARGV[1]) "
            + "else return 0 end";

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisService(SocketConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    /**
     * Appends an entry using Redis Streams (XADD) with approximate MAXLEN trimming.
     */
    @Override
    public Mono<String> appendToStream(String key, Map<String, String> fields, long maxLen) {
        XAddArgs args = XAddArgs.Builder
            .maxlen(maxLen)
            .approximateTrimming();

        return commands.xadd(key, args, fields)
            .doOnError(err -> log.error("Failed to append to stream {}", key, err));
    }

    /**
     * Reads the newest entries with XREVRANGE.
     */
    @Override
    public Flux<StreamEntry> readLatest(String key, int count) {
        return commands.xrevrange(key, Range.unbounded(), Limit.from(count))
            .map(message -> new StreamEntry(message.getId(), message.getBody()))
            .doOnError(err -> log.error("Failed to read stream {}", key, err));
    }

    @Override
    public Mono<Boolean> hashSet(String key, String field, String value) {
        return commands.hset(key, field, value)
            .doOnError(err -> log.error("Failed to set {}.{}", key, field, err));
    }

    @Override
    public Mono<String> hashGet(String key, String field) {
        return commands.hget(key, field)
            .doOnError(err -> log.error("Failed to get {}.{}", key, field, err));
    }

    @Override
    public Mono<Map<String, String>> hashGetAll(String key) {
        return commands.hgetall(key)
            .collectMap(KeyValue::getKey, Value::getValue)
            .doOnError(err -> log.error("Failed to read hash {}", key, err));
    }

    @Override
    public Mono<Boolean> hashDeleteIfEquals(String key, String field, String expected) {
        return commands.<Long>eval(HDEL_IF_EQUALS, ScriptOutputType.INTEGER, new String[]{key}, field, expected)
            .next()
            .map(removed -> removed > 0)
            .defaultIfEmpty(false)
            .doOnError(err -> log.error("Failed to conditionally delete {}.{}", key, field, err));
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
