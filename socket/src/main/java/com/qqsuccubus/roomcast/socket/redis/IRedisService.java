package com.qqsuccubus.roomcast.socket.redis;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Redis operations used by the Redis-backed stores.
 * <p>
 * Enables testing the stores against an in-memory fake.
 * </p>
 */
public interface IRedisService {

    /**
     * Appends an entry to a stream, trimming it to roughly {@code maxLen} entries.
     *
     * @return the stream entry id
     */
    Mono<String> appendToStream(String key, Map<String, String> fields, long maxLen);

    /**
     * Latest {@code count} stream entries, newest first.
     */
    Flux<StreamEntry> readLatest(String key, int count);

    /**
     * Sets a hash field.
     *
     * @return {@code true} if the field was created, {@code false} if it was overwritten
     */
    Mono<Boolean> hashSet(String key, String field, String value);

    Mono<String> hashGet(String key, String field);

    Mono<Map<String, String>> hashGetAll(String key);

    /**
     * Deletes a hash field only if it still holds {@code expected}.
     *
     * @return {@code true} if deleted
     */
    Mono<Boolean> hashDeleteIfEquals(String key, String field, String expected);

    /**
     * Closes the Redis connection.
     */
    void close();

    /**
     * One stream entry.
     */
    record StreamEntry(String id, Map<String, String> fields) {
    }
}
