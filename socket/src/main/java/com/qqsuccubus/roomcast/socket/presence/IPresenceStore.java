package com.qqsuccubus.roomcast.socket.presence;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Keyed last-seen timestamps, one per actor.
 */
public interface IPresenceStore {

    /**
     * Records a heartbeat.
     *
     * @return {@code true} if the actor had no record before
     */
    Mono<Boolean> touch(String wallet, long nowMs);

    /**
     * Last heartbeat of an actor; empty if none.
     */
    Mono<Long> lastSeen(String wallet);

    /**
     * Every tracked actor with its last heartbeat.
     */
    Mono<Map<String, Long>> snapshot();

    /**
     * Removes the record only if it still holds {@code expectedMs}, so a heartbeat racing with the
     * sweep wins.
     *
     * @return {@code true} if removed
     */
    Mono<Boolean> removeIfUnchanged(String wallet, long expectedMs);
}
