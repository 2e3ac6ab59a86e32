package com.qqsuccubus.roomcast.socket.room;

import reactor.core.publisher.Mono;

/**
 * Resolves room ids to their gating policy.
 */
public interface IRoomDirectory {

    /**
     * @return the room's policy, or empty if the room does not exist
     */
    Mono<RoomPolicy> lookup(String roomId);
}
