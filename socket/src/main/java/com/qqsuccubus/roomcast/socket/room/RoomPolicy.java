package com.qqsuccubus.roomcast.socket.room;

import lombok.Value;

import java.util.Set;

/**
 * Gating requirement of a room: a joiner must hold at least one of {@link #requiredAttributes};
 * an empty set means the room is open.
 */
@Value
public class RoomPolicy {
    String roomId;
    Set<String> requiredAttributes;

    public static RoomPolicy open(String roomId) {
        return new RoomPolicy(roomId, Set.of());
    }

    public boolean isGated() {
        return !requiredAttributes.isEmpty();
    }
}
