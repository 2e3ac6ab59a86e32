package com.qqsuccubus.roomcast.socket.room;

import com.qqsuccubus.roomcast.socket.config.SocketConfig;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;

/**
 * Room directory backed by {@code GATED_ROOMS}. Rooms not listed there are open when
 * {@code OPEN_ROOMS_BY_DEFAULT} is set and unknown otherwise.
 */
public class ConfiguredRoomDirectory implements IRoomDirectory {
    private final Map<String, Set<String>> gatedRooms;
    private final boolean openByDefault;

    public ConfiguredRoomDirectory(Map<String, Set<String>> gatedRooms, boolean openByDefault) {
        this.gatedRooms = Map.copyOf(gatedRooms);
        this.openByDefault = openByDefault;
    }

    public static ConfiguredRoomDirectory fromConfig(SocketConfig config) {
        return new ConfiguredRoomDirectory(config.getGatedRooms(), config.isOpenRoomsByDefault());
    }

    @Override
    public Mono<RoomPolicy> lookup(String roomId) {
        Set<String> required = gatedRooms.get(roomId);
        if (required != null) {
            return Mono.just(new RoomPolicy(roomId, required));
        }
        return openByDefault ? Mono.just(RoomPolicy.open(roomId)) : Mono.empty();
    }
}
