package com.qqsuccubus.roomcast.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qqsuccubus.roomcast.core.util.JsonUtils;
import lombok.Value;

/**
 * Payload shapes carried in {@link Envelope#getPayloadJson()}.
 */
public final class Payloads {
    private Payloads() {
    }

    /**
     * Chat content published to room, gated and direct channels.
     */
    @Value
    public static class Chat {
        @JsonProperty("message")
        String message;

        @JsonCreator
        public Chat(@JsonProperty("message") String message) {
            this.message = message;
        }

        public String toJson() {
            return JsonUtils.writeValueAsString(this);
        }

        public static Chat fromJson(String json) {
            return JsonUtils.readValue(json, Chat.class);
        }
    }

    /**
     * Presence transition published to the status channel.
     */
    @Value
    public static class Presence {
        @JsonProperty("online")
        boolean online;

        /**
         * Last heartbeat (epoch millis).
         */
        @JsonProperty("last_seen")
        long lastSeen;

        @JsonCreator
        public Presence(
            @JsonProperty("online") boolean online,
            @JsonProperty("last_seen") long lastSeen
        ) {
            this.online = online;
            this.lastSeen = lastSeen;
        }

        public String toJson() {
            return JsonUtils.writeValueAsString(this);
        }

        public static Presence fromJson(String json) {
            return JsonUtils.readValue(json, Presence.class);
        }
    }
}
