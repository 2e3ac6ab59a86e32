package com.qqsuccubus.roomcast.core.msg;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.qqsuccubus.roomcast.core.util.JsonUtils;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Server-to-client frames: {@code {type, ...}}.
 * <p>
 * Channel envelopes are rendered per channel kind by {@link #fromEnvelope(Envelope)}:
 * <ul>
 *   <li>room → {@code room_message}</li>
 *   <li>gated → {@code gated_message}</li>
 *   <li>direct → {@code private_message}</li>
 *   <li>status → {@code status}</li>
 * </ul>
 * </p>
 */
public final class OutboundFrames {
    private OutboundFrames() {
    }

    /**
     * Common shape of every outbound frame.
     */
    public interface OutboundFrame {
        @JsonProperty("type")
        String getType();

        default String toJson() {
            return JsonUtils.writeValueAsString(this);
        }
    }

    public static OutboundFrame fromEnvelope(Envelope envelope) {
        ChannelId channel = envelope.getChannel();
        return switch (channel.getKind()) {
            case ROOM -> new RoomMessage(
                envelope.getMsgId(),
                channel.getName(),
                channel.key(),
                envelope.getFrom(),
                Payloads.Chat.fromJson(envelope.getPayloadJson()).getMessage(),
                timestamp(envelope.getTs())
            );
            case GATED -> new GatedMessage(
                envelope.getMsgId(),
                channel.requiredAttributes(),
                channel.key(),
                envelope.getFrom(),
                Payloads.Chat.fromJson(envelope.getPayloadJson()).getMessage(),
                timestamp(envelope.getTs())
            );
            case DIRECT -> new PrivateMessage(
                envelope.getMsgId(),
                envelope.getFrom(),
                channel.getName(),
                Payloads.Chat.fromJson(envelope.getPayloadJson()).getMessage(),
                timestamp(envelope.getTs())
            );
            case STATUS -> {
                Payloads.Presence presence = Payloads.Presence.fromJson(envelope.getPayloadJson());
                yield new Status(envelope.getFrom(), presence.isOnline(), timestamp(presence.getLastSeen()));
            }
        };
    }

    public static List<OutboundFrame> fromEnvelopes(List<Envelope> envelopes) {
        List<OutboundFrame> frames = new ArrayList<>(envelopes.size());
        for (Envelope envelope : envelopes) {
            frames.add(fromEnvelope(envelope));
        }
        return frames;
    }

    public static String timestamp(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis).toString();
    }

    @Value
    @Builder
    @JsonPropertyOrder({"type"})
    public static class Welcome implements OutboundFrame {
        @JsonProperty("wallet_address")
        String walletAddress;

        @JsonProperty("connection_id")
        String connectionId;

        @JsonProperty("nft_holdings")
        Set<String> attributes;

        @JsonProperty("node_id")
        String nodeId;

        @JsonProperty("message")
        String message;

        @Override
        public String getType() {
            return FrameTypes.WELCOME;
        }
    }

    @Value
    @JsonPropertyOrder({"type"})
    public static class ErrorReply implements OutboundFrame {
        @JsonProperty("code")
        String code;

        @JsonProperty("message")
        String message;

        /**
         * Seconds until the rejected action may be retried; only set for rate-limit denials.
         */
        @JsonProperty("retry_after")
        Long retryAfter;

        @Override
        public String getType() {
            return FrameTypes.ERROR;
        }
    }

    @Value
    @JsonPropertyOrder({"type"})
    public static class HeartbeatAck implements OutboundFrame {
        @JsonProperty("wallet_address")
        String walletAddress;

        @JsonProperty("timestamp")
        String timestamp;

        @Override
        public String getType() {
            return FrameTypes.HEARTBEAT_ACK;
        }
    }

    @Value
    @Builder
    @JsonPropertyOrder({"type"})
    public static class RoomJoined implements OutboundFrame {
        @JsonProperty("channel")
        String channel;

        @JsonProperty("room_id")
        String roomId;

        @JsonProperty("required_attributes")
        Set<String> requiredAttributes;

        @JsonProperty("recent")
        List<OutboundFrame> recent;

        @Override
        public String getType() {
            return FrameTypes.ROOM_JOINED;
        }
    }

    @Value
    @JsonPropertyOrder({"type"})
    public static class RoomLeft implements OutboundFrame {
        @JsonProperty("channel")
        String channel;

        @Override
        public String getType() {
            return FrameTypes.ROOM_LEFT;
        }
    }

    @Value
    @JsonPropertyOrder({"type"})
    public static class RoomMessage implements OutboundFrame {
        @JsonProperty("message_id")
        String messageId;

        @JsonProperty("room_id")
        String roomId;

        @JsonProperty("channel")
        String channel;

        @JsonProperty("wallet_address")
        String walletAddress;

        @JsonProperty("content")
        String content;

        @JsonProperty("timestamp")
        String timestamp;

        @Override
        public String getType() {
            return FrameTypes.ROOM_MESSAGE;
        }
    }

    @Value
    @JsonPropertyOrder({"type"})
    public static class GatedMessage implements OutboundFrame {
        @JsonProperty("message_id")
        String messageId;

        @JsonProperty("required_attributes")
        Set<String> requiredAttributes;

        @JsonProperty("channel")
        String channel;

        @JsonProperty("wallet_address")
        String walletAddress;

        @JsonProperty("content")
        String content;

        @JsonProperty("timestamp")
        String timestamp;

        @Override
        public String getType() {
            return FrameTypes.GATED_MESSAGE;
        }
    }

    @Value
    @JsonPropertyOrder({"type"})
    public static class PrivateMessage implements OutboundFrame {
        @JsonProperty("message_id")
        String messageId;

        @JsonProperty("from_wallet")
        String fromWallet;

        @JsonProperty("to_wallet")
        String toWallet;

        @JsonProperty("content")
        String content;

        @JsonProperty("timestamp")
        String timestamp;

        @Override
        public String getType() {
            return FrameTypes.PRIVATE_MESSAGE;
        }
    }

    @Value
    @JsonPropertyOrder({"type"})
    public static class MessageSent implements OutboundFrame {
        @JsonProperty("message_id")
        String messageId;

        @JsonProperty("target_wallet")
        String targetWallet;

        @Override
        public String getType() {
            return FrameTypes.MESSAGE_SENT;
        }
    }

    @Value
    @JsonPropertyOrder({"type"})
    public static class Status implements OutboundFrame {
        @JsonProperty("actor")
        String actor;

        @JsonProperty("online")
        boolean online;

        @JsonProperty("last_seen")
        String lastSeen;

        @Override
        public String getType() {
            return FrameTypes.STATUS;
        }
    }

    @Value
    @JsonPropertyOrder({"type"})
    public static class OnlineUsers implements OutboundFrame {
        @JsonProperty("users")
        List<String> users;

        @JsonProperty("count")
        int count;

        @Override
        public String getType() {
            return FrameTypes.ONLINE_USERS;
        }
    }

    @Value
    @Builder
    @JsonPropertyOrder({"type"})
    public static class Stats implements OutboundFrame {
        @JsonProperty("node_id")
        String nodeId;

        @JsonProperty("connections")
        int connections;

        @JsonProperty("unique_wallets")
        int uniqueWallets;

        @JsonProperty("channels")
        int channels;

        @JsonProperty("online_users_count")
        int onlineUsersCount;

        @Override
        public String getType() {
            return FrameTypes.STATS;
        }
    }

    @Value
    @JsonPropertyOrder({"type"})
    public static class RecentMessages implements OutboundFrame {
        @JsonProperty("channel")
        String channel;

        @JsonProperty("messages")
        List<OutboundFrame> messages;

        @Override
        public String getType() {
            return FrameTypes.RECENT_MESSAGES;
        }
    }

    @Value
    @JsonPropertyOrder({"type"})
    public static class LoggedOut implements OutboundFrame {
        @JsonProperty("wallet_address")
        String walletAddress;

        @Override
        public String getType() {
            return FrameTypes.LOGGED_OUT;
        }
    }
}
