package com.qqsuccubus.roomcast.core.msg;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Client-to-server frame: {@code {type, ...type-specific fields}}.
 * <p>
 * Only the fields relevant to {@link #type} are populated; the router validates presence.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class InboundFrame {

    @JsonProperty("type")
    String type;

    /**
     * Credentials for {@code auth}.
     */
    @JsonProperty("token")
    String token;

    @JsonProperty("room_id")
    String roomId;

    /**
     * Chat content for room, gated and private messages.
     */
    @JsonProperty("message")
    String message;

    @JsonProperty("target_wallet")
    String targetWallet;

    @JsonProperty("required_attributes")
    List<String> requiredAttributes;

    /**
     * Optional history size for {@code get_recent}.
     */
    @JsonProperty("limit")
    Integer limit;
}
