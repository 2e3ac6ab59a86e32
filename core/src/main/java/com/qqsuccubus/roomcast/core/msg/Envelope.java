package com.qqsuccubus.roomcast.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Immutable unit of published data.
 * <p>
 * <b>Ordering guarantee:</b> envelopes published to the same channel reach every subscriber
 * in publish order. Nothing is guaranteed across channels.
 * </p>
 * <p>
 * <b>At-most-once:</b> fan-out delivers an envelope at most once per subscriber; late joiners
 * only see what is still in the channel's recent buffer.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class Envelope {
    /**
     * Store-assigned message identifier; status events use a generated UUID.
     */
    @JsonProperty("msgId")
    String msgId;

    /**
     * Target channel.
     */
    @JsonProperty("channel")
    ChannelId channel;

    /**
     * Sender wallet address (the subject actor for status events).
     */
    @JsonProperty("from")
    String from;

    /**
     * JSON-encoded payload. Opaque to the broker.
     */
    @JsonProperty("payloadJson")
    String payloadJson;

    /**
     * Publish timestamp (epoch millis).
     */
    @JsonProperty("ts")
    long ts;

    @JsonCreator
    public Envelope(
        @JsonProperty("msgId") String msgId,
        @JsonProperty("channel") ChannelId channel,
        @JsonProperty("from") String from,
        @JsonProperty("payloadJson") String payloadJson,
        @JsonProperty("ts") long ts
    ) {
        this.msgId = msgId;
        this.channel = channel;
        this.from = from;
        this.payloadJson = payloadJson;
        this.ts = ts;
    }
}
