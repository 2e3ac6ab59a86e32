package com.qqsuccubus.roomcast.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Identifies a broadcast channel.
 * <p>
 * Key format: {@code <kind>:<name>}, e.g. {@code room:R1}, {@code gated:nft-a,nft-b},
 * {@code direct:7xKXtg2CW87d97TXJSDpbD5jBkheTqA83TZRuJosgAsU}. The status channel has no name: {@code status}.
 * Gated channel names are the sorted, comma-joined attribute set so that the same requirement always
 * resolves to the same channel.
 * </p>
 */
@Getter
@EqualsAndHashCode
public final class ChannelId {
    private static final String SEPARATOR = ":";
    private static final String ATTRIBUTE_SEPARATOR = ",";
    private static final ChannelId STATUS = new ChannelId(ChannelKind.STATUS, "");

    private final ChannelKind kind;
    private final String name;

    private ChannelId(ChannelKind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public static ChannelId room(String roomId) {
        requireName(roomId, "roomId");
        return new ChannelId(ChannelKind.ROOM, roomId);
    }

    public static ChannelId gated(Collection<String> requiredAttributes) {
        if (requiredAttributes == null || requiredAttributes.isEmpty()) {
            throw new IllegalArgumentException("Gated channel requires at least one attribute");
        }
        Set<String> sorted = new TreeSet<>();
        for (String attribute : requiredAttributes) {
            requireName(attribute, "attribute");
            if (attribute.contains(ATTRIBUTE_SEPARATOR)) {
                throw new IllegalArgumentException("Attribute must not contain '" + ATTRIBUTE_SEPARATOR + "': " + attribute);
            }
            sorted.add(attribute);
        }
        return new ChannelId(ChannelKind.GATED, String.join(ATTRIBUTE_SEPARATOR, sorted));
    }

    public static ChannelId direct(String walletAddress) {
        requireName(walletAddress, "walletAddress");
        return new ChannelId(ChannelKind.DIRECT, walletAddress);
    }

    public static ChannelId status() {
        return STATUS;
    }

    /**
     * Parses a channel key produced by {@link #key()}.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ChannelId parse(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Channel key is blank");
        }
        if (key.equals(ChannelKind.STATUS.prefix())) {
            return STATUS;
        }
        int idx = key.indexOf(SEPARATOR);
        if (idx <= 0 || idx == key.length() - 1) {
            throw new IllegalArgumentException("Malformed channel key: " + key);
        }
        ChannelKind kind = ChannelKind.fromPrefix(key.substring(0, idx));
        String name = key.substring(idx + 1);
        return switch (kind) {
            case ROOM -> room(name);
            case GATED -> gated(Arrays.asList(name.split(ATTRIBUTE_SEPARATOR)));
            case DIRECT -> direct(name);
            case STATUS -> throw new IllegalArgumentException("Malformed channel key: " + key);
        };
    }

    /**
     * Attributes a subscriber must intersect; empty for every kind except {@link ChannelKind#GATED}.
     */
    public Set<String> requiredAttributes() {
        if (kind != ChannelKind.GATED) {
            return Collections.emptySet();
        }
        return Arrays.stream(name.split(ATTRIBUTE_SEPARATOR))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @JsonValue
    public String key() {
        return kind == ChannelKind.STATUS ? kind.prefix() : kind.prefix() + SEPARATOR + name;
    }

    @Override
    public String toString() {
        return key();
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
    }
}
