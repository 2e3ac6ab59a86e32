package com.qqsuccubus.roomcast.core.model;

import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Verified external identity plus the authorization attributes (token/NFT holdings) it had at
 * authentication time.
 * <p>
 * Attributes are a snapshot and are never refreshed while a connection is open.
 * </p>
 */
@Value
public class Actor {
    /**
     * Stable identity (wallet address).
     */
    String walletAddress;

    Set<String> attributes;

    public Actor(String walletAddress, Collection<String> attributes) {
        if (walletAddress == null || walletAddress.isBlank()) {
            throw new IllegalArgumentException("walletAddress must not be blank");
        }
        this.walletAddress = walletAddress;
        this.attributes = attributes == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(attributes));
    }

    /**
     * Whether this actor may enter a scope gated on {@code requiredAttributes}: an empty requirement
     * admits everyone, otherwise at least one attribute must be held.
     */
    public boolean satisfies(Set<String> requiredAttributes) {
        if (requiredAttributes == null || requiredAttributes.isEmpty()) {
            return true;
        }
        for (String required : requiredAttributes) {
            if (attributes.contains(required)) {
                return true;
            }
        }
        return false;
    }
}
