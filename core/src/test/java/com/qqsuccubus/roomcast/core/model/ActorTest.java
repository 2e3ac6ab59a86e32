package com.qqsuccubus.roomcast.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ActorTest {

    @Test
    void testEmptyRequirementAdmitsEveryone() {
        Actor actor = new Actor("wallet-a", List.of());

        assertTrue(actor.satisfies(Set.of()));
        assertTrue(actor.satisfies(null));
    }

    @Test
    void testRequirementNeedsIntersection() {
        Actor actor = new Actor("wallet-a", List.of("nft-a", "nft-c"));

        assertTrue(actor.satisfies(Set.of("nft-b", "nft-c")));
        assertFalse(actor.satisfies(Set.of("nft-b", "nft-d")));
    }

    @Test
    void testAttributesAreASnapshot() {
        List<String> holdings = new java.util.ArrayList<>(List.of("nft-a"));
        Actor actor = new Actor("wallet-a", holdings);

        holdings.add("nft-b");

        assertEquals(Set.of("nft-a"), actor.getAttributes());
        assertThrows(UnsupportedOperationException.class, () -> actor.getAttributes().add("nft-b"));
    }

    @Test
    void testBlankWalletRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Actor(" ", List.of()));
    }
}
