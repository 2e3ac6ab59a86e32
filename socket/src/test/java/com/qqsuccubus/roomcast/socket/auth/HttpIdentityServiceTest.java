package com.qqsuccubus.roomcast.socket.auth;

import com.qqsuccubus.roomcast.core.error.AuthenticationException;
import com.qqsuccubus.roomcast.core.error.DependencyException;
import com.qqsuccubus.roomcast.core.model.Actor;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HttpIdentityServiceTest {

    @Test
    void testToActor_okResponse() {
        Actor actor = HttpIdentityService.toActor(200,
            "{\"wallet_address\":\"7xKX\",\"nft_holdings\":[\"nft-a\",\"nft-b\"],\"extra\":1}");

        assertEquals("7xKX", actor.getWalletAddress());
        assertEquals(Set.of("nft-a", "nft-b"), actor.getAttributes());
    }

    @Test
    void testToActor_missingHoldingsMeansNoAttributes() {
        Actor actor = HttpIdentityService.toActor(200, "{\"wallet_address\":\"7xKX\"}");

        assertEquals(Set.of(), actor.getAttributes());
    }

    @Test
    void testToActor_rejectedToken() {
        assertThrows(AuthenticationException.class, () -> HttpIdentityService.toActor(401, ""));
        assertThrows(AuthenticationException.class, () -> HttpIdentityService.toActor(403, "{}"));
        assertThrows(AuthenticationException.class, () -> HttpIdentityService.toActor(200, "{}"));
    }

    @Test
    void testToActor_serverErrorIsDependencyFailure() {
        assertThrows(DependencyException.class, () -> HttpIdentityService.toActor(500, "oops"));
        assertThrows(DependencyException.class, () -> HttpIdentityService.toActor(404, ""));
    }

    @Test
    void testAuthenticate_blankTokenFailsWithoutCall() {
        HttpIdentityService service = new HttpIdentityService("http://127.0.0.1:1/verify", Duration.ofSeconds(1));

        StepVerifier.create(service.authenticate(" "))
            .expectError(AuthenticationException.class)
            .verify();
    }
}
