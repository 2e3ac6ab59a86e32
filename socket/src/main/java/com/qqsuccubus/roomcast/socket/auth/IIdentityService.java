package com.qqsuccubus.roomcast.socket.auth;

import com.qqsuccubus.roomcast.core.model.Actor;
import reactor.core.publisher.Mono;

/**
 * External identity/authorization check.
 */
public interface IIdentityService {

    /**
     * Verifies credentials and returns the actor with its current attributes.
     * <p>
     * Fails with {@link com.qqsuccubus.roomcast.core.error.AuthenticationException} when the
     * credentials are rejected and {@link com.qqsuccubus.roomcast.core.error.DependencyException}
     * when the service cannot be reached.
     * </p>
     */
    Mono<Actor> authenticate(String token);
}
