package com.qqsuccubus.roomcast.socket.support;

import com.qqsuccubus.roomcast.core.error.AuthenticationException;
import com.qqsuccubus.roomcast.core.error.DependencyException;
import com.qqsuccubus.roomcast.core.model.Actor;
import com.qqsuccubus.roomcast.socket.auth.IIdentityService;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identity service with a fixed token table. The token {@link #UNAVAILABLE} simulates an outage.
 */
public class StubIdentityService implements IIdentityService {
    public static final String UNAVAILABLE = "identity-down";

    private final Map<String, Actor> actors = new ConcurrentHashMap<>();

    public StubIdentityService register(String token, String wallet, String... attributes) {
        actors.put(token, new Actor(wallet, List.of(attributes)));
        return this;
    }

    @Override
    public Mono<Actor> authenticate(String token) {
        if (UNAVAILABLE.equals(token)) {
            return Mono.error(new DependencyException("Identity service unavailable"));
        }
        Actor actor = token == null ? null : actors.get(token);
        if (actor == null) {
            return Mono.error(new AuthenticationException("Invalid or expired token"));
        }
        return Mono.just(actor);
    }
}
