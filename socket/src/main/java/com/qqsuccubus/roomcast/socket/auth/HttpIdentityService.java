package com.qqsuccubus.roomcast.socket.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qqsuccubus.roomcast.core.error.AuthenticationException;
import com.qqsuccubus.roomcast.core.error.DependencyException;
import com.qqsuccubus.roomcast.core.error.RoomcastException;
import com.qqsuccubus.roomcast.core.model.Actor;
import com.qqsuccubus.roomcast.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Verifies tokens against an HTTP identity endpoint.
 * <p>
 * Request: {@code POST <url> {"token": "..."}}. Response 200:
 * {@code {"wallet_address": "...", "nft_holdings": ["..."]}}; 401/403 rejects the token; anything
 * else is treated as the service being unavailable.
 * </p>
 */
public class HttpIdentityService implements IIdentityService {
    private static final Logger log = LoggerFactory.getLogger(HttpIdentityService.class);

    private final HttpClient httpClient;
    private final String url;

    public HttpIdentityService(String url, Duration timeout) {
        this(HttpClient.create(), url, timeout);
    }

    HttpIdentityService(HttpClient httpClient, String url, Duration timeout) {
        this.httpClient = httpClient
                .headers(h -> h
                        .set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON)
                        .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON))
                .responseTimeout(timeout);
        this.url = url;
        log.info("HttpIdentityService initialized with {}", url);
    }

    @Override
    public Mono<Actor> authenticate(String token) {
        if (token == null || token.isBlank()) {
            return Mono.error(new AuthenticationException("Token is required"));
        }
        String body = JsonUtils.writeValueAsString(Map.of("token", token));

        return httpClient.post()
                .uri(url)
                .send(ByteBufFlux.fromString(Mono.just(body)))
                .responseSingle((response, content) -> content.asString()
                        .defaultIfEmpty("")
                        .map(text -> toActor(response.status().code(), text)))
                .onErrorMap(err -> !(err instanceof RoomcastException),
                        err -> new DependencyException("Identity service unavailable: " + err.getMessage(), err))
                .doOnError(err -> log.debug("Token verification failed: {}", err.getMessage()));
    }

    static Actor toActor(int status, String body) {
        if (status == 401 || status == 403) {
            throw new AuthenticationException("Invalid or expired token");
        }
        if (status != 200) {
            throw new DependencyException("Identity service returned HTTP " + status);
        }
        IdentityResponse response = JsonUtils.readValue(body, IdentityResponse.class);
        if (response.getWalletAddress() == null || response.getWalletAddress().isBlank()) {
            throw new AuthenticationException("Identity response carries no wallet address");
        }
        return new Actor(response.getWalletAddress(), response.getNftHoldings());
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class IdentityResponse {
        @JsonProperty("wallet_address")
        private String walletAddress;

        @JsonProperty("nft_holdings")
        private List<String> nftHoldings;
    }
}
