package com.qqsuccubus.roomcast.socket.config;

import com.qqsuccubus.roomcast.core.ratelimit.RateLimitPolicy;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Configuration for a socket node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    String nodeId;
    int httpPort;
    String redisUrl;

    /**
     * {@code memory} or {@code redis}.
     */
    String messageStore;

    /**
     * {@code memory} or {@code redis}.
     */
    String presenceStore;

    /**
     * Identity service endpoint; tokens are POSTed here.
     */
    String identityUrl;

    /**
     * Ring buffer capacity per channel.
     */
    int channelBufferSize;

    /**
     * Maximum messages kept per channel by the message store.
     */
    int historyMaxLen;

    int perConnBufferSize;

    /**
     * Maximum chat message length in characters.
     */
    int maxMessageLength;

    int pingInterval;
    int idleTimeout;
    int authTimeoutSec;
    int presenceSweepIntervalSec;
    int presenceThresholdSec;
    int channelIdleTtlSec;
    int rateLimitEvictSec;
    int drainDurationSec;
    int drainTimeoutSec;

    /**
     * Upper bound on a single message store call made while handling a frame.
     */
    int storeTimeoutSec;

    /**
     * Rooms requiring attributes: room id → attributes, at least one of which must be held.
     */
    @Builder.Default
    Map<String, Set<String>> gatedRooms = Collections.emptyMap();

    /**
     * Whether room ids absent from {@link #gatedRooms} are open rooms (otherwise unknown).
     */
    boolean openRoomsByDefault;

    @Builder.Default
    RateLimitPolicy rateLimitPolicy = RateLimitPolicy.defaults();

    boolean useVirtualThreads;

    public static SocketConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    public static SocketConfig fromEnv(Function<String, String> env) {
        SocketConfig config = SocketConfig.builder()
                .nodeId(getEnv(env, "NODE_ID", "socket-node-1"))
                .httpPort(Integer.parseInt(getEnv(env, "HTTP_PORT", "8080")))
                .redisUrl(getEnv(env, "REDIS_URL", "redis://localhost:6379"))
                .messageStore(getEnv(env, "MESSAGE_STORE", "memory"))
                .presenceStore(getEnv(env, "PRESENCE_STORE", "memory"))
                .identityUrl(getEnv(env, "IDENTITY_URL", "http://localhost:8000/api/auth/verify"))
                .channelBufferSize(Integer.parseInt(getEnv(env, "CHANNEL_BUFFER_SIZE", "50")))
                .historyMaxLen(Integer.parseInt(getEnv(env, "HISTORY_MAX_LEN", "1000")))
                .perConnBufferSize(Integer.parseInt(getEnv(env, "PER_CONN_BUFFER_SIZE", "256")))
                .maxMessageLength(Integer.parseInt(getEnv(env, "MAX_MESSAGE_LENGTH", "4000")))
                .pingInterval(Integer.parseInt(getEnv(env, "PING_INTERVAL", "10")))
                .idleTimeout(Integer.parseInt(getEnv(env, "IDLE_TIMEOUT", "60")))
                .authTimeoutSec(Integer.parseInt(getEnv(env, "AUTH_TIMEOUT_SEC", "10")))
                .presenceSweepIntervalSec(Integer.parseInt(getEnv(env, "PRESENCE_SWEEP_INTERVAL_SEC", "30")))
                .presenceThresholdSec(Integer.parseInt(getEnv(env, "PRESENCE_THRESHOLD_SEC", "90")))
                .channelIdleTtlSec(Integer.parseInt(getEnv(env, "CHANNEL_IDLE_TTL_SEC", "300")))
                .rateLimitEvictSec(Integer.parseInt(getEnv(env, "RATE_LIMIT_EVICT_SEC", "60")))
                .drainDurationSec(Integer.parseInt(getEnv(env, "DRAIN_DURATION_SEC", "60")))
                .drainTimeoutSec(Integer.parseInt(getEnv(env, "DRAIN_TIMEOUT_SEC", "30")))
                .storeTimeoutSec(Integer.parseInt(getEnv(env, "STORE_TIMEOUT_SEC", "5")))
                .gatedRooms(parseGatedRooms(getEnv(env, "GATED_ROOMS", "")))
                .openRoomsByDefault(Boolean.parseBoolean(getEnv(env, "OPEN_ROOMS_BY_DEFAULT", "true")))
                .rateLimitPolicy(RateLimitPolicy.fromEnv(env))
                .useVirtualThreads(Boolean.parseBoolean(getEnv(env, "USE_VIRTUAL_THREADS", "false")))
                .build();
        config.validate();
        return config;
    }

    /**
     * Fails fast on settings that would make presence flap.
     *
     * @throws IllegalStateException if the configuration is inconsistent
     */
    public void validate() {
        if (presenceSweepIntervalSec <= 0) {
            throw new IllegalStateException("PRESENCE_SWEEP_INTERVAL_SEC must be positive");
        }
        if (presenceThresholdSec <= presenceSweepIntervalSec) {
            throw new IllegalStateException(String.format(
                "PRESENCE_THRESHOLD_SEC (%d) must exceed PRESENCE_SWEEP_INTERVAL_SEC (%d)",
                presenceThresholdSec, presenceSweepIntervalSec));
        }
        if (storeTimeoutSec <= 0) {
            throw new IllegalStateException("STORE_TIMEOUT_SEC must be positive");
        }
        if (channelBufferSize <= 0 || perConnBufferSize <= 0) {
            throw new IllegalStateException("Buffer sizes must be positive");
        }
    }

    /**
     * Parses {@code vip=nft-a|nft-b;whales=nft-c}.
     */
    static Map<String, Set<String>> parseGatedRooms(String value) {
        Map<String, Set<String>> rooms = new LinkedHashMap<>();
        if (value == null || value.isBlank()) {
            return rooms;
        }
        for (String entry : value.split(";")) {
            if (entry.isBlank()) {
                continue;
            }
            int idx = entry.indexOf('=');
            if (idx <= 0) {
                throw new IllegalArgumentException("Malformed GATED_ROOMS entry: " + entry);
            }
            Set<String> attributes = new LinkedHashSet<>();
            for (String attribute : entry.substring(idx + 1).split("\\|")) {
                if (!attribute.isBlank()) {
                    attributes.add(attribute.trim());
                }
            }
            rooms.put(entry.substring(0, idx).trim(), Collections.unmodifiableSet(attributes));
        }
        return rooms;
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null ? value : defaultValue;
    }
}
