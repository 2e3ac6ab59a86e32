package com.qqsuccubus.roomcast.socket.router;

import com.qqsuccubus.roomcast.core.error.AuthenticationException;
import com.qqsuccubus.roomcast.core.error.AuthorizationException;
import com.qqsuccubus.roomcast.core.error.DependencyException;
import com.qqsuccubus.roomcast.core.error.ErrorCode;
import com.qqsuccubus.roomcast.core.error.RateLimitExceededException;
import com.qqsuccubus.roomcast.core.error.RoomcastException;
import com.qqsuccubus.roomcast.core.error.ValidationException;
import com.qqsuccubus.roomcast.core.model.Actor;
import com.qqsuccubus.roomcast.core.msg.ChannelId;
import com.qqsuccubus.roomcast.core.msg.Envelope;
import com.qqsuccubus.roomcast.core.msg.FrameTypes;
import com.qqsuccubus.roomcast.core.msg.InboundFrame;
import com.qqsuccubus.roomcast.core.msg.OutboundFrames;
import com.qqsuccubus.roomcast.core.msg.OutboundFrames.ErrorReply;
import com.qqsuccubus.roomcast.core.msg.Payloads;
import com.qqsuccubus.roomcast.core.ratelimit.ActionClass;
import com.qqsuccubus.roomcast.core.ratelimit.Decision;
import com.qqsuccubus.roomcast.core.ratelimit.RateLimitKey;
import com.qqsuccubus.roomcast.core.ratelimit.RateLimitPolicy;
import com.qqsuccubus.roomcast.core.ratelimit.RateLimiter;
import com.qqsuccubus.roomcast.core.util.BytesUtils;
import com.qqsuccubus.roomcast.core.util.JsonUtils;
import com.qqsuccubus.roomcast.socket.auth.IIdentityService;
import com.qqsuccubus.roomcast.socket.config.SocketConfig;
import com.qqsuccubus.roomcast.socket.metrics.MetricsService;
import com.qqsuccubus.roomcast.socket.presence.PresenceMonitor;
import com.qqsuccubus.roomcast.socket.pubsub.Backfill;
import com.qqsuccubus.roomcast.socket.pubsub.PubSubBroker;
import com.qqsuccubus.roomcast.socket.pubsub.Subscription;
import com.qqsuccubus.roomcast.socket.room.IRoomDirectory;
import com.qqsuccubus.roomcast.socket.session.CloseCodes;
import com.qqsuccubus.roomcast.socket.session.Connection;
import com.qqsuccubus.roomcast.socket.session.ConnectionFactory;
import com.qqsuccubus.roomcast.socket.session.ConnectionRegistry;
import com.qqsuccubus.roomcast.socket.session.ConnectionState;
import com.qqsuccubus.roomcast.socket.store.IMessageStore;
import com.qqsuccubus.roomcast.socket.ws.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.netty.channel.AbortedException;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Drives one reactive pipeline per connection: authentication, frame dispatch, replies and cleanup.
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>auth: {token}</li>
 *   <li>heartbeat: {}</li>
 *   <li>join_room / leave_room: {room_id}</li>
 *   <li>join_gated / leave_gated: {required_attributes}</li>
 *   <li>room_message: {room_id, message}</li>
 *   <li>gated_message: {required_attributes, message}</li>
 *   <li>private_message: {target_wallet, message}</li>
 *   <li>get_online_users, stats: {}</li>
 *   <li>get_recent: {room_id, limit?}</li>
 *   <li>logout: {}</li>
 * </ul>
 * </p>
 * <p>
 * Inbound frames of a connection are handled strictly one at a time. Every action is checked against
 * the rate limiter before it has any side effect. Cleanup runs exactly once whichever way the
 * pipeline ends, including cancellation.
 * </p>
 */
public class MessageRouter {
    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private static final Set<String> INBOUND_TYPES = Set.of(
        FrameTypes.AUTH, FrameTypes.HEARTBEAT, FrameTypes.JOIN_ROOM, FrameTypes.JOIN_GATED,
        FrameTypes.LEAVE_ROOM, FrameTypes.LEAVE_GATED, FrameTypes.ROOM_MESSAGE, FrameTypes.GATED_MESSAGE,
        FrameTypes.PRIVATE_MESSAGE, FrameTypes.GET_ONLINE_USERS, FrameTypes.STATS, FrameTypes.GET_RECENT,
        FrameTypes.LOGOUT
    );

    private final SocketConfig config;
    private final ConnectionFactory connectionFactory;
    private final ConnectionRegistry registry;
    private final IIdentityService identityService;
    private final IRoomDirectory roomDirectory;
    private final PubSubBroker broker;
    private final IMessageStore messageStore;
    private final PresenceMonitor presenceMonitor;
    private final RateLimiter rateLimiter;
    private final RateLimitPolicy rateLimitPolicy;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Scheduler timerScheduler;
    private final Duration storeTimeout;

    public MessageRouter(
            SocketConfig config,
            ConnectionFactory connectionFactory,
            ConnectionRegistry registry,
            IIdentityService identityService,
            IRoomDirectory roomDirectory,
            PubSubBroker broker,
            IMessageStore messageStore,
            PresenceMonitor presenceMonitor,
            RateLimiter rateLimiter,
            MetricsService metricsService,
            Clock clock,
            Scheduler timerScheduler
    ) {
        this.config = config;
        this.connectionFactory = connectionFactory;
        this.registry = registry;
        this.identityService = identityService;
        this.roomDirectory = roomDirectory;
        this.broker = broker;
        this.messageStore = messageStore;
        this.presenceMonitor = presenceMonitor;
        this.rateLimiter = rateLimiter;
        this.rateLimitPolicy = config.getRateLimitPolicy();
        this.metricsService = metricsService;
        this.clock = clock;
        this.timerScheduler = timerScheduler;
        this.storeTimeout = Duration.ofSeconds(config.getStoreTimeoutSec());
    }

    /**
     * Serves a freshly accepted transport until it closes.
     *
     * @param transport  accepted transport
     * @param queryToken token from the upgrade URL, authenticated before any frame is read
     * @return completes once the connection is cleaned up and the transport closed
     */
    public Mono<Void> serve(Transport transport, @Nullable String queryToken) {
        Connection connection = connectionFactory.create(transport);
        log.debug("Accepted connection {}", connection.getId());

        Disposable authTimer = Mono.delay(Duration.ofSeconds(config.getAuthTimeoutSec()), timerScheduler)
            .subscribe(tick -> {
                if (connection.getState() == ConnectionState.CONNECTING) {
                    log.info("Connection {} did not authenticate in {}s, closing",
                        connection.getId(), config.getAuthTimeoutSec());
                    connection.send(new ErrorReply(ErrorCode.AUTH_REQUIRED.name(), "Authentication timeout", null));
                    connection.requestClose(CloseCodes.AUTH_TIMEOUT, "Authentication timeout");
                }
            });

        Mono<Void> preAuth = queryToken != null
            ? authenticate(connection, queryToken).onErrorResume(err -> replyError(connection, err))
            : Mono.empty();

        // a closed transport also cancels the frame in flight, so cleanup never waits on a dependency
        Sinks.Empty<Void> receiveEnded = Sinks.empty();
        Mono<Void> inbound = preAuth
            .thenMany(transport.receive()
                .doOnTerminate(receiveEnded::tryEmitEmpty)
                .takeUntilOther(connection.onCloseRequested().thenReturn(true)))
            .concatMap(frame -> handleFrame(connection, frame))
            .takeUntilOther(receiveEnded.asMono().thenReturn(true))
            .then()
            .doFinally(signal -> cleanup(connection, authTimer));

        Mono<Void> outbound = transport.send(connection.outboundFrames()
            .doOnNext(frame -> metricsService.recordNetworkOutboundWs(BytesUtils.getBytesLength(frame))));

        return Mono.when(outbound, inbound)
            .then(Mono.defer(() -> connection.getCloseReason() != null
                ? transport.close(connection.getCloseCode(), connection.getCloseReason())
                : Mono.empty()))
            .doOnError(err -> {
                // AbortedException is expected when the peer goes away mid-write
                if (!(err instanceof AbortedException)) {
                    log.error("Connection {} failed", connection.getId(), err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .doFinally(signal -> cleanup(connection, authTimer));
    }

    private Mono<Void> handleFrame(Connection connection, String text) {
        if (connection.getCloseReason() != null) {
            return Mono.empty();
        }
        long start = System.nanoTime();
        metricsService.recordNetworkInboundWs(BytesUtils.getBytesLength(text));

        return Mono.defer(() -> {
                MDC.put("connectionId", connection.getId());
                if (connection.getWallet() != null) {
                    MDC.put("wallet", connection.getWallet());
                }
                try {
                    InboundFrame frame = parse(text);
                    if (connection.getState() == ConnectionState.CONNECTING) {
                        return handleUnauthenticated(connection, frame);
                    }
                    return handleAuthenticated(connection, frame);
                } finally {
                    MDC.remove("connectionId");
                    MDC.remove("wallet");
                }
            })
            .onErrorResume(err -> replyError(connection, err))
            .doFinally(signal -> metricsService.recordFrameLatency(start));
    }

    private Mono<Void> handleUnauthenticated(Connection connection, @Nullable InboundFrame frame) {
        enforce(connection.getId(), ActionClass.AUTH);
        if (frame == null) {
            throw new ValidationException("Malformed frame");
        }
        metricsService.recordInboundFrame(typeTag(frame));
        if (!FrameTypes.AUTH.equals(frame.getType())) {
            throw new ValidationException(ErrorCode.AUTH_REQUIRED, "Authenticate first");
        }
        return authenticate(connection, frame.getToken());
    }

    private Mono<Void> authenticate(Connection connection, @Nullable String token) {
        return identityService.authenticate(token)
            .doOnError(AuthenticationException.class, err -> metricsService.recordAuthFailure())
            .flatMap(actor -> admit(connection, actor));
    }

    private Mono<Void> admit(Connection connection, Actor actor) {
        if (!registry.isAdmitting()) {
            refuseWhileDraining(connection);
            return Mono.empty();
        }
        if (!connection.admit(actor)) {
            log.debug("Connection {} left CONNECTING before authentication finished", connection.getId());
            return Mono.empty();
        }
        String wallet = actor.getWalletAddress();
        registry.add(connection);
        metricsService.recordConnectionOpened();
        if (connection.isClosed()) {
            // closed while admitting; cleanup may already have run
            registry.remove(connection.getId()).ifPresent(c -> metricsService.recordConnectionClosed());
            return Mono.empty();
        }
        if (!registry.isAdmitting()) {
            // drain started after the check above and may have missed this connection
            refuseWhileDraining(connection);
            return Mono.empty();
        }

        subscribe(connection, ChannelId.direct(wallet));
        subscribe(connection, ChannelId.status());

        connection.send(OutboundFrames.Welcome.builder()
            .walletAddress(wallet)
            .connectionId(connection.getId())
            .attributes(actor.getAttributes())
            .nodeId(config.getNodeId())
            .message("Authenticated")
            .build());
        log.info("Connection {} authenticated as {}", connection.getId(), wallet);

        return refreshPresence(wallet);
    }

    private Mono<Void> handleAuthenticated(Connection connection, @Nullable InboundFrame frame) {
        String wallet = connection.getWallet();
        if (frame == null) {
            enforce(wallet, ActionClass.GENERIC);
            throw new ValidationException("Malformed frame");
        }
        String type = frame.getType();
        metricsService.recordInboundFrame(typeTag(frame));

        return refreshPresence(wallet)
            .then(Mono.defer(() -> {
                enforce(wallet, actionFor(type));
                connection.beginProcessing();
                return dispatch(connection, frame);
            }))
            .doFinally(signal -> connection.endProcessing());
    }

    private Mono<Void> dispatch(Connection connection, InboundFrame frame) {
        String type = frame.getType();
        if (type == null) {
            throw new ValidationException(ErrorCode.UNKNOWN_TYPE, "Missing message type");
        }
        return switch (type) {
            case FrameTypes.HEARTBEAT -> {
                connection.send(new OutboundFrames.HeartbeatAck(
                    connection.getWallet(), OutboundFrames.timestamp(clock.millis())));
                yield Mono.empty();
            }
            case FrameTypes.JOIN_ROOM -> joinRoom(connection, frame);
            case FrameTypes.JOIN_GATED -> joinGated(connection, frame);
            case FrameTypes.LEAVE_ROOM -> leave(connection, roomChannel(frame));
            case FrameTypes.LEAVE_GATED -> leave(connection, gatedChannel(frame));
            case FrameTypes.ROOM_MESSAGE -> publishChat(connection, roomChannel(frame), frame.getMessage());
            case FrameTypes.GATED_MESSAGE -> publishChat(connection, gatedChannel(frame), frame.getMessage());
            case FrameTypes.PRIVATE_MESSAGE -> privateMessage(connection, frame);
            case FrameTypes.GET_ONLINE_USERS -> presenceMonitor.onlineActors()
                .doOnNext(users -> connection.send(new OutboundFrames.OnlineUsers(users, users.size())))
                .then();
            case FrameTypes.STATS -> stats(connection);
            case FrameTypes.GET_RECENT -> recent(connection, frame);
            case FrameTypes.LOGOUT -> {
                connection.send(new OutboundFrames.LoggedOut(connection.getWallet()));
                connection.requestClose(CloseCodes.NORMAL, "Logged out");
                log.info("Connection {} logged out", connection.getId());
                yield Mono.empty();
            }
            case FrameTypes.AUTH -> throw new ValidationException("Already authenticated");
            default -> throw new ValidationException(ErrorCode.UNKNOWN_TYPE, "Unknown message type: " + type);
        };
    }

    private Mono<Void> joinRoom(Connection connection, InboundFrame frame) {
        ChannelId channel = roomChannel(frame);
        String roomId = channel.getName();
        return roomDirectory.lookup(roomId)
            .switchIfEmpty(Mono.error(() -> new ValidationException(ErrorCode.NOT_FOUND, "Room not found: " + roomId)))
            .flatMap(policy -> {
                requireAccess(connection, policy.getRequiredAttributes());
                return join(connection, channel, roomId, policy.getRequiredAttributes());
            });
    }

    private Mono<Void> joinGated(Connection connection, InboundFrame frame) {
        ChannelId channel = gatedChannel(frame);
        requireAccess(connection, channel.requiredAttributes());
        return join(connection, channel, null, channel.requiredAttributes());
    }

    private Mono<Void> join(Connection connection, ChannelId channel, @Nullable String roomId,
                            Set<String> requiredAttributes) {
        if (connection.isSubscribed(channel)) {
            connection.send(roomJoined(channel, roomId, requiredAttributes, broker.recent(channel, broker.getCapacity())));
            return Mono.empty();
        }
        return seedIfCold(channel).then(Mono.fromRunnable(() -> {
            Backfill backfill = broker.subscribeWithRecent(channel, connection, broker.getCapacity());
            if (!connection.addSubscription(backfill.getSubscription())) {
                broker.unsubscribe(backfill.getSubscription());
                return;
            }
            connection.send(roomJoined(channel, roomId, requiredAttributes, backfill.getRecent()));
            log.debug("{} joined {} ({} recent)", connection.getWallet(), channel, backfill.getRecent().size());
        }));
    }

    /**
     * Loads store history into a channel this node has not buffered yet. A failing store leaves the
     * channel cold so the next join tries again.
     */
    private Mono<Void> seedIfCold(ChannelId channel) {
        if (!broker.isCold(channel)) {
            return Mono.empty();
        }
        return withStoreTimeout(messageStore.recentHistory(channel, broker.getCapacity()).collectList(),
                "History read for " + channel)
            .doOnNext(history -> broker.seedIfCold(channel, history))
            .doOnError(err -> log.warn("Could not load history for {}: {}", channel, err.getMessage()))
            .onErrorResume(err -> Mono.empty())
            .then();
    }

    private Mono<Void> leave(Connection connection, ChannelId channel) {
        Subscription subscription = connection.removeSubscription(channel);
        if (subscription == null) {
            throw new AuthorizationException(ErrorCode.NOT_A_MEMBER, "Not a member of " + channel);
        }
        broker.unsubscribe(subscription);
        connection.send(new OutboundFrames.RoomLeft(channel.key()));
        log.debug("{} left {}", connection.getWallet(), channel);
        return Mono.empty();
    }

    private Mono<Void> publishChat(Connection connection, ChannelId channel, @Nullable String message) {
        requireMessage(message);
        if (!connection.isSubscribed(channel)) {
            throw new AuthorizationException(ErrorCode.NOT_A_MEMBER, "Join " + channel + " before sending messages");
        }
        return persist(channel, connection.getWallet(), message)
            .doOnNext(envelope -> broker.publish(channel, envelope))
            .then();
    }

    private Mono<Void> privateMessage(Connection connection, InboundFrame frame) {
        String target = requireField(frame.getTargetWallet(), "target_wallet");
        requireMessage(frame.getMessage());
        if (target.equals(connection.getWallet())) {
            throw new ValidationException("Cannot send a private message to yourself");
        }
        ChannelId channel = ChannelId.direct(target);
        return persist(channel, connection.getWallet(), frame.getMessage())
            .doOnNext(envelope -> {
                broker.publish(channel, envelope);
                connection.send(new OutboundFrames.MessageSent(envelope.getMsgId(), target));
            })
            .then();
    }

    private Mono<Envelope> persist(ChannelId channel, String from, String message) {
        long start = System.nanoTime();
        return withStoreTimeout(messageStore.persist(channel, from, new Payloads.Chat(message).toJson()),
                "Persist to " + channel)
            .doOnNext(envelope -> metricsService.recordStorePersistLatency(start));
    }

    private <T> Mono<T> withStoreTimeout(Mono<T> call, String operation) {
        return call.timeout(storeTimeout, timerScheduler)
            .onErrorMap(TimeoutException.class,
                err -> new DependencyException(operation + " timed out after " + storeTimeout, err));
    }

    private Mono<Void> stats(Connection connection) {
        return presenceMonitor.onlineActors()
            .doOnNext(online -> connection.send(OutboundFrames.Stats.builder()
                .nodeId(config.getNodeId())
                .connections(registry.size())
                .uniqueWallets(registry.uniqueActorCount())
                .channels(broker.channelCount())
                .onlineUsersCount(online.size())
                .build()))
            .then();
    }

    private Mono<Void> recent(Connection connection, InboundFrame frame) {
        ChannelId channel = roomChannel(frame);
        if (!connection.isSubscribed(channel)) {
            throw new AuthorizationException(ErrorCode.NOT_A_MEMBER, "Not a member of " + channel);
        }
        int capacity = broker.getCapacity();
        int limit = frame.getLimit() == null ? capacity : Math.max(1, Math.min(frame.getLimit(), capacity));
        List<Envelope> recent = broker.recent(channel, limit);
        connection.send(new OutboundFrames.RecentMessages(channel.key(), OutboundFrames.fromEnvelopes(recent)));
        return Mono.empty();
    }

    private Mono<Void> replyError(Connection connection, Throwable err) {
        ErrorReply reply;
        boolean fatal = false;
        if (err instanceof RateLimitExceededException limited) {
            metricsService.recordRateLimited(limited.getAction());
            reply = new ErrorReply(limited.getCode().name(), limited.getMessage(), limited.getRetryAfterSeconds());
        } else if (err instanceof DependencyException) {
            log.error("Dependency failure on connection {}", connection.getId(), err);
            reply = new ErrorReply(ErrorCode.INTERNAL_ERROR.name(), "Internal server error", null);
        } else if (err instanceof RoomcastException roomcast) {
            log.debug("Rejected frame on connection {}: {}", connection.getId(), roomcast.getMessage());
            reply = new ErrorReply(roomcast.getCode().name(), roomcast.getMessage(), null);
            fatal = roomcast.isFatal();
        } else {
            log.error("Unexpected error on connection {}", connection.getId(), err);
            reply = new ErrorReply(ErrorCode.INTERNAL_ERROR.name(), "Internal server error", null);
        }
        metricsService.recordError(reply.getCode());
        connection.send(reply);
        if (fatal) {
            connection.requestClose(CloseCodes.AUTH_FAILED, reply.getMessage());
        }
        return Mono.empty();
    }

    private void cleanup(Connection connection, Disposable authTimer) {
        authTimer.dispose();
        List<Subscription> held = connection.markClosed();
        for (Subscription subscription : held) {
            broker.unsubscribe(subscription);
        }
        registry.remove(connection.getId()).ifPresent(removed -> {
            metricsService.recordConnectionClosed();
            log.info("Connection {} ({}) closed, left {} channels",
                removed.getId(), removed.getWallet(), held.size());
        });
        connection.completeOutbound();
    }

    private void refuseWhileDraining(Connection connection) {
        log.info("Connection {} authenticated while draining, closing", connection.getId());
        connection.requestClose(CloseCodes.GOING_AWAY, "Server draining");
    }

    private void subscribe(Connection connection, ChannelId channel) {
        Subscription subscription = broker.subscribe(channel, connection);
        if (!connection.addSubscription(subscription)) {
            broker.unsubscribe(subscription);
        }
    }

    private Mono<Void> refreshPresence(String wallet) {
        return presenceMonitor.heartbeat(wallet)
            .doOnError(err -> log.warn("Presence update failed for {}: {}", wallet, err.getMessage()))
            .onErrorResume(err -> Mono.empty());
    }

    private void enforce(String actorId, ActionClass action) {
        Decision decision = rateLimiter.checkAll(RateLimitKey.of(actorId, action.key()), rateLimitPolicy.rulesFor(action));
        if (!decision.isAllowed()) {
            throw new RateLimitExceededException(action.key(), decision.getRetryAfter());
        }
    }

    private void requireAccess(Connection connection, Set<String> requiredAttributes) {
        if (!connection.getActor().satisfies(requiredAttributes)) {
            throw new AuthorizationException(ErrorCode.ACCESS_DENIED,
                "Holding one of " + requiredAttributes + " is required");
        }
    }

    private OutboundFrames.RoomJoined roomJoined(ChannelId channel, @Nullable String roomId,
                                                 Set<String> requiredAttributes, List<Envelope> recent) {
        return OutboundFrames.RoomJoined.builder()
            .channel(channel.key())
            .roomId(roomId)
            .requiredAttributes(requiredAttributes.isEmpty() ? null : requiredAttributes)
            .recent(OutboundFrames.fromEnvelopes(recent))
            .build();
    }

    private static ChannelId roomChannel(InboundFrame frame) {
        return ChannelId.room(requireField(frame.getRoomId(), "room_id"));
    }

    private static ChannelId gatedChannel(InboundFrame frame) {
        List<String> attributes = frame.getRequiredAttributes();
        if (attributes == null || attributes.isEmpty()) {
            throw new ValidationException("required_attributes is required");
        }
        try {
            return ChannelId.gated(attributes);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    private void requireMessage(@Nullable String message) {
        requireField(message, "message");
        if (message.length() > config.getMaxMessageLength()) {
            throw new ValidationException("message exceeds " + config.getMaxMessageLength() + " characters");
        }
    }

    private static String requireField(@Nullable String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " is required");
        }
        return value;
    }

    @Nullable
    private static InboundFrame parse(String text) {
        try {
            return JsonUtils.readValue(text, InboundFrame.class);
        } catch (IllegalArgumentException e) {
            log.debug("Malformed frame: {}", e.getMessage());
            return null;
        }
    }

    // client-chosen strings never become meter tags
    private static String typeTag(InboundFrame frame) {
        String type = frame.getType();
        if (type == null) {
            return "missing";
        }
        return INBOUND_TYPES.contains(type) ? type : "unknown";
    }

    static ActionClass actionFor(@Nullable String type) {
        if (type == null) {
            return ActionClass.GENERIC;
        }
        return switch (type) {
            case FrameTypes.HEARTBEAT -> ActionClass.HEARTBEAT;
            case FrameTypes.JOIN_ROOM, FrameTypes.JOIN_GATED, FrameTypes.LEAVE_ROOM, FrameTypes.LEAVE_GATED ->
                ActionClass.JOIN_CHANNEL;
            case FrameTypes.ROOM_MESSAGE, FrameTypes.GATED_MESSAGE -> ActionClass.CHAT_MESSAGE;
            case FrameTypes.PRIVATE_MESSAGE -> ActionClass.PRIVATE_MESSAGE;
            case FrameTypes.GET_ONLINE_USERS, FrameTypes.STATS, FrameTypes.GET_RECENT -> ActionClass.QUERY;
            default -> ActionClass.GENERIC;
        };
    }
}
