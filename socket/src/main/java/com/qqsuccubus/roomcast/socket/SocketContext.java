package com.qqsuccubus.roomcast.socket;

import com.qqsuccubus.roomcast.core.ratelimit.RateLimiter;
import com.qqsuccubus.roomcast.socket.auth.HttpIdentityService;
import com.qqsuccubus.roomcast.socket.auth.IIdentityService;
import com.qqsuccubus.roomcast.socket.config.SocketConfig;
import com.qqsuccubus.roomcast.socket.drain.DrainService;
import com.qqsuccubus.roomcast.socket.http.HttpServer;
import com.qqsuccubus.roomcast.socket.metrics.MetricsService;
import com.qqsuccubus.roomcast.socket.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.roomcast.socket.presence.IPresenceStore;
import com.qqsuccubus.roomcast.socket.presence.InMemoryPresenceStore;
import com.qqsuccubus.roomcast.socket.presence.PresenceMonitor;
import com.qqsuccubus.roomcast.socket.presence.RedisPresenceStore;
import com.qqsuccubus.roomcast.socket.pubsub.PubSubBroker;
import com.qqsuccubus.roomcast.socket.redis.IRedisService;
import com.qqsuccubus.roomcast.socket.redis.RedisService;
import com.qqsuccubus.roomcast.socket.room.ConfiguredRoomDirectory;
import com.qqsuccubus.roomcast.socket.room.IRoomDirectory;
import com.qqsuccubus.roomcast.socket.router.MessageRouter;
import com.qqsuccubus.roomcast.socket.session.ConnectionFactory;
import com.qqsuccubus.roomcast.socket.session.ConnectionRegistry;
import com.qqsuccubus.roomcast.socket.store.IMessageStore;
import com.qqsuccubus.roomcast.socket.store.InMemoryMessageStore;
import com.qqsuccubus.roomcast.socket.store.RedisMessageStore;
import com.qqsuccubus.roomcast.socket.ws.WebSocketUpgradeHandler;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;

/**
 * Process context: owns every component of a socket node, starts the background tasks and shuts
 * them down in order.
 */
@Getter
public class SocketContext {
    private static final Logger log = LoggerFactory.getLogger(SocketContext.class);

    private static final String STORE_MEMORY = "memory";
    private static final String STORE_REDIS = "redis";
    private static final Duration IDENTITY_TIMEOUT = Duration.ofSeconds(5);

    private final SocketConfig config;
    private final MetricsService metricsService;
    private final ConnectionRegistry registry;
    private final PubSubBroker broker;
    private final PresenceMonitor presenceMonitor;
    private final RateLimiter rateLimiter;
    private final MessageRouter router;
    private final DrainService drainService;
    private final Scheduler scheduler;

    @Nullable
    private final PrometheusMetricsExporter metricsExporter;
    @Nullable
    private final IRedisService redisService;

    private final Disposable.Composite maintenance = Disposables.composite();
    private HttpServer httpServer;

    public SocketContext(
            SocketConfig config,
            Clock clock,
            MetricsService metricsService,
            @Nullable PrometheusMetricsExporter metricsExporter,
            @Nullable IRedisService redisService,
            IMessageStore messageStore,
            IPresenceStore presenceStore,
            IIdentityService identityService,
            IRoomDirectory roomDirectory,
            Scheduler scheduler
    ) {
        this.config = config;
        this.metricsService = metricsService;
        this.metricsExporter = metricsExporter;
        this.redisService = redisService;
        this.scheduler = scheduler;

        this.registry = new ConnectionRegistry();
        this.broker = new PubSubBroker(
            config.getChannelBufferSize(), Duration.ofSeconds(config.getChannelIdleTtlSec()), clock, metricsService);
        this.presenceMonitor = new PresenceMonitor(
            presenceStore,
            broker,
            clock,
            Duration.ofSeconds(config.getPresenceThresholdSec()),
            Duration.ofSeconds(config.getPresenceSweepIntervalSec()),
            scheduler,
            metricsService
        );
        this.rateLimiter = new RateLimiter(clock);
        this.router = new MessageRouter(
            config,
            new ConnectionFactory(config, metricsService, clock),
            registry,
            identityService,
            roomDirectory,
            broker,
            messageStore,
            presenceMonitor,
            rateLimiter,
            metricsService,
            clock,
            scheduler
        );
        this.drainService = new DrainService(registry, Duration.ofSeconds(config.getDrainDurationSec()), scheduler);
    }

    /**
     * Builds the production context: Prometheus metrics, HTTP identity service and the stores
     * selected by {@code MESSAGE_STORE} / {@code PRESENCE_STORE}.
     */
    public static SocketContext create(SocketConfig config) {
        Clock clock = Clock.systemUTC();
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter();
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        String messageStoreKind = storeKind(config.getMessageStore(), "MESSAGE_STORE");
        String presenceStoreKind = storeKind(config.getPresenceStore(), "PRESENCE_STORE");
        IRedisService redisService = STORE_REDIS.equals(messageStoreKind) || STORE_REDIS.equals(presenceStoreKind)
            ? new RedisService(config)
            : null;

        IMessageStore messageStore = STORE_REDIS.equals(messageStoreKind)
            ? new RedisMessageStore(redisService, clock, config.getHistoryMaxLen())
            : new InMemoryMessageStore(clock, config.getHistoryMaxLen());
        IPresenceStore presenceStore = STORE_REDIS.equals(presenceStoreKind)
            ? new RedisPresenceStore(redisService)
            : new InMemoryPresenceStore();

        log.info("Stores: messages={}, presence={}", messageStoreKind, presenceStoreKind);

        return new SocketContext(
            config,
            clock,
            metricsService,
            metricsExporter,
            redisService,
            messageStore,
            presenceStore,
            new HttpIdentityService(config.getIdentityUrl(), IDENTITY_TIMEOUT),
            ConfiguredRoomDirectory.fromConfig(config),
            Schedulers.parallel()
        );
    }

    /**
     * Binds gauges and starts the presence sweep and maintenance tasks. Does not open the HTTP port.
     */
    public void startBackgroundTasks() {
        metricsService.bindGauges(registry::size, broker::channelCount, presenceMonitor::getLastOnlineCount);
        presenceMonitor.start();

        maintenance.add(Flux.interval(Duration.ofSeconds(config.getRateLimitEvictSec()), scheduler)
            .subscribe(tick -> rateLimiter.evictExpired(),
                err -> log.error("Rate limiter eviction stopped", err)));
        maintenance.add(Flux.interval(Duration.ofSeconds(config.getChannelIdleTtlSec()), scheduler)
            .subscribe(tick -> broker.evictIdle(),
                err -> log.error("Channel eviction stopped", err)));
    }

    /**
     * Starts background tasks and the HTTP server.
     */
    public void start() {
        if (metricsExporter == null) {
            throw new IllegalStateException("HTTP surface requires a Prometheus metrics exporter");
        }
        startBackgroundTasks();
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(config, router, drainService);
        httpServer = new HttpServer(config, upgradeHandler, metricsExporter, drainService);
        httpServer.start();
    }

    /**
     * Drain connections, stop background tasks, stop the HTTP server, close Redis.
     */
    public void shutdown() {
        log.info("Shutting down node {}", config.getNodeId());
        drainService.drainAll(Duration.ofSeconds(config.getDrainTimeoutSec()))
            .block(Duration.ofSeconds(config.getDrainTimeoutSec() + 5L));
        drainService.stop();

        presenceMonitor.stop();
        maintenance.dispose();

        if (httpServer != null) {
            httpServer.stop();
        }
        if (redisService != null) {
            redisService.close();
        }
        log.info("Shutdown complete");
    }

    private static String storeKind(String value, String variable) {
        String kind = value == null ? STORE_MEMORY : value.trim().toLowerCase();
        if (!STORE_MEMORY.equals(kind) && !STORE_REDIS.equals(kind)) {
            throw new IllegalStateException(variable + " must be 'memory' or 'redis', got: " + value);
        }
        return kind;
    }
}
