package com.qqsuccubus.roomcast.socket.presence;

import com.qqsuccubus.roomcast.core.msg.ChannelId;
import com.qqsuccubus.roomcast.core.msg.Envelope;
import com.qqsuccubus.roomcast.core.msg.Payloads;
import com.qqsuccubus.roomcast.socket.metrics.MetricsService;
import com.qqsuccubus.roomcast.socket.pubsub.PubSubBroker;
import com.qqsuccubus.roomcast.socket.support.FakeRedisService;
import com.qqsuccubus.roomcast.socket.support.MutableClock;
import com.qqsuccubus.roomcast.socket.support.TestConfigs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PresenceMonitorTest {

    private static final Duration THRESHOLD = Duration.ofSeconds(90);
    private static final Duration SWEEP = Duration.ofSeconds(30);

    private MutableClock clock;
    private MetricsService metricsService;
    private PubSubBroker broker;
    private List<Envelope> statusEvents;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        metricsService = new MetricsService(new SimpleMeterRegistry(), TestConfigs.defaults());
        broker = new PubSubBroker(50, Duration.ofMinutes(5), clock, metricsService);
        statusEvents = new CopyOnWriteArrayList<>();
        broker.subscribe(ChannelId.status(), statusEvents::add);
    }

    @Test
    @DisplayName("Heartbeat keeps an actor online until the threshold, then one offline event")
    void testSweep_reportsOfflineExactlyOnce() {
        // Given: heartbeat at t0
        PresenceMonitor monitor = monitor(new InMemoryPresenceStore());
        long t0 = clock.millis();
        StepVerifier.create(monitor.heartbeat("wallet-a")).verifyComplete();

        // When: exactly at the threshold
        clock.advance(THRESHOLD);

        // Then: still online, sweep evicts nothing
        StepVerifier.create(monitor.isOnline("wallet-a")).expectNext(true).verifyComplete();
        StepVerifier.create(monitor.sweep()).expectNext(0).verifyComplete();

        // When: past the threshold
        clock.advance(Duration.ofMillis(1));

        // Then: offline, exactly one notification carrying the last heartbeat time
        StepVerifier.create(monitor.isOnline("wallet-a")).expectNext(false).verifyComplete();
        StepVerifier.create(monitor.sweep()).expectNext(1).verifyComplete();
        StepVerifier.create(monitor.sweep()).expectNext(0).verifyComplete();

        List<Envelope> offline = statusEvents.stream()
            .filter(e -> !Payloads.Presence.fromJson(e.getPayloadJson()).isOnline())
            .toList();
        assertEquals(1, offline.size());
        assertEquals("wallet-a", offline.get(0).getFrom());
        assertEquals(t0, Payloads.Presence.fromJson(offline.get(0).getPayloadJson()).getLastSeen());
    }

    @Test
    void testHeartbeat_firstRecordPublishesOnlineOnce() {
        PresenceMonitor monitor = monitor(new InMemoryPresenceStore());

        StepVerifier.create(monitor.heartbeat("wallet-a")).verifyComplete();
        clock.advance(Duration.ofSeconds(10));
        StepVerifier.create(monitor.heartbeat("wallet-a")).verifyComplete();

        assertEquals(1, statusEvents.size());
        Payloads.Presence presence = Payloads.Presence.fromJson(statusEvents.get(0).getPayloadJson());
        assertTrue(presence.isOnline());
    }

    @Test
    @DisplayName("A heartbeat landing between snapshot and delete keeps the actor")
    void testSweep_concurrentHeartbeatWins() {
        InMemoryPresenceStore store = new InMemoryPresenceStore();
        PresenceMonitor monitor = monitor(store);
        StepVerifier.create(monitor.heartbeat("wallet-a")).verifyComplete();
        long stale = clock.millis();
        clock.advance(THRESHOLD.plusSeconds(1));

        // fresher heartbeat recorded after the sweep read the stale value
        StepVerifier.create(store.touch("wallet-a", clock.millis())).expectNext(false).verifyComplete();
        StepVerifier.create(store.removeIfUnchanged("wallet-a", stale)).expectNext(false).verifyComplete();

        StepVerifier.create(monitor.isOnline("wallet-a")).expectNext(true).verifyComplete();
    }

    @Test
    void testOnlineActors_sortedAndFresh() {
        PresenceMonitor monitor = monitor(new InMemoryPresenceStore());
        StepVerifier.create(monitor.heartbeat("wallet-c")).verifyComplete();
        clock.advance(Duration.ofSeconds(60));
        StepVerifier.create(monitor.heartbeat("wallet-b")).verifyComplete();
        StepVerifier.create(monitor.heartbeat("wallet-a")).verifyComplete();
        clock.advance(Duration.ofSeconds(40));

        StepVerifier.create(monitor.onlineActors())
            .expectNext(List.of("wallet-a", "wallet-b"))
            .verifyComplete();
    }

    @Test
    void testRedisStore_sweepUsesConditionalDelete() {
        FakeRedisService redis = new FakeRedisService();
        PresenceMonitor monitor = monitor(new RedisPresenceStore(redis));

        StepVerifier.create(monitor.heartbeat("wallet-a")).verifyComplete();
        assertEquals(String.valueOf(clock.millis()), redis.getHash("presence", "wallet-a"));

        clock.advance(THRESHOLD.plusSeconds(1));
        StepVerifier.create(monitor.sweep()).expectNext(1).verifyComplete();

        assertNull(redis.getHash("presence", "wallet-a"));
        assertEquals(0, monitor.getLastOnlineCount());
    }

    @Test
    void testStart_sweepsOnInterval() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        PresenceMonitor monitor = new PresenceMonitor(
            new InMemoryPresenceStore(), broker, clock, THRESHOLD, SWEEP, scheduler, metricsService);
        StepVerifier.create(monitor.heartbeat("wallet-a")).verifyComplete();
        monitor.start();

        clock.advance(Duration.ofSeconds(100));
        scheduler.advanceTimeBy(SWEEP);
        monitor.stop();

        StepVerifier.create(monitor.isOnline("wallet-a")).expectNext(false).verifyComplete();
        assertEquals(2, statusEvents.size());
    }

    @Test
    void testConstructor_rejectsThresholdNotAboveSweepInterval() {
        assertThrows(IllegalArgumentException.class, () -> new PresenceMonitor(
            new InMemoryPresenceStore(), broker, clock, SWEEP, SWEEP, Schedulers.immediate(), metricsService));
    }

    @Test
    void testIsOnline_unknownActorIsOffline() {
        PresenceMonitor monitor = monitor(new InMemoryPresenceStore());
        StepVerifier.create(monitor.isOnline("nobody")).expectNext(false).verifyComplete();
        assertTrue(statusEvents.isEmpty());
    }

    private PresenceMonitor monitor(IPresenceStore store) {
        return new PresenceMonitor(store, broker, clock, THRESHOLD, SWEEP, Schedulers.immediate(), metricsService);
    }
}
