package com.qqsuccubus.roomcast.socket.drain;

import com.qqsuccubus.roomcast.core.model.Actor;
import com.qqsuccubus.roomcast.socket.metrics.MetricsService;
import com.qqsuccubus.roomcast.socket.session.CloseCodes;
import com.qqsuccubus.roomcast.socket.session.Connection;
import com.qqsuccubus.roomcast.socket.session.ConnectionFactory;
import com.qqsuccubus.roomcast.socket.session.ConnectionRegistry;
import com.qqsuccubus.roomcast.socket.support.MutableClock;
import com.qqsuccubus.roomcast.socket.support.TestConfigs;
import com.qqsuccubus.roomcast.socket.support.TestTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DrainServiceTest {

    private VirtualTimeScheduler scheduler;
    private ConnectionRegistry registry;
    private ConnectionFactory factory;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        registry = new ConnectionRegistry();
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), TestConfigs.defaults());
        factory = new ConnectionFactory(TestConfigs.defaults(), metricsService, new MutableClock(0));
    }

    @Test
    void testStartDrain_noConnectionsCompletesImmediately() {
        DrainService drainService = new DrainService(registry, Duration.ofSeconds(60), scheduler);

        assertTrue(drainService.startDrain());

        assertTrue(drainService.isDraining());
        assertTrue(drainService.isDrainComplete());
        assertFalse(drainService.startDrain(), "Second drain request is ignored");
    }

    @Test
    @DisplayName("Connections are closed in batches spread over the drain duration")
    void testStartDrain_closesInBatches() {
        // Given: 3 connections, 4s drain = 2 batches of 2
        List<Connection> connections = register(3);
        DrainService drainService = new DrainService(registry, Duration.ofSeconds(4), scheduler);

        // When
        drainService.startDrain();
        assertEquals(0, closing(connections));
        scheduler.advanceTimeBy(Duration.ofSeconds(2));

        // Then
        assertEquals(2, closing(connections));
        scheduler.advanceTimeBy(Duration.ofSeconds(2));
        assertEquals(3, closing(connections));
        for (Connection connection : connections) {
            assertEquals(CloseCodes.GOING_AWAY, connection.getCloseCode());
        }
        drainService.stop();
    }

    @Test
    void testDrainAll_completesOnceRegistryIsEmpty() {
        List<Connection> connections = register(2);
        DrainService drainService = new DrainService(registry, Duration.ofSeconds(60), scheduler);
        AtomicBoolean done = new AtomicBoolean();

        drainService.drainAll(Duration.ofSeconds(5)).subscribe(v -> { }, err -> { }, () -> done.set(true));

        assertTrue(drainService.isDraining());
        assertEquals(2, closing(connections));
        assertFalse(done.get());

        connections.forEach(connection -> registry.remove(connection.getId()));
        scheduler.advanceTimeBy(Duration.ofMillis(100));

        assertTrue(done.get());
        assertTrue(drainService.isDrainComplete());
    }

    @Test
    @DisplayName("drainAll stops admission and closes connections registered after the first batch")
    void testDrainAll_closesLateRegistrations() {
        // Given
        register(1);
        DrainService drainService = new DrainService(registry, Duration.ofSeconds(60), scheduler);
        AtomicBoolean done = new AtomicBoolean();

        // When: a connection slips into the registry after the first batch
        drainService.drainAll(Duration.ofSeconds(5)).subscribe(v -> { }, err -> { }, () -> done.set(true));
        assertFalse(registry.isAdmitting());
        List<Connection> late = register(1);
        scheduler.advanceTimeBy(Duration.ofMillis(100));

        // Then
        assertEquals(CloseCodes.GOING_AWAY, late.get(0).getCloseCode());
        assertFalse(done.get());
    }

    @Test
    void testStartDrain_stopsAdmission() {
        DrainService drainService = new DrainService(registry, Duration.ofSeconds(60), scheduler);

        drainService.startDrain();

        assertFalse(registry.isAdmitting());
    }

    @Test
    void testDrainAll_givesUpAfterTimeout() {
        register(1);
        DrainService drainService = new DrainService(registry, Duration.ofSeconds(60), scheduler);
        AtomicBoolean done = new AtomicBoolean();

        drainService.drainAll(Duration.ofSeconds(5)).subscribe(v -> { }, err -> { }, () -> done.set(true));
        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertTrue(done.get());
        assertFalse(drainService.isDrainComplete());
        assertEquals(1, registry.size());
    }

    private List<Connection> register(int count) {
        List<Connection> connections = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Connection connection = factory.create(new TestTransport());
            connection.admit(new Actor("wallet-" + i, List.of()));
            registry.add(connection);
            connections.add(connection);
        }
        return connections;
    }

    private static long closing(List<Connection> connections) {
        return connections.stream().filter(connection -> connection.getCloseReason() != null).count();
    }
}
