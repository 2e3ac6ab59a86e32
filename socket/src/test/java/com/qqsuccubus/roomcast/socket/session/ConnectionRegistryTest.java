package com.qqsuccubus.roomcast.socket.session;

import com.qqsuccubus.roomcast.core.model.Actor;
import com.qqsuccubus.roomcast.core.msg.ChannelId;
import com.qqsuccubus.roomcast.socket.metrics.MetricsService;
import com.qqsuccubus.roomcast.socket.pubsub.PubSubBroker;
import com.qqsuccubus.roomcast.socket.pubsub.Subscription;
import com.qqsuccubus.roomcast.socket.support.MutableClock;
import com.qqsuccubus.roomcast.socket.support.TestConfigs;
import com.qqsuccubus.roomcast.socket.support.TestTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionRegistryTest {

    private ConnectionFactory factory;
    private ConnectionRegistry registry;
    private MetricsService metricsService;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        metricsService = new MetricsService(new SimpleMeterRegistry(), TestConfigs.defaults());
        factory = new ConnectionFactory(TestConfigs.defaults(), metricsService, clock);
        registry = new ConnectionRegistry();
    }

    @Test
    void testAdd_indexesByIdAndActor() {
        Connection first = authenticated("wallet-a");
        Connection second = authenticated("wallet-a");
        Connection other = authenticated("wallet-b");

        registry.add(first);
        registry.add(second);
        registry.add(other);

        assertEquals(3, registry.size());
        assertEquals(2, registry.uniqueActorCount());
        assertEquals(2, registry.byActor("wallet-a").size());
        assertTrue(registry.get(first.getId()).isPresent());
    }

    @Test
    void testAdd_rejectsUnauthenticatedAndDuplicates() {
        Connection pending = factory.create(new TestTransport());
        assertThrows(IllegalArgumentException.class, () -> registry.add(pending));

        Connection connection = authenticated("wallet-a");
        registry.add(connection);
        assertThrows(IllegalArgumentException.class, () -> registry.add(connection));
        assertEquals(1, registry.size());
    }

    @Test
    void testRemove_onlyFirstCallReturnsConnection() {
        Connection connection = authenticated("wallet-a");
        registry.add(connection);

        assertTrue(registry.remove(connection.getId()).isPresent());
        assertFalse(registry.remove(connection.getId()).isPresent());
        assertTrue(registry.byActor("wallet-a").isEmpty());
        assertEquals(0, registry.uniqueActorCount());
    }

    @Test
    void testMarkClosed_handsBackSubscriptionsOnce() {
        PubSubBroker broker = new PubSubBroker(10, Duration.ofMinutes(5), clock, metricsService);
        Connection connection = authenticated("wallet-a");
        Subscription subscription = broker.subscribe(ChannelId.room("R1"), connection);
        assertTrue(connection.addSubscription(subscription));

        List<Subscription> held = connection.markClosed();

        assertEquals(List.of(subscription), held);
        assertTrue(connection.markClosed().isEmpty());
        assertEquals(ConnectionState.CLOSED, connection.getState());
        assertFalse(connection.addSubscription(broker.subscribe(ChannelId.room("R2"), connection)));
    }

    @Test
    void testStateMachine_admitOnlyFromConnecting() {
        Connection connection = factory.create(new TestTransport());
        assertEquals(ConnectionState.CONNECTING, connection.getState());

        assertTrue(connection.admit(new Actor("wallet-a", List.of())));
        assertFalse(connection.admit(new Actor("wallet-b", List.of())));
        assertEquals("wallet-a", connection.getWallet());

        assertTrue(connection.beginProcessing());
        assertEquals(ConnectionState.PROCESSING, connection.getState());
        connection.endProcessing();
        assertEquals(ConnectionState.AUTHENTICATED, connection.getState());
    }

    @Test
    void testRequestClose_firstRequestWins() {
        Connection connection = factory.create(new TestTransport());

        connection.requestClose(CloseCodes.NORMAL, "Logged out");
        connection.requestClose(CloseCodes.GOING_AWAY, "Server draining");

        assertEquals(CloseCodes.NORMAL, connection.getCloseCode());
        assertEquals("Logged out", connection.getCloseReason());
    }

    private Connection authenticated(String wallet) {
        Connection connection = factory.create(new TestTransport());
        connection.admit(new Actor(wallet, List.of()));
        return connection;
    }
}
