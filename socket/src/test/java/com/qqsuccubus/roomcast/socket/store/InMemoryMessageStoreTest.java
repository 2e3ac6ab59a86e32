package com.qqsuccubus.roomcast.socket.store;

import com.qqsuccubus.roomcast.core.msg.ChannelId;
import com.qqsuccubus.roomcast.core.msg.Envelope;
import com.qqsuccubus.roomcast.core.msg.Payloads;
import com.qqsuccubus.roomcast.socket.support.MutableClock;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class InMemoryMessageStoreTest {

    private static final ChannelId R1 = ChannelId.room("R1");

    private final MutableClock clock = new MutableClock(1_700_000_000_000L);

    @Test
    void testPersist_assignsIdAndTimestamp() {
        InMemoryMessageStore store = new InMemoryMessageStore(clock, 10);

        StepVerifier.create(store.persist(R1, "wallet-a", new Payloads.Chat("hello").toJson()))
            .assertNext(envelope -> {
                assertNotNull(envelope.getMsgId());
                assertEquals(R1, envelope.getChannel());
                assertEquals("wallet-a", envelope.getFrom());
                assertEquals(clock.millis(), envelope.getTs());
            })
            .verifyComplete();
    }

    @Test
    void testRecentHistory_oldestFirstCappedAtMaxLen() {
        InMemoryMessageStore store = new InMemoryMessageStore(clock, 3);
        for (int i = 1; i <= 5; i++) {
            store.persist(R1, "wallet-a", new Payloads.Chat("m" + i).toJson()).block();
            clock.advance(Duration.ofSeconds(1));
        }

        StepVerifier.create(store.recentHistory(R1, 10).map(this::content))
            .expectNext("m3", "m4", "m5")
            .verifyComplete();
        StepVerifier.create(store.recentHistory(R1, 2).map(this::content))
            .expectNext("m4", "m5")
            .verifyComplete();
        StepVerifier.create(store.recentHistory(ChannelId.room("empty"), 10))
            .verifyComplete();
    }

    @Test
    void testChannelCap_dropsLeastRecentlyUsedChannel() {
        InMemoryMessageStore store = new InMemoryMessageStore(clock, 10, 2);
        store.persist(R1, "wallet-a", new Payloads.Chat("one").toJson()).block();
        store.persist(ChannelId.room("R2"), "wallet-a", new Payloads.Chat("two").toJson()).block();

        // reading R1 makes R2 the eldest
        store.recentHistory(R1, 10).blockLast();
        store.persist(ChannelId.direct("wallet-b"), "wallet-a", new Payloads.Chat("three").toJson()).block();

        assertEquals(2, store.channelCount());
        StepVerifier.create(store.recentHistory(R1, 10).map(this::content))
            .expectNext("one")
            .verifyComplete();
        StepVerifier.create(store.recentHistory(ChannelId.room("R2"), 10))
            .verifyComplete();
    }

    private String content(Envelope envelope) {
        return Payloads.Chat.fromJson(envelope.getPayloadJson()).getMessage();
    }
}
