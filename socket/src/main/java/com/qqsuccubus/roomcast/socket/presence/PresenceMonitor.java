package com.qqsuccubus.roomcast.socket.presence;

import com.qqsuccubus.roomcast.core.msg.ChannelId;
import com.qqsuccubus.roomcast.core.msg.Envelope;
import com.qqsuccubus.roomcast.core.msg.Payloads;
import com.qqsuccubus.roomcast.socket.metrics.MetricsService;
import com.qqsuccubus.roomcast.socket.pubsub.PubSubBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks actor liveness and reports transitions on the status channel.
 * <p>
 * An actor is online while its last heartbeat is at most {@code threshold} old. A background sweep
 * every {@code sweepInterval} removes stale records and publishes one {@code status{online:false}}
 * per removed record. The first heartbeat of an actor without a record publishes
 * {@code status{online:true}}.
 * </p>
 */
public class PresenceMonitor {
    private static final Logger log = LoggerFactory.getLogger(PresenceMonitor.class);

    private final IPresenceStore store;
    private final PubSubBroker broker;
    private final Clock clock;
    private final Duration threshold;
    private final Duration sweepInterval;
    private final Scheduler scheduler;
    private final MetricsService metricsService;
    private final AtomicInteger lastOnlineCount = new AtomicInteger();

    private Disposable sweepTask;

    public PresenceMonitor(
            IPresenceStore store,
            PubSubBroker broker,
            Clock clock,
            Duration threshold,
            Duration sweepInterval,
            Scheduler scheduler,
            MetricsService metricsService
    ) {
        if (threshold.compareTo(sweepInterval) <= 0) {
            throw new IllegalArgumentException(
                "Liveness threshold " + threshold + " must exceed sweep interval " + sweepInterval);
        }
        this.store = store;
        this.broker = broker;
        this.clock = clock;
        this.threshold = threshold;
        this.sweepInterval = sweepInterval;
        this.scheduler = scheduler;
        this.metricsService = metricsService;
    }

    public Mono<Void> heartbeat(String wallet) {
        return Mono.defer(() -> {
            long now = clock.millis();
            return store.touch(wallet, now)
                .doOnNext(created -> {
                    if (created) {
                        log.debug("{} came online", wallet);
                        publishStatus(wallet, true, now);
                    }
                })
                .then();
        });
    }

    public Mono<Boolean> isOnline(String wallet) {
        return store.lastSeen(wallet)
            .map(this::isFresh)
            .defaultIfEmpty(false);
    }

    /**
     * Wallets currently online, sorted.
     */
    public Mono<List<String>> onlineActors() {
        return store.snapshot().map(records -> {
            List<String> online = new ArrayList<>();
            records.forEach((wallet, lastSeen) -> {
                if (isFresh(lastSeen)) {
                    online.add(wallet);
                }
            });
            online.sort(null);
            return online;
        });
    }

    /**
     * Removes every record older than the threshold and announces each removal.
     *
     * @return number of actors reported offline
     */
    public Mono<Integer> sweep() {
        return store.snapshot().flatMap(records -> {
            List<Map.Entry<String, Long>> stale = new ArrayList<>();
            for (Map.Entry<String, Long> record : records.entrySet()) {
                if (!isFresh(record.getValue())) {
                    stale.add(record);
                }
            }
            lastOnlineCount.set(records.size() - stale.size());
            return Flux.fromIterable(stale)
                .concatMap(record -> store.removeIfUnchanged(record.getKey(), record.getValue())
                    .filter(removed -> removed)
                    .doOnNext(removed -> {
                        metricsService.recordPresenceEviction();
                        publishStatus(record.getKey(), false, record.getValue());
                    }))
                .count()
                .map(Long::intValue);
        }).doOnNext(evicted -> {
            if (evicted > 0) {
                log.info("Presence sweep: {} actors went offline", evicted);
            }
        });
    }

    public void start() {
        sweepTask = Flux.interval(sweepInterval, scheduler)
            .concatMap(tick -> sweep().onErrorResume(err -> {
                log.error("Presence sweep failed, retrying next tick", err);
                return Mono.just(0);
            }))
            .subscribe();
        log.info("Presence sweep started (interval={}, threshold={})", sweepInterval, threshold);
    }

    public void stop() {
        if (sweepTask != null) {
            sweepTask.dispose();
        }
        log.info("Presence sweep stopped");
    }

    /**
     * Online actors as of the last sweep.
     */
    public int getLastOnlineCount() {
        return lastOnlineCount.get();
    }

    private boolean isFresh(long lastSeen) {
        return clock.millis() - lastSeen <= threshold.toMillis();
    }

    private void publishStatus(String wallet, boolean online, long lastSeen) {
        Envelope envelope = new Envelope(
            UUID.randomUUID().toString(),
            ChannelId.status(),
            wallet,
            new Payloads.Presence(online, lastSeen).toJson(),
            clock.millis()
        );
        broker.publish(ChannelId.status(), envelope);
    }
}
