package com.qqsuccubus.roomcast.socket.drain;

import com.qqsuccubus.roomcast.socket.session.CloseCodes;
import com.qqsuccubus.roomcast.socket.session.Connection;
import com.qqsuccubus.roomcast.socket.session.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gracefully drains the connections of this node.
 * <p>
 * Draining process:
 * 1. /drain is called (e.g. from a preStop hook) or the node shuts down
 * 2. Node enters draining mode, rejects new upgrades and stops admitting connections that are
 *    still authenticating
 * 3. Existing connections are closed in batches with code 1001 so clients reconnect elsewhere
 * 4. Drain completes once the registry is empty
 * </p>
 */
public class DrainService {
    private static final Logger log = LoggerFactory.getLogger(DrainService.class);

    static final Duration BATCH_INTERVAL = Duration.ofSeconds(2);

    private final ConnectionRegistry registry;
    private final Duration drainDuration;
    private final Scheduler scheduler;
    private final AtomicBoolean isDraining = new AtomicBoolean(false);
    private final AtomicBoolean isDrainComplete = new AtomicBoolean(false);
    private final AtomicInteger remainingConnections = new AtomicInteger(0);

    private Disposable drainTask;

    public DrainService(ConnectionRegistry registry, Duration drainDuration, Scheduler scheduler) {
        this.registry = registry;
        this.drainDuration = drainDuration;
        this.scheduler = scheduler;
    }

    /**
     * Enters drain mode and closes connections in batches spread over the drain duration.
     *
     * @return {@code false} if a drain was already in progress
     */
    public boolean startDrain() {
        if (!isDraining.compareAndSet(false, true)) {
            log.warn("Drain already in progress");
            return false;
        }
        registry.stopAdmitting();
        int totalConnections = registry.size();
        remainingConnections.set(totalConnections);
        log.warn("Drain mode activated for {} connections over {}", totalConnections, drainDuration);

        if (totalConnections == 0) {
            log.info("No active connections, drain complete immediately");
            isDrainComplete.set(true);
            return true;
        }

        long totalBatches = Math.max(1, drainDuration.toMillis() / BATCH_INTERVAL.toMillis());
        int connectionsPerBatch = (int) Math.max(1, (totalConnections + totalBatches - 1) / totalBatches);
        log.info("Drain plan: {} batches, ~{} connections per batch, batch every {}",
            totalBatches, connectionsPerBatch, BATCH_INTERVAL);

        drainTask = Flux.interval(BATCH_INTERVAL, scheduler)
            .take(totalBatches)
            .doOnNext(tick -> drainBatch(connectionsPerBatch))
            .takeUntil(tick -> isDrainComplete.get())
            .then(Mono.fromRunnable(() -> drainBatch(Integer.MAX_VALUE)))
            .subscribe(
                v -> { },
                err -> log.error("Drain task failed", err),
                () -> log.info("Drain schedule finished, {} connections remaining", registry.size())
            );
        return true;
    }

    /**
     * Enters drain mode, closes every connection at once and waits for the registry to empty.
     *
     * @param timeout upper bound on the wait
     * @return completes when drained or when the timeout elapses
     */
    public Mono<Void> drainAll(Duration timeout) {
        return Mono.defer(() -> {
            isDraining.set(true);
            registry.stopAdmitting();
            drainBatch(Integer.MAX_VALUE);
            // re-run each tick for connections that were admitted while the first batch ran
            return Flux.interval(Duration.ofMillis(100), scheduler)
                .doOnNext(tick -> drainBatch(Integer.MAX_VALUE))
                .filter(tick -> registry.size() == 0)
                .next()
                .then()
                .timeout(timeout, scheduler)
                .doOnSuccess(v -> {
                    isDrainComplete.set(true);
                    log.info("All connections drained");
                })
                .onErrorResume(err -> {
                    log.warn("Drain timed out with {} connections remaining", registry.size());
                    return Mono.empty();
                });
        });
    }

    /**
     * Requests close of up to {@code batchSize} connections.
     */
    int drainBatch(int batchSize) {
        List<Connection> active = registry.all();
        int remaining = active.size();
        remainingConnections.set(remaining);

        if (remaining == 0) {
            if (isDrainComplete.compareAndSet(false, true)) {
                log.info("All connections drained");
            }
            return 0;
        }

        int closed = 0;
        for (Connection connection : active) {
            if (closed >= batchSize) {
                break;
            }
            // already closing
            if (connection.getCloseReason() != null) {
                continue;
            }
            connection.requestClose(CloseCodes.GOING_AWAY, "Server draining");
            closed++;
        }
        log.debug("Draining batch: closing {} connections ({} remaining)", closed, remaining - closed);
        return closed;
    }

    public boolean isDraining() {
        return isDraining.get();
    }

    public boolean isDrainComplete() {
        return isDrainComplete.get();
    }

    /**
     * Connections left as of the last batch.
     */
    public int getRemainingConnections() {
        return remainingConnections.get();
    }

    public void stop() {
        if (drainTask != null) {
            drainTask.dispose();
        }
        log.info("Drain service stopped");
    }
}
