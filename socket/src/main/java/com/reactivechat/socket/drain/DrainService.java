package com.reactivechat.socket.drain;

import com.reactivechat.core.util.JitterBackoff;
import com.reactivechat.socket.config.SocketConfig;
import com.reactivechat.socket.session.CloseReason;
import com.reactivechat.socket.session.Connection;
import com.reactivechat.socket.session.ConnectionState;
import com.reactivechat.socket.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Gracefully drains a node before it stops.
 * <p>
 * 1. {@code POST /drain} (or the shutdown hook) enters draining mode
 * 2. New WebSocket upgrades are rejected with 503
 * 3. Live connections are asked to close in batches spread over {@code drainTimeout}; each gets
 *    a {@code closing} frame with a jittered {@code retryAfterMs} so clients do not reconnect
 *    to the remaining nodes all at once
 * </p>
 */
public class DrainService {
    private static final Logger log = LoggerFactory.getLogger(DrainService.class);

    private static final int DRAIN_BATCHES = 10;

    private final SessionRegistry registry;
    private final SocketConfig config;
    private final Scheduler scheduler;
    private final AtomicBoolean isDraining = new AtomicBoolean(false);

    private volatile Disposable drainTask;

    public DrainService(SessionRegistry registry, SocketConfig config) {
        this(registry, config, Schedulers.parallel());
    }

    public DrainService(SessionRegistry registry, SocketConfig config, Scheduler scheduler) {
        this.registry = registry;
        this.config = config;
        this.scheduler = scheduler;
    }

    /**
     * Starts the draining process. Idempotent.
     *
     * @return Mono completing when drain is started
     */
    public Mono<Void> startDrain() {
        if (!isDraining.compareAndSet(false, true)) {
            log.warn("Drain already in progress");
            return Mono.empty();
        }

        int total = registry.connectionCount();
        log.warn("DRAIN MODE ACTIVATED - closing {} connections over {}ms", total, config.getDrainTimeout().toMillis());

        if (total == 0) {
            return Mono.empty();
        }

        int perBatch = Math.max(1, (total + DRAIN_BATCHES - 1) / DRAIN_BATCHES);
        Duration interval = config.getDrainTimeout().dividedBy(DRAIN_BATCHES + 1);

        // First batch immediately, the rest spread out, then a final sweep
        drainTask = Flux.interval(Duration.ZERO, interval, scheduler)
            .take(DRAIN_BATCHES)
            .doOnNext(tick -> drainBatch(perBatch))
            .doOnComplete(() -> drainBatch(Integer.MAX_VALUE))
            .subscribe();

        return Mono.empty();
    }

    private void drainBatch(int batchSize) {
        List<Connection> connections = registry.allConnections().stream()
            .filter(connection -> connection.getState() != ConnectionState.CLOSING
                && connection.getState() != ConnectionState.CLOSED)
            .collect(Collectors.toList());
        if (connections.isEmpty()) {
            return;
        }

        int toClose = Math.min(batchSize, connections.size());
        log.debug("Draining batch: closing {} connections ({} remaining)", toClose, connections.size() - toClose);

        for (int i = 0; i < toClose; i++) {
            long retryAfterMs = JitterBackoff.next(0).toMillis();
            connections.get(i).requestClose(CloseReason.drain(retryAfterMs));
        }
    }

    /**
     * @return Mono completing once no connection is left, or after {@code timeout}
     */
    public Mono<Void> awaitDrained(Duration timeout) {
        return Flux.interval(Duration.ZERO, Duration.ofMillis(100), scheduler)
            .filter(tick -> registry.connectionCount() == 0)
            .next()
            .timeout(timeout, scheduler)
            .onErrorResume(err -> {
                log.warn("Drain timed out with {} connections left", registry.connectionCount());
                return Mono.empty();
            })
            .then();
    }

    public boolean isDraining() {
        return isDraining.get();
    }

    public boolean isDrainComplete() {
        return isDraining.get() && registry.connectionCount() == 0;
    }

    public int getRemainingConnections() {
        return registry.connectionCount();
    }

    public void stop() {
        Disposable task = drainTask;
        if (task != null) {
            task.dispose();
        }
        log.info("Drain service stopped");
    }
}
