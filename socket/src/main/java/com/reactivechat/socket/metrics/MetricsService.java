package com.reactivechat.socket.metrics;

import com.reactivechat.core.error.ErrorCode;
import com.reactivechat.core.metrics.MetricsNames;
import com.reactivechat.core.metrics.MetricsTags;
import com.reactivechat.core.model.EventKind;
import com.reactivechat.socket.config.SocketConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Centralized metrics service for a chat node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    // Router
    private final Counter deliverLocal;
    private final Counter deliverBridge;
    private final Counter duplicates;
    private final Map<EventKind, Counter> sends = new EnumMap<>(EventKind.class);
    private final Timer persistLatency;

    // Broker
    private final Counter publishFailures;
    private final Timer publishLatency;

    // Connections
    private final Counter drops;

    // Auth
    private final Map<ErrorCode, Counter> authFailures = new EnumMap<>(ErrorCode.class);
    private final Counter rotations;
    private final Counter replays;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        deliverLocal = Counter.builder(MetricsNames.DELIVER_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, "local")
            .description("Events pushed right after a local send")
            .register(registry);

        deliverBridge = Counter.builder(MetricsNames.DELIVER_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, "bridge")
            .description("Events pushed on receipt from the broker")
            .register(registry);

        duplicates = Counter.builder(MetricsNames.DUPLICATES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Events suppressed by the dedup window")
            .register(registry);

        for (EventKind kind : EventKind.values()) {
            sends.put(kind, Counter.builder(MetricsNames.SEND_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.TYPE, kind.name().toLowerCase())
                .register(registry));
        }

        persistLatency = Timer.builder(MetricsNames.PERSIST_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Storage persist latency")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(5),
                Duration.ofMillis(20),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500)
            )
            .register(registry);

        publishFailures = Counter.builder(MetricsNames.PUBLISH_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Events whose publish exhausted retries")
            .register(registry);

        publishLatency = Timer.builder(MetricsNames.PUBLISH_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Broker publish latency")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(250),
                Duration.ofMillis(500)
            )
            .register(registry);

        drops = Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "rejected")
            .description("Frames not queued to a connection (queue full or closing)")
            .register(registry);

        for (ErrorCode code : ErrorCode.values()) {
            if (code.isAuthentication()) {
                authFailures.put(code, Counter.builder(MetricsNames.AUTH_FAILURES_TOTAL)
                    .tag(MetricsTags.NODE_ID, nodeId)
                    .tag(MetricsTags.CODE, code.name())
                    .register(registry));
            }
        }

        rotations = Counter.builder(MetricsNames.ROTATIONS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);

        replays = Counter.builder(MetricsNames.REPLAYS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Refresh token reuse detected")
            .register(registry);
    }

    public void registerConnectionGauge(Supplier<Number> activeConnections) {
        Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, activeConnections)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);
    }

    public void recordDeliverLocal(int pushes) {
        deliverLocal.increment(pushes);
    }

    public void recordDeliverBridge(int pushes) {
        deliverBridge.increment(pushes);
    }

    public void recordDuplicate() {
        duplicates.increment();
    }

    public void recordSend(EventKind kind) {
        sends.get(kind).increment();
    }

    /**
     * Records storage persist latency.
     *
     * @param startNanos start nanos
     */
    public void recordPersistLatency(long startNanos) {
        persistLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordPublishFailure() {
        publishFailures.increment();
    }

    /**
     * Records broker publish latency, retries included.
     *
     * @param startNanos start nanos
     */
    public void recordPublishLatency(long startNanos) {
        publishLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordDrop() {
        drops.increment();
    }

    public void recordClose(String reason) {
        Counter.builder(MetricsNames.CLOSES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    public void recordAuthFailure(ErrorCode code) {
        Counter counter = authFailures.get(code);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordRotation() {
        rotations.increment();
    }

    public void recordReplay() {
        replays.increment();
    }

    public double getDeliveredCount() {
        return deliverLocal.count() + deliverBridge.count();
    }

    public double getDuplicateCount() {
        return duplicates.count();
    }
}
