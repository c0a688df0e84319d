package com.reactivechat.core.metrics;

/**
 * Micrometer metric names.
 * <p>
 * <b>Naming convention:</b> {@code chat.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: events enqueued onto local connections.
     * <p>
     * Tags: nodeId, type (local/bridge)
     * </p>
     */
    public static final String DELIVER_TOTAL = "chat.router.deliver.total";

    /**
     * Counter: events dropped by the dedup window (bridge echo of a local push).
     */
    public static final String DUPLICATES_TOTAL = "chat.router.duplicates.total";

    /**
     * Counter: messages accepted by the router.
     * <p>
     * Tags: nodeId, type (event kind)
     * </p>
     */
    public static final String SEND_TOTAL = "chat.router.send.total";

    /**
     * Timer: storage persist latency.
     */
    public static final String PERSIST_LATENCY = "chat.router.persist.latency";

    /**
     * Counter: publishes that exhausted retries (degraded delivery).
     */
    public static final String PUBLISH_FAILURES_TOTAL = "chat.broker.publish.failures.total";

    /**
     * Timer: broker publish latency.
     */
    public static final String PUBLISH_LATENCY = "chat.broker.publish.latency";

    /**
     * Counter: connections forced to close.
     * <p>
     * Tags: nodeId, reason
     * </p>
     */
    public static final String CLOSES_TOTAL = "chat.socket.closes.total";

    /**
     * Counter: events that did not fit a connection's outbound queue.
     */
    public static final String DROPS_TOTAL = "chat.socket.drops.total";

    /**
     * Gauge: live connections on this node.
     */
    public static final String CONNECTIONS_ACTIVE = "chat.socket.connections.active";

    /**
     * Counter: token validation failures.
     * <p>
     * Tags: nodeId, code
     * </p>
     */
    public static final String AUTH_FAILURES_TOTAL = "chat.auth.failures.total";

    /**
     * Counter: successful refresh token rotations.
     */
    public static final String ROTATIONS_TOTAL = "chat.auth.rotations.total";

    /**
     * Counter: refresh token replays detected (chain revoked).
     */
    public static final String REPLAYS_TOTAL = "chat.auth.replays.total";
}
