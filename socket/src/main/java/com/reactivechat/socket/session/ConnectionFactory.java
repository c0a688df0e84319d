package com.reactivechat.socket.session;

import com.reactivechat.core.msg.ServerFrame;
import com.reactivechat.socket.config.SocketConfig;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates {@link Connection} instances (Single Responsibility Principle).
 * <p>
 * Connection ids are {@code <nodeId>-<counter>} and are never reused within a process.
 * </p>
 */
public class ConnectionFactory {
    private final SocketConfig config;
    private final AtomicLong counter = new AtomicLong();

    public ConnectionFactory(SocketConfig config) {
        this.config = config;
    }

    public Connection createConnection() {
        // The connection enforces the exact capacity; the array queue rounds up to a power of two
        // and keeps one extra slot for the closing frame.
        int capacity = config.getQueueCapacity();
        Sinks.Many<ServerFrame> sink = Sinks.many().unicast().onBackpressureBuffer(
            Queues.<ServerFrame>get(capacity + 1).get()
        );

        String id = config.getNodeId() + "-" + counter.incrementAndGet();
        return new Connection(id, sink, capacity, System.currentTimeMillis());
    }
}
