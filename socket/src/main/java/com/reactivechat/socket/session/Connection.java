package com.reactivechat.socket.session;

import com.reactivechat.core.model.DeliveryEvent;
import com.reactivechat.core.model.EventKind;
import com.reactivechat.core.model.Principal;
import com.reactivechat.core.msg.ServerFrame;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live real-time channel.
 * <p>
 * Owned by the supervisor that created it; the {@link SessionRegistry} and the router only hold
 * references to it. Any thread may {@link #offer} frames concurrently with the transport
 * draining the outbound queue. Offers never wait: once {@code capacity} frames are waiting for
 * the transport the connection asks to be closed and further frames are rejected.
 * </p>
 */
public class Connection {
    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    @Getter
    private final String id;
    @Getter
    private final long createdAt;
    private final AtomicLong lastHeartbeat;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    @Getter
    private volatile Principal principal;

    private final int capacity;
    // Frames queued but not yet taken by the transport
    private final AtomicInteger pending = new AtomicInteger();
    private final Sinks.Many<ServerFrame> outbound;
    private final Sinks.One<CloseReason> closeRequest = Sinks.one();
    private final Sinks.Empty<Void> discard = Sinks.empty();

    // Highest MESSAGE_CREATED sequence pushed per conversation. Guarded by "this".
    private final Map<String, Long> highestSequence = new HashMap<>();

    Connection(String id, Sinks.Many<ServerFrame> outbound, int capacity, long now) {
        this.id = id;
        this.outbound = outbound;
        this.capacity = capacity;
        this.createdAt = now;
        this.lastHeartbeat = new AtomicLong(now);
    }

    public ConnectionState getState() {
        return state.get();
    }

    public String getPrincipalId() {
        Principal current = principal;
        return current == null ? null : current.getUserId();
    }

    /**
     * CONNECTING to AUTHENTICATED, binding the principal for the connection's lifetime.
     */
    public boolean authenticate(Principal principal) {
        if (state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.AUTHENTICATED)) {
            this.principal = principal;
            return true;
        }
        return false;
    }

    public boolean activate() {
        return state.compareAndSet(ConnectionState.AUTHENTICATED, ConnectionState.ACTIVE);
    }

    /**
     * Moves to CLOSING from any non-terminal state.
     *
     * @return false if the connection was already closing or closed
     */
    public boolean beginClosing() {
        ConnectionState current = state.get();
        while (current != ConnectionState.CLOSING && current != ConnectionState.CLOSED) {
            if (state.compareAndSet(current, ConnectionState.CLOSING)) {
                return true;
            }
            current = state.get();
        }
        return false;
    }

    public void markClosed() {
        state.set(ConnectionState.CLOSED);
    }

    public void touch(long now) {
        lastHeartbeat.set(now);
    }

    public long getLastHeartbeat() {
        return lastHeartbeat.get();
    }

    public int getPendingFrames() {
        return pending.get();
    }

    /**
     * Enqueues a delivery event, flagging it {@code late} when a newer message of the same
     * conversation was already pushed on this connection.
     */
    public synchronized boolean offerEvent(DeliveryEvent event) {
        boolean late = false;
        if (event.getKind() == EventKind.MESSAGE_CREATED) {
            Long highest = highestSequence.get(event.getConversationId());
            late = highest != null && event.getSequence() < highest;
            if (!late) {
                highestSequence.put(event.getConversationId(), event.getSequence());
            }
        }
        return offer(ServerFrame.event(event, late));
    }

    /**
     * Enqueues a frame without blocking.
     *
     * @return false if the frame was not queued (connection closing, or queue full)
     */
    public synchronized boolean offer(ServerFrame frame) {
        ConnectionState current = state.get();
        if (current == ConnectionState.CLOSING || current == ConnectionState.CLOSED) {
            return false;
        }

        if (pending.get() >= capacity) {
            log.warn("Outbound queue full for connection {} ({}), closing it", id, getPrincipalId());
            requestClose(CloseReason.queueOverflow());
            return false;
        }

        pending.incrementAndGet();
        Sinks.EmitResult result = outbound.tryEmitNext(frame);
        if (result.isSuccess()) {
            return true;
        }
        pending.decrementAndGet();
        log.debug("Dropped frame {} for connection {}: {}", frame.getType(), id, result);
        return false;
    }

    /**
     * Asks the owning supervisor to close this connection. Only the first request counts.
     */
    public void requestClose(CloseReason reason) {
        closeRequest.tryEmitValue(reason);
    }

    public Mono<CloseReason> closeRequested() {
        return closeRequest.asMono();
    }

    /**
     * Frames to write to the transport, in enqueue order. Ends after {@link #completeOutbound}
     * once the queue is drained, or right away on {@link #discardOutbound()}.
     */
    public Flux<ServerFrame> outboundFlux() {
        return outbound.asFlux()
            .doOnNext(frame -> pending.decrementAndGet())
            .takeUntilOther(discard.asMono());
    }

    /**
     * Queues a last frame (may be null) and completes the outbound stream after it. The last
     * frame is not counted against the capacity.
     */
    public synchronized void completeOutbound(ServerFrame last) {
        if (last != null && outbound.tryEmitNext(last).isSuccess()) {
            pending.incrementAndGet();
        }
        outbound.tryEmitComplete();
    }

    /**
     * Ends the outbound stream immediately, dropping queued frames.
     */
    public void discardOutbound() {
        discard.tryEmitEmpty();
    }
}
