package com.reactivechat.socket.session;

import com.reactivechat.core.error.ErrorCode;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * Why a connection moves to {@link ConnectionState#CLOSING}, and how.
 * <p>
 * A graceful close flushes the outbound queue and sends a {@code closing} frame first;
 * a forceful close discards whatever is still queued.
 * </p>
 */
@Value
public class CloseReason {
    public static final int NORMAL = 1000;
    public static final int GOING_AWAY = 1001;
    public static final int HEARTBEAT_TIMEOUT = 4408;
    public static final int QUEUE_OVERFLOW = 4429;

    private static final String CLIENT_CLOSED = "CLIENT_CLOSED";

    int code;
    String reason;
    boolean graceful;
    @Nullable
    Long retryAfterMs;

    /**
     * @return true if the transport is already gone and no close frame can be sent
     */
    public boolean isTransportGone() {
        return CLIENT_CLOSED.equals(reason) || ErrorCode.TRANSPORT_CLOSED.name().equals(reason);
    }

    public static CloseReason normal() {
        return new CloseReason(NORMAL, "NORMAL", true, null);
    }

    public static CloseReason drain(long retryAfterMs) {
        return new CloseReason(GOING_AWAY, "DRAIN", true, retryAfterMs);
    }

    public static CloseReason heartbeatTimeout() {
        return new CloseReason(HEARTBEAT_TIMEOUT, "HEARTBEAT_TIMEOUT", false, null);
    }

    public static CloseReason queueOverflow() {
        return new CloseReason(QUEUE_OVERFLOW, "QUEUE_OVERFLOW", false, null);
    }

    /**
     * The client ended the transport. Nothing can be flushed anymore.
     */
    public static CloseReason clientClosed() {
        return new CloseReason(NORMAL, CLIENT_CLOSED, false, null);
    }

    public static CloseReason transportClosed() {
        return of(ErrorCode.TRANSPORT_CLOSED);
    }

    /**
     * Close caused by an error code, e.g. revocation detected on re-validation.
     * Nothing more is delivered to a connection whose credential is no longer valid.
     */
    public static CloseReason of(ErrorCode code) {
        return new CloseReason(code.closeCode(), code.name(), false, null);
    }
}
