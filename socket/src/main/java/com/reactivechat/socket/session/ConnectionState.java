package com.reactivechat.socket.session;

/**
 * Lifecycle of one real-time connection. Transitions only move forward.
 */
public enum ConnectionState {
    /** Transport established, credential not yet validated. */
    CONNECTING,
    AUTHENTICATED,
    ACTIVE,
    /** Unregistered; the outbound queue is being flushed or discarded. */
    CLOSING,
    CLOSED
}
