package com.reactivechat.core.error;

/**
 * Failure taxonomy shared by the token service, router and connection supervisor.
 */
public enum ErrorCode {
    AUTH_EXPIRED(4401, true),
    AUTH_INVALID(4401, true),
    AUTH_REVOKED(4401, true),
    /**
     * A refresh token was redeemed twice; its whole chain is revoked.
     */
    TOKEN_REPLAY(4401, true),
    NOT_A_MEMBER(4403, false),
    CONVERSATION_NOT_FOUND(4404, false),
    MESSAGE_NOT_FOUND(4404, false),
    PERSISTENCE_FAILURE(1011, false),
    /**
     * Degraded delivery: the message is durable but fan-out may lag.
     */
    PUBLISH_FAILURE(1011, false),
    TRANSPORT_CLOSED(1006, false),
    BAD_REQUEST(4400, false);

    private final int closeCode;
    private final boolean authentication;

    ErrorCode(int closeCode, boolean authentication) {
        this.closeCode = closeCode;
        this.authentication = authentication;
    }

    public int closeCode() {
        return closeCode;
    }

    public boolean isAuthentication() {
        return authentication;
    }
}
