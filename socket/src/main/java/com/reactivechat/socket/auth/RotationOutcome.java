package com.reactivechat.socket.auth;

/**
 * Result of the atomic check-and-mark-used step of a refresh token rotation.
 */
public enum RotationOutcome {
    /**
     * The token was unused; it is now used and its replacement is recorded.
     */
    ROTATED,
    /**
     * The token had already been redeemed. Nothing was written.
     */
    ALREADY_USED,
    NOT_FOUND
}
