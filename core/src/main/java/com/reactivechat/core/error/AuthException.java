package com.reactivechat.core.error;

/**
 * Token validation or rotation failure. Never retried by the server; the client must
 * re-authenticate.
 */
public class AuthException extends ChatException {

    public AuthException(ErrorCode code, String message) {
        super(code, message);
        if (!code.isAuthentication()) {
            throw new IllegalArgumentException("Not an authentication error code: " + code);
        }
    }

    public static AuthException expired(String message) {
        return new AuthException(ErrorCode.AUTH_EXPIRED, message);
    }

    public static AuthException invalid(String message) {
        return new AuthException(ErrorCode.AUTH_INVALID, message);
    }

    public static AuthException revoked(String message) {
        return new AuthException(ErrorCode.AUTH_REVOKED, message);
    }

    public static AuthException replay(String message) {
        return new AuthException(ErrorCode.TOKEN_REPLAY, message);
    }
}
