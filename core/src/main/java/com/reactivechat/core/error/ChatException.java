package com.reactivechat.core.error;

import lombok.Getter;

/**
 * Unchecked failure carrying an {@link ErrorCode}.
 */
@Getter
public class ChatException extends RuntimeException {
    private final ErrorCode code;

    public ChatException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ChatException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
