package com.reactivechat.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Access/refresh credentials handed to a client.
 */
@Value
@Builder
public class TokenPair {
    String principalId;
    String accessToken;
    Instant accessExpiresAt;
    String refreshToken;
    Instant refreshExpiresAt;
    @Builder.Default
    String tokenType = "bearer";
}
