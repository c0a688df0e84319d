package com.reactivechat.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Server-side record of an issued refresh token.
 * <p>
 * <b>Single use:</b> a token id is redeemed at most once. Redemption flips {@code used} and
 * records a child token in the same chain ({@code parentId} points back).
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class RefreshToken {
    String tokenId;
    String principalId;
    /**
     * Lineage shared by every token minted from one login.
     */
    String chainId;
    String parentId;
    Instant issuedAt;
    Instant expiresAt;
    boolean used;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
