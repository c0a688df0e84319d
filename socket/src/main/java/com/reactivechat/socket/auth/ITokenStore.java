package com.reactivechat.socket.auth;

import com.reactivechat.core.model.RefreshToken;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Storage collaborator of the token service (Dependency Inversion Principle).
 * <p>
 * Holds refresh token records and revocation state. Implementations must make
 * {@link #markUsed(String, RefreshToken)} atomic: two concurrent calls on the same token id
 * never both return {@link RotationOutcome#ROTATED}.
 * </p>
 */
public interface ITokenStore {

    /**
     * Records a freshly issued, unused refresh token.
     */
    Mono<Void> recordRefreshToken(RefreshToken token);

    /**
     * @return the record, or empty if unknown or expired out of the store
     */
    Mono<RefreshToken> findRefreshToken(String tokenId);

    /**
     * Marks {@code tokenId} used and records {@code replacement} in one atomic step.
     *
     * @param tokenId     token being redeemed
     * @param replacement child token in the same chain
     * @return outcome of the check-and-mark step
     */
    Mono<RotationOutcome> markUsed(String tokenId, RefreshToken replacement);

    /**
     * Revokes a single access or refresh token id.
     */
    Mono<Void> revokeToken(String tokenId, Duration ttl);

    /**
     * Revokes every token minted in a chain.
     */
    Mono<Void> revokeChain(String chainId, Duration ttl);

    /**
     * Revokes every token of a principal issued at or before {@code cutoffMillis}.
     */
    Mono<Void> revokePrincipal(String principalId, long cutoffMillis, Duration ttl);

    /**
     * @return the live revocation cut-off of a principal in epoch millis, or empty if none
     */
    Mono<Long> principalCutoff(String principalId);

    /**
     * @return true if any of token id, chain id or principal cut-off revokes the token
     */
    Mono<Boolean> isRevoked(String principalId, String chainId, String tokenId, long issuedAtMillis);
}
