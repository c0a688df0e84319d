package com.reactivechat.socket.auth;

import com.reactivechat.core.model.Principal;
import com.reactivechat.core.model.TokenPair;
import reactor.core.publisher.Mono;

/**
 * Token lifecycle: issue, validate, rotate, revoke.
 * <p>
 * Failures are signalled as {@link com.reactivechat.core.error.AuthException} carrying
 * {@code AUTH_EXPIRED}, {@code AUTH_INVALID}, {@code AUTH_REVOKED} or {@code TOKEN_REPLAY}.
 * </p>
 */
public interface ITokenService {

    /**
     * Issues a fresh access/refresh pair starting a new token chain.
     */
    Mono<TokenPair> issue(Principal principal);

    /**
     * Checks signature, expiry and revocation of an access token.
     *
     * @return the principal the token was issued to
     */
    Mono<Principal> validateAccess(String accessToken);

    /**
     * Redeems a refresh token for a new pair. A second redemption of the same token fails
     * with {@code TOKEN_REPLAY} and revokes the whole chain.
     */
    Mono<TokenPair> rotate(String refreshToken);

    /**
     * Revokes every token of the principal issued up to now.
     */
    Mono<Void> revokePrincipal(String principalId);

    /**
     * Revokes one access token id or refresh token id.
     */
    Mono<Void> revokeToken(String tokenId);

    /**
     * Revokes the chain the access token belongs to; with {@code everywhere} the whole principal.
     */
    Mono<Void> logout(String accessToken, boolean everywhere);

    /**
     * Drops the cached principal so the next validation reloads memberships.
     */
    void invalidatePrincipal(String principalId);
}
