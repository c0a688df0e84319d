package com.reactivechat.socket.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.reactivechat.core.error.AuthException;
import com.reactivechat.core.model.Principal;
import com.reactivechat.core.model.RefreshToken;
import com.reactivechat.core.model.TokenPair;
import com.reactivechat.socket.config.SocketConfig;
import com.reactivechat.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Issues and verifies JWT access/refresh tokens.
 * <p>
 * Access and refresh tokens are signed with separate HMAC-SHA256 secrets. Access tokens are
 * verified statelessly and then checked against the revocation set. Refresh tokens are
 * single-use: each carries a token id recorded in the {@link ITokenStore}, and redeeming it
 * flips the record to used in the same atomic step that records its replacement.
 * </p>
 * <p>
 * <b>Claims:</b> {@code sub} principal id, {@code jti} token id, {@code chain} lineage id,
 * {@code iat_ms} issue time in millis (revocation cut-offs), {@code typ} access/refresh.
 * </p>
 */
public class TokenService implements ITokenService {
    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    static final String CLAIM_TYPE = "typ";
    static final String CLAIM_CHAIN = "chain";
    static final String CLAIM_ISSUED_AT_MS = "iat_ms";
    static final String CLAIM_NAME = "name";
    static final String CLAIM_NONCE = "nonce";
    static final String TYPE_ACCESS = "access";
    static final String TYPE_REFRESH = "refresh";

    private final ITokenStore tokenStore;
    private final IPrincipalDirectory principalDirectory;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Algorithm accessAlgorithm;
    private final Algorithm refreshAlgorithm;
    private final JWTVerifier accessVerifier;
    private final JWTVerifier refreshVerifier;
    private final String issuer;
    private final Duration accessTtl;
    private final Duration refreshTtl;
    private final Cache<String, Principal> principalCache;
    private final SecureRandom random = new SecureRandom();

    public TokenService(SocketConfig config, ITokenStore tokenStore, IPrincipalDirectory principalDirectory,
                        MetricsService metricsService) {
        this(config, tokenStore, principalDirectory, metricsService, Clock.systemUTC());
    }

    public TokenService(SocketConfig config, ITokenStore tokenStore, IPrincipalDirectory principalDirectory,
                        MetricsService metricsService, Clock clock) {
        this.tokenStore = tokenStore;
        this.principalDirectory = principalDirectory;
        this.metricsService = metricsService;
        this.clock = clock;
        this.issuer = config.getTokenIssuer();
        this.accessTtl = config.getAccessTokenTtl();
        this.refreshTtl = config.getRefreshTokenTtl();

        this.accessAlgorithm = Algorithm.HMAC256(config.getAccessTokenSecret().getBytes(StandardCharsets.UTF_8));
        this.refreshAlgorithm = Algorithm.HMAC256(config.getRefreshTokenSecret().getBytes(StandardCharsets.UTF_8));
        long leeway = config.getClockSkew().toSeconds();
        this.accessVerifier = JWT.require(accessAlgorithm)
            .withIssuer(issuer)
            .withClaim(CLAIM_TYPE, TYPE_ACCESS)
            .acceptLeeway(leeway)
            .build();
        this.refreshVerifier = JWT.require(refreshAlgorithm)
            .withIssuer(issuer)
            .withClaim(CLAIM_TYPE, TYPE_REFRESH)
            .acceptLeeway(leeway)
            .build();

        this.principalCache = Caffeine.newBuilder()
            .maximumSize(100_000)
            .expireAfterWrite(config.getPrincipalCacheTtl())
            .build();
    }

    @Override
    public Mono<TokenPair> issue(Principal principal) {
        return issueTime(principal.getUserId()).flatMap(now -> {
            RefreshToken refresh = RefreshToken.builder()
                .tokenId(UUID.randomUUID().toString())
                .principalId(principal.getUserId())
                .chainId(UUID.randomUUID().toString())
                .issuedAt(now)
                .expiresAt(now.plus(refreshTtl))
                .used(false)
                .build();

            principalCache.put(principal.getUserId(), principal);
            return tokenStore.recordRefreshToken(refresh)
                .then(Mono.fromSupplier(() -> toPair(principal, refresh, now)))
                .doOnSuccess(pair -> log.debug("Issued token chain {} for principal {}",
                    refresh.getChainId(), principal.getUserId()));
        });
    }

    @Override
    public Mono<Principal> validateAccess(String accessToken) {
        return verify(accessVerifier, accessToken)
            .flatMap(jwt -> {
                String principalId = jwt.getSubject();
                String chainId = jwt.getClaim(CLAIM_CHAIN).asString();
                Long issuedAtMs = jwt.getClaim(CLAIM_ISSUED_AT_MS).asLong();
                if (principalId == null || chainId == null || issuedAtMs == null || jwt.getId() == null) {
                    return Mono.<Principal>error(AuthException.invalid("Access token is missing required claims"));
                }
                return tokenStore.isRevoked(principalId, chainId, jwt.getId(), issuedAtMs)
                    .flatMap(revoked -> revoked
                        ? Mono.<Principal>error(AuthException.revoked("Access token has been revoked"))
                        : loadPrincipal(principalId));
            })
            .doOnError(AuthException.class, err -> metricsService.recordAuthFailure(err.getCode()));
    }

    @Override
    public Mono<TokenPair> rotate(String refreshToken) {
        return verify(refreshVerifier, refreshToken)
            .flatMap(jwt -> {
                String tokenId = jwt.getId();
                String principalId = jwt.getSubject();
                String chainId = jwt.getClaim(CLAIM_CHAIN).asString();
                Long issuedAtMs = jwt.getClaim(CLAIM_ISSUED_AT_MS).asLong();
                if (tokenId == null || principalId == null || chainId == null || issuedAtMs == null) {
                    return Mono.<TokenPair>error(AuthException.invalid("Refresh token is missing required claims"));
                }
                return tokenStore.isRevoked(principalId, chainId, tokenId, issuedAtMs)
                    .flatMap(revoked -> revoked
                        ? Mono.<TokenPair>error(AuthException.revoked("Refresh token has been revoked"))
                        : redeem(tokenId, principalId, chainId));
            })
            .doOnError(AuthException.class, err -> metricsService.recordAuthFailure(err.getCode()));
    }

    private Mono<TokenPair> redeem(String tokenId, String principalId, String chainId) {
        return tokenStore.findRefreshToken(tokenId)
            .switchIfEmpty(Mono.error(() -> AuthException.invalid("Unknown refresh token")))
            .flatMap(record -> issueTime(principalId).flatMap(now -> {
                if (!record.getPrincipalId().equals(principalId) || !record.getChainId().equals(chainId)) {
                    return Mono.<TokenPair>error(AuthException.invalid("Refresh token does not match its record"));
                }
                if (record.isExpired(now)) {
                    return Mono.<TokenPair>error(AuthException.expired("Refresh token has expired"));
                }

                RefreshToken replacement = RefreshToken.builder()
                    .tokenId(UUID.randomUUID().toString())
                    .principalId(principalId)
                    .chainId(chainId)
                    .parentId(tokenId)
                    .issuedAt(now)
                    .expiresAt(now.plus(refreshTtl))
                    .used(false)
                    .build();

                return tokenStore.markUsed(tokenId, replacement)
                    .flatMap(outcome -> switch (outcome) {
                        case ROTATED -> {
                            metricsService.recordRotation();
                            principalCache.invalidate(principalId);
                            yield loadPrincipal(principalId)
                                .map(principal -> toPair(principal, replacement, now));
                        }
                        case ALREADY_USED -> onReplay(tokenId, principalId, chainId);
                        case NOT_FOUND -> Mono.<TokenPair>error(AuthException.invalid("Unknown refresh token"));
                    });
            }));
    }

    /**
     * Issue time for new tokens of a principal: now, or just after a live revocation cut-off
     * set within the same millisecond, so a login right after "logout everywhere" survives it.
     */
    private Mono<Instant> issueTime(String principalId) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return tokenStore.principalCutoff(principalId)
                .map(cutoff -> cutoff < now.toEpochMilli() ? now : Instant.ofEpochMilli(cutoff + 1))
                .defaultIfEmpty(now);
        });
    }

    private Mono<TokenPair> onReplay(String tokenId, String principalId, String chainId) {
        log.warn("Refresh token {} of principal {} redeemed twice, revoking chain {}", tokenId, principalId, chainId);
        metricsService.recordReplay();
        return tokenStore.revokeChain(chainId, refreshTtl)
            .then(Mono.error(AuthException.replay("Refresh token already used; token chain revoked")));
    }

    @Override
    public Mono<Void> revokePrincipal(String principalId) {
        return tokenStore.revokePrincipal(principalId, clock.millis(), refreshTtl)
            .doOnSuccess(v -> {
                principalCache.invalidate(principalId);
                log.info("Revoked all tokens of principal {}", principalId);
            });
    }

    @Override
    public Mono<Void> revokeToken(String tokenId) {
        return tokenStore.revokeToken(tokenId, refreshTtl)
            .doOnSuccess(v -> log.info("Revoked token {}", tokenId));
    }

    @Override
    public Mono<Void> logout(String accessToken, boolean everywhere) {
        return verify(accessVerifier, accessToken)
            .flatMap(jwt -> {
                String principalId = jwt.getSubject();
                String chainId = jwt.getClaim(CLAIM_CHAIN).asString();
                if (principalId == null || chainId == null) {
                    return Mono.<Void>error(AuthException.invalid("Access token is missing required claims"));
                }
                if (everywhere) {
                    return revokePrincipal(principalId);
                }
                return tokenStore.revokeChain(chainId, refreshTtl)
                    .then(tokenStore.revokeToken(jwt.getId(), accessTtl))
                    .doOnSuccess(v -> log.info("Principal {} logged out of chain {}", principalId, chainId));
            });
    }

    @Override
    public void invalidatePrincipal(String principalId) {
        principalCache.invalidate(principalId);
    }

    private Mono<Principal> loadPrincipal(String principalId) {
        Principal cached = principalCache.getIfPresent(principalId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return principalDirectory.findPrincipal(principalId)
            .doOnNext(principal -> principalCache.put(principalId, principal))
            .switchIfEmpty(Mono.error(() -> AuthException.invalid("Unknown principal")));
    }

    private Mono<DecodedJWT> verify(JWTVerifier verifier, String token) {
        if (token == null || token.isBlank()) {
            return Mono.error(AuthException.invalid("Missing token"));
        }
        return Mono.fromCallable(() -> verifier.verify(token))
            .onErrorMap(TokenExpiredException.class, err -> AuthException.expired("Token has expired"))
            .onErrorMap(err -> err instanceof JWTVerificationException && !(err instanceof TokenExpiredException),
                err -> {
                    log.debug("JWT verification failed: {}", err.getMessage());
                    return AuthException.invalid("Token is invalid");
                });
    }

    private TokenPair toPair(Principal principal, RefreshToken refresh, Instant now) {
        Instant accessExpiresAt = now.plus(accessTtl);
        String access = JWT.create()
            .withIssuer(issuer)
            .withSubject(principal.getUserId())
            .withJWTId(UUID.randomUUID().toString())
            .withIssuedAt(now)
            .withExpiresAt(accessExpiresAt)
            .withClaim(CLAIM_TYPE, TYPE_ACCESS)
            .withClaim(CLAIM_CHAIN, refresh.getChainId())
            .withClaim(CLAIM_ISSUED_AT_MS, now.toEpochMilli())
            .withClaim(CLAIM_NAME, principal.getDisplayName())
            .withClaim(CLAIM_NONCE, nonce())
            .sign(accessAlgorithm);

        String refreshJwt = JWT.create()
            .withIssuer(issuer)
            .withSubject(principal.getUserId())
            .withJWTId(refresh.getTokenId())
            .withIssuedAt(refresh.getIssuedAt())
            .withExpiresAt(refresh.getExpiresAt())
            .withClaim(CLAIM_TYPE, TYPE_REFRESH)
            .withClaim(CLAIM_CHAIN, refresh.getChainId())
            .withClaim(CLAIM_ISSUED_AT_MS, refresh.getIssuedAt().toEpochMilli())
            .sign(refreshAlgorithm);

        return TokenPair.builder()
            .principalId(principal.getUserId())
            .accessToken(access)
            .accessExpiresAt(accessExpiresAt)
            .refreshToken(refreshJwt)
            .refreshExpiresAt(refresh.getExpiresAt())
            .build();
    }

    private String nonce() {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
