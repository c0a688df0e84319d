package com.reactivechat.socket.auth;

import com.reactivechat.core.model.RefreshToken;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local token store for single-node runs and tests.
 * <p>
 * Rotation atomicity comes from {@link ConcurrentHashMap#computeIfPresent}, which runs the
 * check-and-mark step under the bin lock of the token id.
 * </p>
 */
public class InMemoryTokenStore implements ITokenStore {

    private final Clock clock;
    private final Map<String, RefreshToken> refreshTokens = new ConcurrentHashMap<>();
    // id -> expiry (epoch millis)
    private final Map<String, Long> revokedTokens = new ConcurrentHashMap<>();
    private final Map<String, Long> revokedChains = new ConcurrentHashMap<>();
    private final Map<String, Cutoff> revokedPrincipals = new ConcurrentHashMap<>();

    public InMemoryTokenStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTokenStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Void> recordRefreshToken(RefreshToken token) {
        return Mono.fromRunnable(() -> refreshTokens.put(token.getTokenId(), token));
    }

    @Override
    public Mono<RefreshToken> findRefreshToken(String tokenId) {
        return Mono.justOrEmpty(refreshTokens.get(tokenId));
    }

    @Override
    public Mono<RotationOutcome> markUsed(String tokenId, RefreshToken replacement) {
        return Mono.fromSupplier(() -> {
            AtomicReference<RotationOutcome> outcome = new AtomicReference<>(RotationOutcome.NOT_FOUND);
            refreshTokens.computeIfPresent(tokenId, (id, current) -> {
                if (current.isUsed()) {
                    outcome.set(RotationOutcome.ALREADY_USED);
                    return current;
                }
                outcome.set(RotationOutcome.ROTATED);
                return current.withUsed(true);
            });
            if (outcome.get() == RotationOutcome.ROTATED) {
                refreshTokens.put(replacement.getTokenId(), replacement);
            }
            return outcome.get();
        });
    }

    @Override
    public Mono<Void> revokeToken(String tokenId, Duration ttl) {
        return Mono.fromRunnable(() -> revokedTokens.put(tokenId, expiry(ttl)));
    }

    @Override
    public Mono<Void> revokeChain(String chainId, Duration ttl) {
        return Mono.fromRunnable(() -> revokedChains.put(chainId, expiry(ttl)));
    }

    @Override
    public Mono<Void> revokePrincipal(String principalId, long cutoffMillis, Duration ttl) {
        return Mono.fromRunnable(() -> revokedPrincipals.merge(
            principalId,
            new Cutoff(cutoffMillis, expiry(ttl)),
            (current, next) -> new Cutoff(
                Math.max(current.cutoffMillis(), next.cutoffMillis()),
                Math.max(current.expiresAt(), next.expiresAt()))
        ));
    }

    @Override
    public Mono<Long> principalCutoff(String principalId) {
        return Mono.fromSupplier(() -> liveCutoff(principalId, clock.millis()))
            .map(Cutoff::cutoffMillis);
    }

    @Override
    public Mono<Boolean> isRevoked(String principalId, String chainId, String tokenId, long issuedAtMillis) {
        return Mono.fromSupplier(() -> {
            long now = clock.millis();
            if (isLive(revokedTokens, tokenId, now) || isLive(revokedChains, chainId, now)) {
                return true;
            }
            Cutoff cutoff = liveCutoff(principalId, now);
            return cutoff != null && issuedAtMillis <= cutoff.cutoffMillis();
        });
    }

    private Cutoff liveCutoff(String principalId, long now) {
        Cutoff cutoff = revokedPrincipals.get(principalId);
        if (cutoff != null && cutoff.expiresAt() <= now) {
            revokedPrincipals.remove(principalId, cutoff);
            return null;
        }
        return cutoff;
    }

    private long expiry(Duration ttl) {
        return clock.millis() + ttl.toMillis();
    }

    private static boolean isLive(Map<String, Long> revocations, String id, long now) {
        if (id == null) {
            return false;
        }
        Long expiresAt = revocations.get(id);
        if (expiresAt == null) {
            return false;
        }
        if (expiresAt <= now) {
            revocations.remove(id, expiresAt);
            return false;
        }
        return true;
    }

    private record Cutoff(long cutoffMillis, long expiresAt) {
    }
}
