package com.reactivechat.socket.auth;

import com.reactivechat.core.model.RefreshToken;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

class InMemoryTokenStoreTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryTokenStore store = new InMemoryTokenStore(clock);

    @Test
    void testMarkUsed_OnceThenAlreadyUsed() {
        store.recordRefreshToken(token("t1", null)).block();

        StepVerifier.create(store.markUsed("t1", token("t2", "t1")))
            .expectNext(RotationOutcome.ROTATED)
            .verifyComplete();
        StepVerifier.create(store.markUsed("t1", token("t3", "t1")))
            .expectNext(RotationOutcome.ALREADY_USED)
            .verifyComplete();
        StepVerifier.create(store.findRefreshToken("t3"))
            .verifyComplete();
    }

    @Test
    void testMarkUsed_UnknownToken() {
        StepVerifier.create(store.markUsed("missing", token("t2", "missing")))
            .expectNext(RotationOutcome.NOT_FOUND)
            .verifyComplete();
    }

    @Test
    void testChainRevocationExpiresAfterTtl() {
        store.revokeChain("chain-1", Duration.ofMinutes(1)).block();

        StepVerifier.create(store.isRevoked("alice", "chain-1", "t1", NOW.toEpochMilli()))
            .expectNext(true)
            .verifyComplete();

        clock.advance(Duration.ofMinutes(2));
        StepVerifier.create(store.isRevoked("alice", "chain-1", "t1", NOW.toEpochMilli()))
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    void testPrincipalCutoff_OnlyOlderTokensRevoked() {
        store.revokePrincipal("alice", NOW.toEpochMilli(), Duration.ofDays(7)).block();

        StepVerifier.create(store.isRevoked("alice", "c", "t", NOW.minusSeconds(10).toEpochMilli()))
            .expectNext(true)
            .verifyComplete();
        StepVerifier.create(store.isRevoked("alice", "c", "t", NOW.plusSeconds(10).toEpochMilli()))
            .expectNext(false)
            .verifyComplete();
        StepVerifier.create(store.isRevoked("bob", "c", "t", NOW.minusSeconds(10).toEpochMilli()))
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    void testPrincipalCutoffExpiresAfterTtl() {
        store.revokePrincipal("alice", NOW.toEpochMilli(), Duration.ofMinutes(1)).block();

        StepVerifier.create(store.principalCutoff("alice"))
            .expectNext(NOW.toEpochMilli())
            .verifyComplete();

        clock.advance(Duration.ofMinutes(2));
        StepVerifier.create(store.principalCutoff("alice"))
            .verifyComplete();
        StepVerifier.create(store.isRevoked("alice", "c", "t", NOW.minusSeconds(10).toEpochMilli()))
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    void testPrincipalCutoff_LaterRevokeWins() {
        store.revokePrincipal("alice", NOW.toEpochMilli(), Duration.ofMinutes(1)).block();
        store.revokePrincipal("alice", NOW.minusSeconds(30).toEpochMilli(), Duration.ofMinutes(5)).block();

        StepVerifier.create(store.principalCutoff("alice"))
            .expectNext(NOW.toEpochMilli())
            .verifyComplete();
    }

    private static RefreshToken token(String id, String parentId) {
        return RefreshToken.builder()
            .tokenId(id)
            .principalId("alice")
            .chainId("chain-1")
            .parentId(parentId)
            .issuedAt(NOW)
            .expiresAt(NOW.plus(Duration.ofDays(7)))
            .build();
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
