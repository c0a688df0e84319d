package com.reactivechat.socket.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.reactivechat.core.error.AuthException;
import com.reactivechat.core.error.ErrorCode;
import com.reactivechat.core.model.Principal;
import com.reactivechat.core.model.TokenPair;
import com.reactivechat.socket.TestConfigs;
import com.reactivechat.socket.config.SocketConfig;
import com.reactivechat.socket.metrics.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Signal;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenServiceTest {

    private static final Principal ALICE = new Principal("alice", "Alice", Set.of("g1"));

    private SocketConfig config;
    private InMemoryTokenStore tokenStore;
    private InMemoryPrincipalDirectory directory;
    private TokenService tokenService;

    @BeforeEach
    void setUp() {
        config = TestConfigs.config();
        tokenStore = new InMemoryTokenStore();
        directory = new InMemoryPrincipalDirectory().register(ALICE);
        tokenService = new TokenService(config, tokenStore, directory,
            new MetricsService(new SimpleMeterRegistry(), config));
    }

    // ========== Issue / validate ==========

    @Test
    void testIssuedAccessToken_ValidatesToPrincipal() {
        TokenPair pair = tokenService.issue(ALICE).block();

        StepVerifier.create(tokenService.validateAccess(pair.getAccessToken()))
            .assertNext(principal -> {
                assertEquals("alice", principal.getUserId());
                assertEquals("Alice", principal.getDisplayName());
            })
            .verifyComplete();
        assertEquals("bearer", pair.getTokenType());
        assertTrue(pair.getRefreshExpiresAt().isAfter(pair.getAccessExpiresAt()));
    }

    @Test
    void testRefreshTokenRecordedUnused() {
        TokenPair pair = tokenService.issue(ALICE).block();
        String tokenId = JWT.decode(pair.getRefreshToken()).getId();

        StepVerifier.create(tokenStore.findRefreshToken(tokenId))
            .assertNext(record -> {
                assertEquals("alice", record.getPrincipalId());
                assertFalse(record.isUsed());
            })
            .verifyComplete();
    }

    @Test
    void testExpiredAccessToken_FailsExpired() {
        Clock past = Clock.fixed(Instant.now().minus(Duration.ofHours(2)), ZoneOffset.UTC);
        TokenService pastService = new TokenService(config, tokenStore, directory,
            new MetricsService(new SimpleMeterRegistry(), config), past);
        TokenPair pair = pastService.issue(ALICE).block();

        StepVerifier.create(tokenService.validateAccess(pair.getAccessToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_EXPIRED, err))
            .verify();
    }

    @Test
    void testTamperedOrForeignToken_FailsInvalid() {
        String forged = JWT.create()
            .withIssuer(config.getTokenIssuer())
            .withSubject("alice")
            .withJWTId("x")
            .withExpiresAt(new Date(System.currentTimeMillis() + 60_000))
            .withClaim("typ", "access")
            .withClaim("chain", "c")
            .withClaim("iat_ms", System.currentTimeMillis())
            .sign(Algorithm.HMAC256("some-other-secret".getBytes(StandardCharsets.UTF_8)));

        StepVerifier.create(tokenService.validateAccess(forged))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_INVALID, err))
            .verify();
        StepVerifier.create(tokenService.validateAccess("not-a-jwt"))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_INVALID, err))
            .verify();
        StepVerifier.create(tokenService.validateAccess(null))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_INVALID, err))
            .verify();
    }

    @Test
    void testRefreshTokenIsNotAnAccessToken() {
        TokenPair pair = tokenService.issue(ALICE).block();

        StepVerifier.create(tokenService.validateAccess(pair.getRefreshToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_INVALID, err))
            .verify();
    }

    @Test
    void testUnknownPrincipal_FailsInvalid() {
        TokenPair pair = tokenService.issue(new Principal("ghost", "Ghost", Set.of())).block();
        tokenService.invalidatePrincipal("ghost");

        StepVerifier.create(tokenService.validateAccess(pair.getAccessToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_INVALID, err))
            .verify();
    }

    // ========== Revocation ==========

    @Test
    void testRevokePrincipal_RejectsAccessAndRefresh() {
        TokenPair pair = tokenService.issue(ALICE).block();

        StepVerifier.create(tokenService.revokePrincipal("alice")).verifyComplete();

        StepVerifier.create(tokenService.validateAccess(pair.getAccessToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_REVOKED, err))
            .verify();
        StepVerifier.create(tokenService.rotate(pair.getRefreshToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_REVOKED, err))
            .verify();
    }

    @Test
    void testRevokeTokenId_RejectsOnlyThatToken() {
        TokenPair first = tokenService.issue(ALICE).block();
        TokenPair second = tokenService.issue(ALICE).block();

        StepVerifier.create(tokenService.revokeToken(JWT.decode(first.getAccessToken()).getId()))
            .verifyComplete();

        StepVerifier.create(tokenService.validateAccess(first.getAccessToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_REVOKED, err))
            .verify();
        StepVerifier.create(tokenService.validateAccess(second.getAccessToken()))
            .expectNextCount(1)
            .verifyComplete();
    }

    @Test
    void testLogout_RevokesOwnChainOnly() {
        TokenPair phone = tokenService.issue(ALICE).block();
        TokenPair laptop = tokenService.issue(ALICE).block();

        StepVerifier.create(tokenService.logout(phone.getAccessToken(), false)).verifyComplete();

        StepVerifier.create(tokenService.rotate(phone.getRefreshToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_REVOKED, err))
            .verify();
        StepVerifier.create(tokenService.validateAccess(laptop.getAccessToken()))
            .expectNextCount(1)
            .verifyComplete();
    }

    @Test
    void testLogoutEverywhere_RevokesAllChains() {
        TokenPair phone = tokenService.issue(ALICE).block();
        TokenPair laptop = tokenService.issue(ALICE).block();

        StepVerifier.create(tokenService.logout(phone.getAccessToken(), true)).verifyComplete();

        StepVerifier.create(tokenService.validateAccess(laptop.getAccessToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_REVOKED, err))
            .verify();
    }

    @Test
    @DisplayName("A login in the same millisecond as a revoke is not caught by the cut-off")
    void testIssueInSameMillisecondAsRevoke_IsValid() {
        Clock frozen = Clock.fixed(Instant.now(), ZoneOffset.UTC);
        TokenService frozenService = new TokenService(config, new InMemoryTokenStore(frozen), directory,
            new MetricsService(new SimpleMeterRegistry(), config), frozen);
        TokenPair before = frozenService.issue(ALICE).block();

        frozenService.revokePrincipal("alice").block();
        TokenPair after = frozenService.issue(ALICE).block();

        StepVerifier.create(frozenService.validateAccess(before.getAccessToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_REVOKED, err))
            .verify();
        StepVerifier.create(frozenService.validateAccess(after.getAccessToken()))
            .expectNextCount(1)
            .verifyComplete();
        TokenPair rotated = frozenService.rotate(after.getRefreshToken()).block();
        StepVerifier.create(frozenService.validateAccess(rotated.getAccessToken()))
            .expectNextCount(1)
            .verifyComplete();
    }

    @Test
    void testReloginAfterRevoke_NeverRejected() {
        for (int i = 0; i < 200; i++) {
            tokenService.revokePrincipal("alice").block();
            TokenPair pair = tokenService.issue(ALICE).block();

            StepVerifier.create(tokenService.validateAccess(pair.getAccessToken()))
                .expectNextCount(1)
                .verifyComplete();
        }
    }

    // ========== Rotation ==========

    @Test
    void testRotate_IssuesNewPairInSameChain() {
        TokenPair pair = tokenService.issue(ALICE).block();

        TokenPair rotated = tokenService.rotate(pair.getRefreshToken()).block();

        assertNotEquals(pair.getRefreshToken(), rotated.getRefreshToken());
        assertEquals(JWT.decode(pair.getRefreshToken()).getClaim("chain").asString(),
            JWT.decode(rotated.getRefreshToken()).getClaim("chain").asString());
        StepVerifier.create(tokenService.validateAccess(rotated.getAccessToken()))
            .expectNextCount(1)
            .verifyComplete();

        String childId = JWT.decode(rotated.getRefreshToken()).getId();
        StepVerifier.create(tokenStore.findRefreshToken(childId))
            .assertNext(child -> assertEquals(JWT.decode(pair.getRefreshToken()).getId(), child.getParentId()))
            .verifyComplete();
    }

    @Test
    @DisplayName("A second rotation of the same refresh token fails with TOKEN_REPLAY and revokes the chain")
    void testReplay_RevokesWholeChain() {
        TokenPair original = tokenService.issue(ALICE).block();
        TokenPair rotated = tokenService.rotate(original.getRefreshToken()).block();

        StepVerifier.create(tokenService.rotate(original.getRefreshToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.TOKEN_REPLAY, err))
            .verify();

        // Descendants minted from the stolen token are dead too
        StepVerifier.create(tokenService.validateAccess(rotated.getAccessToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_REVOKED, err))
            .verify();
        StepVerifier.create(tokenService.rotate(rotated.getRefreshToken()))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_REVOKED, err))
            .verify();
    }

    @Test
    @DisplayName("Two concurrent rotations of one refresh token: exactly one wins")
    void testConcurrentRotate_ExactlyOneSucceeds() {
        for (int round = 0; round < 20; round++) {
            TokenPair pair = tokenService.issue(ALICE).block();

            List<Signal<TokenPair>> outcomes = Mono.zip(
                    tokenService.rotate(pair.getRefreshToken()).materialize().subscribeOn(Schedulers.parallel()),
                    tokenService.rotate(pair.getRefreshToken()).materialize().subscribeOn(Schedulers.parallel()))
                .map(results -> List.of(results.getT1(), results.getT2()))
                .block(Duration.ofSeconds(5));

            long successes = outcomes.stream().filter(Signal::isOnNext).count();
            long replays = outcomes.stream()
                .filter(Signal::isOnError)
                .filter(signal -> signal.getThrowable() instanceof AuthException
                    && ((AuthException) signal.getThrowable()).getCode() == ErrorCode.TOKEN_REPLAY)
                .count();
            assertEquals(1, successes, "exactly one rotation must succeed");
            assertEquals(1, replays, "the other must fail as a replay");

            String chainId = JWT.decode(pair.getRefreshToken()).getClaim("chain").asString();
            StepVerifier.create(tokenStore.isRevoked("alice", chainId, "any", System.currentTimeMillis()))
                .expectNext(true)
                .verifyComplete();
        }
    }

    @Test
    void testRotateUnknownRefreshToken_FailsInvalid() {
        String unknown = JWT.create()
            .withIssuer(config.getTokenIssuer())
            .withSubject("alice")
            .withJWTId("never-recorded")
            .withExpiresAt(new Date(System.currentTimeMillis() + 60_000))
            .withClaim("typ", "refresh")
            .withClaim("chain", "c")
            .withClaim("iat_ms", System.currentTimeMillis())
            .sign(Algorithm.HMAC256(config.getRefreshTokenSecret().getBytes(StandardCharsets.UTF_8)));

        StepVerifier.create(tokenService.rotate(unknown))
            .expectErrorSatisfies(err -> assertCode(ErrorCode.AUTH_INVALID, err))
            .verify();
    }

    private static void assertCode(ErrorCode expected, Throwable err) {
        assertTrue(err instanceof AuthException, "expected AuthException but got " + err);
        assertEquals(expected, ((AuthException) err).getCode());
    }
}
