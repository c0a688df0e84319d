package com.reactivechat.socket.auth;

import com.reactivechat.core.model.RefreshToken;
import com.reactivechat.core.redis.Keys;
import io.lettuce.core.KeyValue;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis-backed token store.
 * <p>
 * Rotation runs as a Lua script, which Redis executes atomically: the used flag of the old
 * token is checked and set, and the replacement is written, with no other command in between.
 * </p>
 */
public class RedisTokenStore implements ITokenStore {
    private static final Logger log = LoggerFactory.getLogger(RedisTokenStore.class);

    private static final String MARK_USED_SCRIPT = """
        local used = redis.call('HGET', KEYS[1], 'used')
        if not used then return 'NOT_FOUND' end
        if used == '1' then return 'ALREADY_USED' end
        redis.call('HSET', KEYS[1], 'used', '1')
        redis.call('HSET', KEYS[2], 'principalId', ARGV[1], 'chainId', ARGV[2], 'parentId', ARGV[3],
                   'issuedAt', ARGV[4], 'expiresAt', ARGV[5], 'used', '0')
        redis.call('PEXPIRE', KEYS[2], ARGV[6])
        return 'ROTATED'
        """;

    private final RedisReactiveCommands<String, String> commands;

    public RedisTokenStore(RedisReactiveCommands<String, String> commands) {
        this.commands = commands;
    }

    @Override
    public Mono<Void> recordRefreshToken(RefreshToken token) {
        String key = Keys.refreshToken(token.getTokenId());
        return commands.hset(key, toHash(token))
            .then(commands.pexpire(key, ttlMillis(token)))
            .then()
            .doOnError(err -> log.error("Failed to record refresh token {}", token.getTokenId(), err));
    }

    @Override
    public Mono<RefreshToken> findRefreshToken(String tokenId) {
        return commands.hgetall(Keys.refreshToken(tokenId))
            .collectMap(KeyValue::getKey, KeyValue::getValue)
            .filter(hash -> !hash.isEmpty())
            .map(hash -> fromHash(tokenId, hash));
    }

    @Override
    public Mono<RotationOutcome> markUsed(String tokenId, RefreshToken replacement) {
        String[] keys = {Keys.refreshToken(tokenId), Keys.refreshToken(replacement.getTokenId())};
        return commands.<String>eval(MARK_USED_SCRIPT, ScriptOutputType.VALUE, keys,
                replacement.getPrincipalId(),
                replacement.getChainId(),
                nullToEmpty(replacement.getParentId()),
                String.valueOf(replacement.getIssuedAt().toEpochMilli()),
                String.valueOf(replacement.getExpiresAt().toEpochMilli()),
                String.valueOf(ttlMillis(replacement)))
            .next()
            .map(RotationOutcome::valueOf)
            .doOnError(err -> log.error("Rotation script failed for refresh token {}", tokenId, err));
    }

    @Override
    public Mono<Void> revokeToken(String tokenId, Duration ttl) {
        return commands.set(Keys.revokedToken(tokenId), "1", SetArgs.Builder.px(ttl.toMillis())).then();
    }

    @Override
    public Mono<Void> revokeChain(String chainId, Duration ttl) {
        return commands.set(Keys.revokedChain(chainId), "1", SetArgs.Builder.px(ttl.toMillis())).then();
    }

    @Override
    public Mono<Void> revokePrincipal(String principalId, long cutoffMillis, Duration ttl) {
        return commands.set(Keys.revokedPrincipal(principalId), String.valueOf(cutoffMillis),
                SetArgs.Builder.px(ttl.toMillis()))
            .then();
    }

    @Override
    public Mono<Long> principalCutoff(String principalId) {
        return commands.get(Keys.revokedPrincipal(principalId)).map(Long::parseLong);
    }

    @Override
    public Mono<Boolean> isRevoked(String principalId, String chainId, String tokenId, long issuedAtMillis) {
        Mono<Boolean> byId = commands.exists(Keys.revokedToken(tokenId), Keys.revokedChain(chainId))
            .map(count -> count > 0);
        Mono<Boolean> byCutoff = principalCutoff(principalId)
            .map(cutoff -> issuedAtMillis <= cutoff)
            .defaultIfEmpty(false);
        return byId.flatMap(revoked -> revoked ? Mono.just(true) : byCutoff);
    }

    private static Map<String, String> toHash(RefreshToken token) {
        Map<String, String> hash = new HashMap<>();
        hash.put("principalId", token.getPrincipalId());
        hash.put("chainId", token.getChainId());
        hash.put("parentId", nullToEmpty(token.getParentId()));
        hash.put("issuedAt", String.valueOf(token.getIssuedAt().toEpochMilli()));
        hash.put("expiresAt", String.valueOf(token.getExpiresAt().toEpochMilli()));
        hash.put("used", token.isUsed() ? "1" : "0");
        return hash;
    }

    private static RefreshToken fromHash(String tokenId, Map<String, String> hash) {
        String parentId = hash.get("parentId");
        return RefreshToken.builder()
            .tokenId(tokenId)
            .principalId(hash.get("principalId"))
            .chainId(hash.get("chainId"))
            .parentId(parentId == null || parentId.isEmpty() ? null : parentId)
            .issuedAt(Instant.ofEpochMilli(Long.parseLong(hash.get("issuedAt"))))
            .expiresAt(Instant.ofEpochMilli(Long.parseLong(hash.get("expiresAt"))))
            .used("1".equals(hash.get("used")))
            .build();
    }

    private static long ttlMillis(RefreshToken token) {
        return Math.max(1L, token.getExpiresAt().toEpochMilli() - System.currentTimeMillis());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
