package com.reactivechat.socket.auth;

import com.reactivechat.core.model.Principal;
import com.reactivechat.core.redis.Keys;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import reactor.core.publisher.Mono;

import java.util.HashSet;

/**
 * Reads principals from {@code user:{id}} hashes and {@code user:{id}:groups} sets.
 */
public class RedisPrincipalDirectory implements IPrincipalDirectory {

    private final RedisReactiveCommands<String, String> commands;

    public RedisPrincipalDirectory(RedisReactiveCommands<String, String> commands) {
        this.commands = commands;
    }

    @Override
    public Mono<Principal> findPrincipal(String principalId) {
        return commands.hget(Keys.user(principalId), "displayName")
            .flatMap(displayName -> commands.smembers(Keys.userGroups(principalId))
                .collect(HashSet<String>::new, HashSet::add)
                .map(groups -> new Principal(principalId, displayName, groups)));
    }
}
