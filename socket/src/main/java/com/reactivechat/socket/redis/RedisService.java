package com.reactivechat.socket.redis;

import com.reactivechat.socket.config.SocketConfig;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Owns the node's single Lettuce connection. All stores share its reactive command set.
 */
public class RedisService {
    private static final Logger log = LoggerFactory.getLogger(RedisService.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisService(SocketConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    public RedisReactiveCommands<String, String> commands() {
        return commands;
    }

    /**
     * @return true if Redis answers PING
     */
    public Mono<Boolean> isHealthy() {
        return commands.ping()
            .map("PONG"::equalsIgnoreCase)
            .onErrorResume(err -> {
                log.warn("Redis health check failed: {}", err.getMessage());
                return Mono.just(false);
            });
    }

    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
