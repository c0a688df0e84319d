package com.reactivechat.socket.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a chat node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    public enum BrokerType { KAFKA, LOCAL }

    public enum StoreType { REDIS, MEMORY }

    String nodeId;
    int httpPort;
    BrokerType brokerType;
    String kafkaBootstrap;
    StoreType storeType;
    String redisUrl;

    // Tokens
    String accessTokenSecret;
    String refreshTokenSecret;
    String tokenIssuer;
    Duration accessTokenTtl;
    Duration refreshTokenTtl;
    Duration clockSkew;
    Duration principalCacheTtl;

    // Connection supervision
    Duration heartbeatInterval;
    int missedHeartbeatThreshold;
    Duration revalidationInterval;
    int queueCapacity;
    Duration closeFlushTimeout;

    // Delivery
    Duration dedupWindow;
    long dedupMaxEntries;
    int publishMaxRetries;
    Duration publishRetryBackoff;

    Duration drainTimeout;

    /**
     * Period of the supervision tick: the more frequent of heartbeat and re-validation.
     */
    public Duration getSupervisionTick() {
        return heartbeatInterval.compareTo(revalidationInterval) <= 0 ? heartbeatInterval : revalidationInterval;
    }

    /**
     * Silence after which a connection is considered dead.
     */
    public Duration getLivenessTimeout() {
        return heartbeatInterval.multipliedBy(missedHeartbeatThreshold);
    }

    public static SocketConfig fromEnv() {
        return SocketConfig.builder()
                .nodeId(getEnv("NODE_ID", "chat-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .brokerType(BrokerType.valueOf(getEnv("BROKER", "kafka").toUpperCase()))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .storeType(StoreType.valueOf(getEnv("STORE", "redis").toUpperCase()))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .accessTokenSecret(getEnv("ACCESS_TOKEN_SECRET", "dev-access-secret-change-me-32-bytes!!"))
                .refreshTokenSecret(getEnv("REFRESH_TOKEN_SECRET", "dev-refresh-secret-change-me-32-bytes!"))
                .tokenIssuer(getEnv("TOKEN_ISSUER", "reactive-chat"))
                .accessTokenTtl(Duration.ofMinutes(Long.parseLong(getEnv("ACCESS_TOKEN_TTL_MIN", "30"))))
                .refreshTokenTtl(Duration.ofDays(Long.parseLong(getEnv("REFRESH_TOKEN_TTL_DAYS", "7"))))
                .clockSkew(Duration.ofSeconds(Long.parseLong(getEnv("CLOCK_SKEW_SEC", "5"))))
                .principalCacheTtl(Duration.ofSeconds(Long.parseLong(getEnv("PRINCIPAL_CACHE_TTL_SEC", "60"))))
                .heartbeatInterval(Duration.ofMillis(Long.parseLong(getEnv("HEARTBEAT_INTERVAL_MS", "10000"))))
                .missedHeartbeatThreshold(Integer.parseInt(getEnv("MISSED_HEARTBEATS", "3")))
                .revalidationInterval(Duration.ofMillis(Long.parseLong(getEnv("REVALIDATION_INTERVAL_MS", "15000"))))
                .queueCapacity(Integer.parseInt(getEnv("QUEUE_CAPACITY", "256")))
                .closeFlushTimeout(Duration.ofMillis(Long.parseLong(getEnv("CLOSE_FLUSH_TIMEOUT_MS", "2000"))))
                .dedupWindow(Duration.ofSeconds(Long.parseLong(getEnv("DEDUP_WINDOW_SEC", "120"))))
                .dedupMaxEntries(Long.parseLong(getEnv("DEDUP_MAX_ENTRIES", "100000")))
                .publishMaxRetries(Integer.parseInt(getEnv("PUBLISH_MAX_RETRIES", "3")))
                .publishRetryBackoff(Duration.ofMillis(Long.parseLong(getEnv("PUBLISH_RETRY_BACKOFF_MS", "100"))))
                .drainTimeout(Duration.ofSeconds(Long.parseLong(getEnv("DRAIN_TIMEOUT_SEC", "30"))))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
