package com.reactivechat.socket;

import com.reactivechat.socket.auth.IPrincipalDirectory;
import com.reactivechat.socket.auth.ITokenStore;
import com.reactivechat.socket.auth.InMemoryPrincipalDirectory;
import com.reactivechat.socket.auth.InMemoryTokenStore;
import com.reactivechat.socket.auth.RedisPrincipalDirectory;
import com.reactivechat.socket.auth.RedisTokenStore;
import com.reactivechat.socket.auth.TokenService;
import com.reactivechat.socket.broker.BrokerBridge;
import com.reactivechat.socket.broker.IBrokerTransport;
import com.reactivechat.socket.broker.InMemoryBrokerTransport;
import com.reactivechat.socket.broker.KafkaBrokerTransport;
import com.reactivechat.socket.config.SocketConfig;
import com.reactivechat.socket.delivery.DeliveryRouter;
import com.reactivechat.socket.delivery.EventDeduplicator;
import com.reactivechat.socket.drain.DrainService;
import com.reactivechat.socket.http.AuthHandler;
import com.reactivechat.socket.http.HttpServer;
import com.reactivechat.socket.metrics.MetricsService;
import com.reactivechat.socket.metrics.PrometheusMetricsExporter;
import com.reactivechat.socket.redis.RedisService;
import com.reactivechat.socket.session.SessionRegistry;
import com.reactivechat.socket.store.IConversationStore;
import com.reactivechat.socket.store.InMemoryConversationStore;
import com.reactivechat.socket.store.RedisConversationStore;
import com.reactivechat.socket.ws.ConnectionSupervisor;
import com.reactivechat.socket.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;

import java.time.Duration;

/**
 * Main entry point for a chat node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve authenticated WebSockets at /ws</li>
 *   <li>Route messages to local connections and publish them to the shared broker</li>
 *   <li>Consume the broker and push events from other nodes</li>
 *   <li>Serve /auth/refresh and /auth/logout</li>
 *   <li>Expose /healthz, /readyz, /metrics and /drain</li>
 * </ul>
 * </p>
 */
public class SocketApp {
    private static final Logger log = LoggerFactory.getLogger(SocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting chat node: {}", config.getNodeId());
        log.info("  Broker: {} ({})", config.getBrokerType(), config.getKafkaBootstrap());
        log.info("  Store: {} ({})", config.getStoreType(), config.getRedisUrl());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config);
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        RedisService redisService = null;
        ITokenStore tokenStore;
        IPrincipalDirectory principalDirectory;
        IConversationStore conversationStore;
        if (config.getStoreType() == SocketConfig.StoreType.REDIS) {
            redisService = new RedisService(config);
            tokenStore = new RedisTokenStore(redisService.commands());
            principalDirectory = new RedisPrincipalDirectory(redisService.commands());
            conversationStore = new RedisConversationStore(redisService.commands());
        } else {
            log.warn("Using in-memory storage: state is lost on restart and not shared between nodes");
            tokenStore = new InMemoryTokenStore();
            principalDirectory = new InMemoryPrincipalDirectory();
            conversationStore = new InMemoryConversationStore();
        }

        IBrokerTransport transport = config.getBrokerType() == SocketConfig.BrokerType.KAFKA
            ? new KafkaBrokerTransport(config)
            : new InMemoryBrokerTransport();

        TokenService tokenService = new TokenService(config, tokenStore, principalDirectory, metricsService);
        SessionRegistry registry = new SessionRegistry();
        metricsService.registerConnectionGauge(registry::connectionCount);

        BrokerBridge bridge = new BrokerBridge(transport, config, metricsService);
        DeliveryRouter router = new DeliveryRouter(
            conversationStore, registry, bridge, new EventDeduplicator(config), metricsService, config
        );
        ConnectionSupervisor supervisor = new ConnectionSupervisor(
            config, tokenService, registry, router, metricsService
        );
        DrainService drainService = new DrainService(registry, config);

        // Broker first, so nothing published after the HTTP server opens is missed
        bridge.start().block(Duration.ofSeconds(30));
        Disposable subscription = bridge.subscribe(router::onEvent);

        HttpServer httpServer = new HttpServer(
            config.getHttpPort(),
            new WebSocketUpgradeHandler(supervisor, drainService),
            new AuthHandler(tokenService),
            metricsExporter,
            drainService,
            redisService
        );
        httpServer.start();

        log.info("Chat node {} is ready", config.getNodeId());

        handleShutdown(config, drainService, subscription, bridge, httpServer, redisService);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(SocketConfig config,
                                       DrainService drainService,
                                       Disposable subscription,
                                       BrokerBridge bridge,
                                       HttpServer httpServer,
                                       RedisService redisService) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            // Close every connection with a reconnect hint before the transport goes away
            drainService.startDrain()
                .then(drainService.awaitDrained(config.getDrainTimeout()))
                .block(config.getDrainTimeout().plusSeconds(5));
            drainService.stop();

            subscription.dispose();
            bridge.stop().block(Duration.ofSeconds(10));

            httpServer.stop();

            if (redisService != null) {
                redisService.close();
            }

            log.info("Shutdown complete");
        }));
    }
}
