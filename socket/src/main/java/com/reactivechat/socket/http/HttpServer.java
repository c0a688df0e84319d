package com.reactivechat.socket.http;

import com.reactivechat.core.util.JsonUtils;
import com.reactivechat.socket.drain.DrainService;
import com.reactivechat.socket.metrics.PrometheusMetricsExporter;
import com.reactivechat.socket.redis.RedisService;
import com.reactivechat.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * HTTP server for WebSocket upgrades, token endpoints, health checks, metrics and drain.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);
    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final int port;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final AuthHandler authHandler;
    private final PrometheusMetricsExporter metricsExporter;
    private final DrainService drainService;
    @Nullable
    private final RedisService redisService;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(port)
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", this::liveness)
                .get("/readyz", this::readiness)
                .post("/drain", this::drain)
                .get("/drain/status", (req, res) -> json(res, HttpResponseStatus.OK, drainStatus()))
                .get("/metrics", (req, res) -> res.header("Content-Type", PROMETHEUS_CONTENT_TYPE)
                    .sendString(Mono.fromSupplier(metricsExporter::scrape)))
                .post("/auth/refresh", authHandler::refresh)
                .post("/auth/logout", authHandler::logout)
                .get("/ws", upgradeHandler::handle)
            )
            .bind()
            .doOnNext(s -> log.info("HTTP server listening on port {}", s.port()))
            .doOnError(err -> log.error("HTTP server failed to bind port {}", port, err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }

    private Mono<Void> liveness(HttpServerRequest req, HttpServerResponse res) {
        return drainService.isDraining()
            ? json(res, HttpResponseStatus.SERVICE_UNAVAILABLE, Map.of("status", "draining"))
            : json(res, HttpResponseStatus.OK, Map.of("status", "up"));
    }

    // Not ready while draining, or while the shared store is unreachable.
    private Mono<Void> readiness(HttpServerRequest req, HttpServerResponse res) {
        if (drainService.isDraining()) {
            return json(res, HttpResponseStatus.SERVICE_UNAVAILABLE, Map.of("status", "draining"));
        }
        Mono<Boolean> storeUp = redisService == null ? Mono.just(true) : redisService.isHealthy();
        return storeUp.flatMap(up -> up
            ? json(res, HttpResponseStatus.OK, Map.of("status", "ready"))
            : json(res, HttpResponseStatus.SERVICE_UNAVAILABLE, Map.of("status", "store_unavailable")));
    }

    private Mono<Void> drain(HttpServerRequest req, HttpServerResponse res) {
        log.warn("Drain requested over HTTP, {} connections open", drainService.getRemainingConnections());
        return drainService.startDrain()
            .then(Mono.defer(() -> json(res, HttpResponseStatus.ACCEPTED, drainStatus())));
    }

    private Map<String, Object> drainStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("draining", drainService.isDraining());
        status.put("complete", drainService.isDrainComplete());
        status.put("remaining", drainService.getRemainingConnections());
        return status;
    }

    private static Mono<Void> json(HttpServerResponse res, HttpResponseStatus status, Object body) {
        return res.status(status)
            .header("Content-Type", "application/json")
            .sendString(Mono.just(JsonUtils.writeValueAsString(body)))
            .then();
    }
}
