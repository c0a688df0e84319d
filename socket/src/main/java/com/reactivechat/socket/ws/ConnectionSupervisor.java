package com.reactivechat.socket.ws;

import com.reactivechat.core.error.AuthException;
import com.reactivechat.core.error.ChatException;
import com.reactivechat.core.error.ErrorCode;
import com.reactivechat.core.model.Principal;
import com.reactivechat.core.msg.ClientFrame;
import com.reactivechat.core.msg.ServerFrame;
import com.reactivechat.core.util.JsonUtils;
import com.reactivechat.socket.auth.ITokenService;
import com.reactivechat.socket.config.SocketConfig;
import com.reactivechat.socket.delivery.IDeliveryRouter;
import com.reactivechat.socket.delivery.SendResult;
import com.reactivechat.socket.metrics.MetricsService;
import com.reactivechat.socket.session.CloseReason;
import com.reactivechat.socket.session.Connection;
import com.reactivechat.socket.session.ConnectionFactory;
import com.reactivechat.socket.session.ConnectionState;
import com.reactivechat.socket.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Owns the lifecycle of real-time connections.
 * <p>
 * <b>State machine:</b> {@code CONNECTING -> AUTHENTICATED -> ACTIVE -> CLOSING -> CLOSED}.
 * The credential is validated once at connect; a failure closes the transport with the
 * matching auth code and the connection never reaches the registry.
 * </p>
 * <p>
 * <b>Supervision:</b> while active, a timer ticks at the more frequent of the heartbeat and
 * re-validation intervals. Each tick checks liveness (any inbound frame counts, recorded on
 * receipt even while an earlier request is still in flight) and re-runs
 * {@code validateAccess}, so a revoked or expired credential closes the connection within one
 * re-validation interval. Storage errors during re-validation keep the connection open until
 * the next tick.
 * </p>
 * <p>
 * <b>Closing:</b> the first of inbound end, outbound failure, a failed tick or a close request
 * (queue overflow, drain) wins. Graceful closes flush the outbound queue within
 * {@code closeFlushTimeout} and send a {@code closing} frame; forceful closes discard it.
 * </p>
 */
public class ConnectionSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final SocketConfig config;
    private final ITokenService tokenService;
    private final SessionRegistry registry;
    private final IDeliveryRouter router;
    private final ConnectionFactory connectionFactory;
    private final MetricsService metricsService;
    private final Scheduler timer;

    public ConnectionSupervisor(
        SocketConfig config,
        ITokenService tokenService,
        SessionRegistry registry,
        IDeliveryRouter router,
        MetricsService metricsService
    ) {
        this(config, tokenService, registry, router, metricsService, Schedulers.parallel());
    }

    public ConnectionSupervisor(
        SocketConfig config,
        ITokenService tokenService,
        SessionRegistry registry,
        IDeliveryRouter router,
        MetricsService metricsService,
        Scheduler timer
    ) {
        this.config = config;
        this.tokenService = tokenService;
        this.registry = registry;
        this.router = router;
        this.connectionFactory = new ConnectionFactory(config);
        this.metricsService = metricsService;
        this.timer = timer;
    }

    /**
     * Runs one connection from handshake to close.
     *
     * @param transport  client channel
     * @param credential access token presented at connect, may be null
     * @return Mono completing when the connection is closed
     */
    public Mono<Void> supervise(ClientTransport transport, @Nullable String credential) {
        Connection connection = connectionFactory.createConnection();
        log.debug("Connection {} opened, validating credential", connection.getId());

        return tokenService.validateAccess(credential)
            .switchIfEmpty(Mono.error(() -> AuthException.invalid("Unknown principal")))
            .onErrorResume(err -> reject(connection, transport, err).then(Mono.<Principal>empty()))
            .flatMap(principal -> run(connection, transport, credential, principal));
    }

    private Mono<Void> reject(Connection connection, ClientTransport transport, Throwable err) {
        ErrorCode code;
        if (err instanceof ChatException) {
            code = ((ChatException) err).getCode();
        } else {
            // Fail closed: a connection is never admitted without a completed check
            code = ErrorCode.PERSISTENCE_FAILURE;
        }

        if (err instanceof AuthException) {
            log.warn("Rejected connection {}: {} ({})", connection.getId(), code, err.getMessage());
        } else {
            log.error("Credential check failed for connection {}", connection.getId(), err);
        }

        connection.beginClosing();
        connection.markClosed();
        metricsService.recordClose(code.name());

        String frame = JsonUtils.writeValueAsString(ServerFrame.error(null, code, err.getMessage()));
        return transport.send(Mono.just(frame))
            .then(transport.close(code.closeCode(), code.name()))
            .timeout(config.getCloseFlushTimeout(), timer)
            .onErrorResume(e -> {
                log.debug("Could not notify rejected connection {}: {}", connection.getId(), e.toString());
                return Mono.empty();
            });
    }

    private Mono<Void> run(Connection connection, ClientTransport transport, String credential, Principal principal) {
        connection.authenticate(principal);
        MDC.put("principalId", principal.getUserId());
        MDC.put("connectionId", connection.getId());

        registry.register(principal.getUserId(), connection);
        connection.activate();
        log.info("Connection {} active for principal {}", connection.getId(), principal.getUserId());

        connection.offer(ServerFrame.welcome(
            config.getNodeId(),
            connection.getId(),
            principal.getUserId(),
            principal.getDisplayName(),
            config.getHeartbeatInterval().toMillis()
        ));

        // Outbound: drains the connection's queue to the transport
        Sinks.Empty<Void> written = Sinks.empty();
        Disposable writer = transport.send(connection.outboundFlux().map(JsonUtils::writeValueAsString))
            .subscribe(
                null,
                err -> {
                    log.debug("Outbound stream of {} failed: {}", connection.getId(), err.toString());
                    written.tryEmitError(err);
                },
                written::tryEmitEmpty
            );

        // Inbound: liveness and heartbeats are handled on receipt; requests go one at a time,
        // so a connection's sends stay in order
        Sinks.One<CloseReason> inboundEnded = Sinks.one();
        Disposable reader = transport.receive()
            .<ClientFrame>handle((text, sink) -> {
                ClientFrame frame = receive(connection, text);
                if (frame != null) {
                    sink.next(frame);
                }
            })
            .concatMap(frame -> handleRequest(connection, frame))
            .subscribe(
                null,
                err -> inboundEnded.tryEmitValue(CloseReason.transportClosed()),
                () -> inboundEnded.tryEmitValue(CloseReason.clientClosed())
            );

        Mono<CloseReason> outboundEnded = written.asMono()
            .then(Mono.fromCallable(CloseReason::transportClosed))
            .onErrorReturn(CloseReason.transportClosed());

        Duration tick = config.getSupervisionTick();
        Mono<CloseReason> supervision = Flux.interval(tick, tick, timer)
            .onBackpressureDrop()
            .concatMap(i -> check(connection, credential))
            .next();

        return Mono.firstWithSignal(
                inboundEnded.asMono(),
                outboundEnded,
                supervision,
                connection.closeRequested()
            )
            .flatMap(reason -> close(connection, transport, reason, written, inboundEnded, reader, writer));
    }

    /**
     * One supervision tick.
     *
     * @return a close reason, or empty to stay active
     */
    private Mono<CloseReason> check(Connection connection, String credential) {
        long silentMillis = System.currentTimeMillis() - connection.getLastHeartbeat();
        if (silentMillis > config.getLivenessTimeout().toMillis()) {
            log.warn("Connection {} silent for {}ms, closing", connection.getId(), silentMillis);
            return Mono.just(CloseReason.heartbeatTimeout());
        }

        return tokenService.validateAccess(credential)
            .then(Mono.<CloseReason>empty())
            .onErrorResume(AuthException.class, e -> {
                log.warn("Credential of connection {} no longer valid: {}", connection.getId(), e.getCode());
                return Mono.just(CloseReason.of(e.getCode()));
            })
            .onErrorResume(e -> {
                log.warn("Re-validation of connection {} failed, retrying next tick: {}",
                    connection.getId(), e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Records liveness and answers what needs no ordering.
     *
     * @return the frame if it is a request for the serialized lane, otherwise null
     */
    @Nullable
    private ClientFrame receive(Connection connection, String text) {
        connection.touch(System.currentTimeMillis());
        if (connection.getState() != ConnectionState.ACTIVE) {
            return null;
        }

        ClientFrame frame = parse(text);
        if (frame == null) {
            connection.offer(ServerFrame.error(null, ErrorCode.BAD_REQUEST, "Malformed frame"));
            return null;
        }
        if (ClientFrame.HEARTBEAT.equals(frame.getType())) {
            connection.offer(ServerFrame.heartbeatAck());
            return null;
        }
        return frame;
    }

    private Mono<Void> handleRequest(Connection connection, ClientFrame frame) {
        if (connection.getState() != ConnectionState.ACTIVE) {
            return Mono.empty();
        }

        Principal principal = connection.getPrincipal();
        String type = frame.getType() == null ? "" : frame.getType();
        Mono<SendResult> action;
        switch (type) {
            case ClientFrame.SEND -> action = router.send(principal, frame.getTarget(), frame.getPayload());
            case ClientFrame.EDIT -> action = router.edit(principal, frame.getMessageId(), frame.getPayload());
            case ClientFrame.DELETE -> action = router.delete(principal, frame.getMessageId());
            case ClientFrame.READ -> action = router.markRead(principal, frame.getMessageId());
            default -> {
                log.warn("Unknown frame type '{}' on connection {}", type, connection.getId());
                connection.offer(ServerFrame.error(frame.getRef(), ErrorCode.BAD_REQUEST, "Unknown frame type"));
                return Mono.empty();
            }
        }

        return action
            .doOnNext(result -> connection.offer(ServerFrame.ack(
                frame.getRef(),
                result.getEvent().getMessageId(),
                result.getEvent().getSequence(),
                result.isDegraded()
            )))
            .onErrorResume(err -> {
                ErrorCode code = err instanceof ChatException
                    ? ((ChatException) err).getCode()
                    : ErrorCode.PERSISTENCE_FAILURE;
                log.debug("{} from {} failed: {} {}", type, connection.getPrincipalId(), code, err.getMessage());
                connection.offer(ServerFrame.error(frame.getRef(), code, err.getMessage()));
                return Mono.empty();
            })
            .then();
    }

    @Nullable
    private static ClientFrame parse(String text) {
        try {
            return JsonUtils.readValue(text, ClientFrame.class);
        } catch (IllegalArgumentException e) {
            log.debug("Malformed client frame: {}", e.getMessage());
            return null;
        }
    }

    private Mono<Void> close(
        Connection connection,
        ClientTransport transport,
        CloseReason reason,
        Sinks.Empty<Void> written,
        Sinks.One<CloseReason> inboundEnded,
        Disposable reader,
        Disposable writer
    ) {
        return Mono.defer(() -> {
            if (!connection.beginClosing()) {
                return Mono.empty();
            }
            registry.unregister(connection.getPrincipalId(), connection);
            log.info("Closing connection {} of {}: {} ({})",
                connection.getId(), connection.getPrincipalId(), reason.getReason(), reason.getCode());

            Duration flushTimeout = config.getCloseFlushTimeout();
            Mono<Void> teardown;
            if (reason.isGraceful()) {
                connection.completeOutbound(ServerFrame.closing(reason.getReason(), null, reason.getRetryAfterMs()));
                teardown = written.asMono()
                    .timeout(flushTimeout, timer)
                    .onErrorResume(TimeoutException.class, e -> {
                        log.warn("Flush of connection {} timed out, discarding the rest", connection.getId());
                        connection.discardOutbound();
                        return Mono.empty();
                    })
                    .then(transport.close(reason.getCode(), reason.getReason()).timeout(flushTimeout, timer))
                    // let a request already being handled finish
                    .then(inboundEnded.asMono().timeout(flushTimeout, timer).then());
            } else {
                connection.discardOutbound();
                reader.dispose();
                teardown = reason.isTransportGone()
                    ? Mono.empty()
                    : transport.close(reason.getCode(), reason.getReason()).timeout(flushTimeout, timer);
            }

            return teardown
                .onErrorResume(err -> {
                    log.debug("Teardown of connection {} ended with {}", connection.getId(), err.toString());
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    reader.dispose();
                    writer.dispose();
                    connection.markClosed();
                    metricsService.recordClose(reason.getReason());
                    log.debug("Connection {} closed", connection.getId());
                });
        });
    }
}
