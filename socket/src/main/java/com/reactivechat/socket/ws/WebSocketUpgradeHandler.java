package com.reactivechat.socket.ws;

import com.reactivechat.socket.drain.DrainService;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.stream.Stream;

/**
 * Handles WebSocket upgrade requests on {@code /ws}.
 * <p>
 * The access token is taken from the {@code Authorization: Bearer} header or, for browser
 * clients that cannot set headers, the {@code access_token} query parameter. It is checked
 * after the upgrade so the failure reaches the client as a close code.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final ConnectionSupervisor supervisor;
    private final DrainService drainService;

    public WebSocketUpgradeHandler(ConnectionSupervisor supervisor, DrainService drainService) {
        this.supervisor = supervisor;
        this.drainService = drainService;
    }

    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        if (drainService.isDraining()) {
            log.warn("Rejecting new WebSocket connection - node is draining");
            return res.status(503)
                .sendString(Mono.just("Service unavailable - node is draining"))
                .then();
        }

        String credential = extractCredential(req.requestHeaders().get(HttpHeaderNames.AUTHORIZATION), req.uri());

        return res.sendWebsocket((inbound, outbound) ->
            supervisor.supervise(new WebSocketClientTransport(inbound, outbound), credential)
        );
    }

    /**
     * Access token of a request: the bearer header wins over the {@code access_token} query
     * parameter. Also used by the logout endpoint.
     */
    @Nullable
    public static String extractCredential(@Nullable String authorization, String uri) {
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }

        QueryStringDecoder decoder = new QueryStringDecoder(uri);
        return Stream.ofNullable(decoder.parameters().get("access_token"))
            .flatMap(Collection::stream)
            .findFirst()
            .orElse(null);
    }
}
