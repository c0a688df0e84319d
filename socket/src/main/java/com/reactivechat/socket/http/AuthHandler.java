package com.reactivechat.socket.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.reactivechat.core.error.ChatException;
import com.reactivechat.core.error.ErrorCode;
import com.reactivechat.core.util.JsonUtils;
import com.reactivechat.socket.auth.ITokenService;
import com.reactivechat.socket.ws.WebSocketUpgradeHandler;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.List;
import java.util.Map;

/**
 * Token endpoints served next to the WebSocket.
 * <ul>
 *   <li>{@code POST /auth/refresh} body {@code {"refreshToken": "..."}}: rotates, 200 with a new pair</li>
 *   <li>{@code POST /auth/logout[?all=true]} with a Bearer access token: revokes its chain
 *   (or every token of the principal), 204</li>
 * </ul>
 * Auth failures answer 401 with {@code {"code", "message"}}.
 */
public class AuthHandler {
    private static final Logger log = LoggerFactory.getLogger(AuthHandler.class);

    private final ITokenService tokenService;

    public AuthHandler(ITokenService tokenService) {
        this.tokenService = tokenService;
    }

    public Mono<Void> refresh(HttpServerRequest req, HttpServerResponse res) {
        return req.receive().aggregate().asString()
            .defaultIfEmpty("")
            .map(AuthHandler::refreshTokenOf)
            .flatMap(tokenService::rotate)
            .map(pair -> new Reply(200, JsonUtils.writeValueAsString(pair)))
            .onErrorResume(err -> Mono.just(errorReply(err)))
            .flatMap(reply -> reply.writeTo(res));
    }

    public Mono<Void> logout(HttpServerRequest req, HttpServerResponse res) {
        String credential = WebSocketUpgradeHandler.extractCredential(
            req.requestHeaders().get(HttpHeaderNames.AUTHORIZATION), req.uri());
        boolean everywhere = new QueryStringDecoder(req.uri()).parameters()
            .getOrDefault("all", List.of())
            .contains("true");

        return tokenService.logout(credential, everywhere)
            .then(Mono.fromCallable(() -> new Reply(204, null)))
            .onErrorResume(err -> Mono.just(errorReply(err)))
            .flatMap(reply -> reply.writeTo(res));
    }

    private static String refreshTokenOf(String body) {
        Map<String, String> fields;
        try {
            fields = JsonUtils.readValue(body, new TypeReference<Map<String, String>>() {
            });
        } catch (IllegalArgumentException e) {
            throw new ChatException(ErrorCode.BAD_REQUEST, "Body must be {\"refreshToken\": \"...\"}");
        }
        String token = fields == null ? null : fields.get("refreshToken");
        if (token == null || token.isBlank()) {
            throw new ChatException(ErrorCode.BAD_REQUEST, "Missing refreshToken");
        }
        return token;
    }

    private static Reply errorReply(Throwable err) {
        ErrorCode code = err instanceof ChatException chat ? chat.getCode() : null;
        if (code == null) {
            log.error("Token endpoint failed", err);
            return new Reply(500, JsonUtils.writeValueAsString(Map.of("code", "INTERNAL", "message", "Internal error")));
        }

        int status;
        if (code.isAuthentication()) {
            log.warn("Token endpoint rejected request: {}", code);
            status = 401;
        } else if (code == ErrorCode.BAD_REQUEST) {
            status = 400;
        } else {
            log.error("Token endpoint failed: {}", code, err);
            status = 503;
        }
        return new Reply(status, JsonUtils.writeValueAsString(
            Map.of("code", code.name(), "message", String.valueOf(err.getMessage()))));
    }

    private static final class Reply {
        private final int status;
        private final String body;

        Reply(int status, String body) {
            this.status = status;
            this.body = body;
        }

        Mono<Void> writeTo(HttpServerResponse res) {
            if (body == null) {
                return res.status(status).send().then();
            }
            return res.status(status)
                .header(HttpHeaderNames.CONTENT_TYPE, "application/json")
                .sendString(Mono.just(body))
                .then();
        }
    }
}
