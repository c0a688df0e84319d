package com.reactivechat.socket.ws;

import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * {@link ClientTransport} over a Reactor Netty WebSocket.
 */
public class WebSocketClientTransport implements ClientTransport {
    private final WebsocketInbound inbound;
    private final WebsocketOutbound outbound;

    public WebSocketClientTransport(WebsocketInbound inbound, WebsocketOutbound outbound) {
        this.inbound = inbound;
        this.outbound = outbound;
    }

    @Override
    public Flux<String> receive() {
        return inbound.aggregateFrames()
            .receive()
            .asString();
    }

    @Override
    public Mono<Void> send(Publisher<String> frames) {
        return outbound.sendString(frames).then();
    }

    @Override
    public Mono<Void> close(int code, String reason) {
        return outbound.sendClose(code, reason);
    }
}
