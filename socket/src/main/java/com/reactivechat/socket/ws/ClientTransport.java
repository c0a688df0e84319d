package com.reactivechat.socket.ws;

import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Bidirectional text-frame channel to one client, as seen by the {@link ConnectionSupervisor}.
 */
public interface ClientTransport {

    /**
     * @return inbound frames; completes when the client closes or the transport drops
     */
    Flux<String> receive();

    /**
     * Writes frames in order.
     *
     * @return Mono completing once the publisher completed and its frames were written
     */
    Mono<Void> send(Publisher<String> frames);

    /**
     * Sends a close frame with the given status.
     */
    Mono<Void> close(int code, String reason);
}
