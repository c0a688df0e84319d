package com.reactivechat.socket.broker;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Named-channel pub/sub transport shared by all nodes (Dependency Inversion Principle).
 * <p>
 * At-least-once, no ordering guarantee across channels or keys. A node subscribed to a channel
 * also receives what it published itself.
 * </p>
 */
public interface IBrokerTransport {

    /**
     * Prepares channels and connections.
     *
     * @return Mono completing when the transport is ready to publish
     */
    Mono<Void> start();

    /**
     * Publishes one payload.
     *
     * @param channel channel name
     * @param key     partitioning key; payloads with the same key keep their relative order
     * @param payload serialized event
     * @return Mono completing when the broker accepted the payload
     */
    Mono<Void> publish(String channel, String key, String payload);

    /**
     * @return every payload published on the channel from now on
     */
    Flux<String> subscribe(String channel);

    Mono<Void> stop();
}
