package com.reactivechat.socket.broker;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local broker. Several nodes created in one JVM can share an instance, which is how
 * multi-node fan-out is exercised without Kafka.
 * <p>
 * Subscribers are invoked on the publishing thread.
 * </p>
 */
public class InMemoryBrokerTransport implements IBrokerTransport {

    private final Map<String, Sinks.Many<String>> channels = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> start() {
        return Mono.empty();
    }

    @Override
    public Mono<Void> publish(String channel, String key, String payload) {
        return Mono.fromRunnable(() -> {
            Sinks.Many<String> sink = channel(channel);
            Sinks.EmitResult result;
            synchronized (sink) {
                result = sink.tryEmitNext(payload);
            }
            // Nobody listening is not a publish failure
            if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                throw new IllegalStateException("Publish to " + channel + " failed: " + result);
            }
        });
    }

    @Override
    public Flux<String> subscribe(String channel) {
        return channel(channel).asFlux();
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> channels.values().forEach(Sinks.Many::tryEmitComplete));
    }

    private Sinks.Many<String> channel(String name) {
        return channels.computeIfAbsent(name, n -> Sinks.many().multicast().directBestEffort());
    }
}
