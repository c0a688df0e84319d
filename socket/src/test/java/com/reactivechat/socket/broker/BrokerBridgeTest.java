package com.reactivechat.socket.broker;

import com.reactivechat.core.error.ChatException;
import com.reactivechat.core.error.ErrorCode;
import com.reactivechat.core.model.DeliveryEvent;
import com.reactivechat.core.model.EventKind;
import com.reactivechat.core.msg.Topics;
import com.reactivechat.socket.TestConfigs;
import com.reactivechat.socket.config.SocketConfig;
import com.reactivechat.socket.metrics.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrokerBridgeTest {

    private SocketConfig config;
    private MetricsService metrics;

    @BeforeEach
    void setUp() {
        config = TestConfigs.config();
        metrics = new MetricsService(new SimpleMeterRegistry(), config);
    }

    @Test
    void testPublishRetriesThenSucceeds() {
        FlakyTransport transport = new FlakyTransport(2);
        BrokerBridge bridge = new BrokerBridge(transport, config, metrics);

        StepVerifier.create(bridge.publish(event("e-1")))
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertEquals(3, transport.attempts.get());
        assertEquals("group:g1", transport.lastKey);
    }

    @Test
    void testPublishGivesUpWithPublishFailure() {
        FlakyTransport transport = new FlakyTransport(Integer.MAX_VALUE);
        BrokerBridge bridge = new BrokerBridge(transport, config, metrics);

        StepVerifier.create(bridge.publish(event("e-1")))
            .expectErrorSatisfies(err -> {
                assertTrue(err instanceof ChatException);
                assertEquals(ErrorCode.PUBLISH_FAILURE, ((ChatException) err).getCode());
            })
            .verify(Duration.ofSeconds(5));

        assertEquals(1 + config.getPublishMaxRetries(), transport.attempts.get());
    }

    @Test
    void testSubscriberReceivesOwnPublications() {
        BrokerBridge bridge = new BrokerBridge(new InMemoryBrokerTransport(), config, metrics);
        List<DeliveryEvent> received = new CopyOnWriteArrayList<>();
        Disposable subscription = bridge.subscribe(received::add);

        bridge.publish(event("e-1")).block();

        assertEquals(1, received.size());
        assertEquals("e-1", received.get(0).getEventId());
        assertEquals(Set.of("alice", "bob"), received.get(0).getRecipients());
        subscription.dispose();
    }

    @Test
    void testUndecodablePayloadIsSkipped() {
        InMemoryBrokerTransport transport = new InMemoryBrokerTransport();
        BrokerBridge bridge = new BrokerBridge(transport, config, metrics);
        List<DeliveryEvent> received = new CopyOnWriteArrayList<>();
        Disposable subscription = bridge.subscribe(received::add);

        transport.publish(Topics.DELIVERY, "group:g1", "{not json").block();
        bridge.publish(event("e-2")).block();

        assertEquals(1, received.size());
        assertEquals("e-2", received.get(0).getEventId());
        subscription.dispose();
    }

    @Test
    void testHandlerErrorDoesNotEndSubscription() {
        BrokerBridge bridge = new BrokerBridge(new InMemoryBrokerTransport(), config, metrics);
        List<String> received = new CopyOnWriteArrayList<>();
        Disposable subscription = bridge.subscribe(event -> {
            received.add(event.getEventId());
            if (event.getEventId().equals("e-1")) {
                throw new IllegalStateException("boom");
            }
        });

        bridge.publish(event("e-1")).block();
        bridge.publish(event("e-2")).block();

        assertEquals(List.of("e-1", "e-2"), received);
        subscription.dispose();
    }

    private static DeliveryEvent event(String eventId) {
        return DeliveryEvent.builder()
            .eventId(eventId)
            .kind(EventKind.MESSAGE_CREATED)
            .messageId("1")
            .conversationId("group:g1")
            .senderId("alice")
            .sequence(1)
            .payload("hello")
            .recipients(Set.of("alice", "bob"))
            .ts(System.currentTimeMillis())
            .originNodeId("node-1")
            .build();
    }

    /**
     * Fails the first {@code failures} publishes, then accepts.
     */
    private static final class FlakyTransport implements IBrokerTransport {
        final AtomicInteger attempts = new AtomicInteger();
        private final int failures;
        volatile String lastKey;

        FlakyTransport(int failures) {
            this.failures = failures;
        }

        @Override
        public Mono<Void> start() {
            return Mono.empty();
        }

        @Override
        public Mono<Void> publish(String channel, String key, String payload) {
            return Mono.defer(() -> {
                lastKey = key;
                return attempts.incrementAndGet() <= failures
                    ? Mono.<Void>error(new IllegalStateException("broker unavailable"))
                    : Mono.<Void>empty();
            });
        }

        @Override
        public Flux<String> subscribe(String channel) {
            return Flux.never();
        }

        @Override
        public Mono<Void> stop() {
            return Mono.empty();
        }
    }
}
