package com.reactivechat.socket.session;

import com.reactivechat.core.model.DeliveryEvent;
import com.reactivechat.core.model.EventKind;
import com.reactivechat.core.model.Principal;
import com.reactivechat.core.msg.ServerFrame;
import com.reactivechat.socket.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionTest {

    private Connection connection;

    @BeforeEach
    void setUp() {
        // queue capacity 8
        connection = new ConnectionFactory(TestConfigs.config()).createConnection();
    }

    @Test
    void testStateMachine() {
        assertEquals(ConnectionState.CONNECTING, connection.getState());
        assertFalse(connection.activate(), "cannot activate before authentication");

        assertTrue(connection.authenticate(new Principal("alice", "Alice", Set.of())));
        assertEquals("alice", connection.getPrincipalId());
        assertTrue(connection.activate());
        assertEquals(ConnectionState.ACTIVE, connection.getState());

        assertTrue(connection.beginClosing());
        assertFalse(connection.beginClosing(), "second close attempt must lose");
        connection.markClosed();
        assertEquals(ConnectionState.CLOSED, connection.getState());
    }

    @Test
    void testConnectionIdsAreUnique() {
        ConnectionFactory factory = new ConnectionFactory(TestConfigs.config("node-7"));

        Connection first = factory.createConnection();
        Connection second = factory.createConnection();

        assertTrue(first.getId().startsWith("node-7-"));
        assertNotEquals(first.getId(), second.getId());
    }

    @Test
    void testOlderSequenceIsFlaggedLate() {
        connection.offerEvent(created("direct:a:b", 2));
        connection.offerEvent(created("direct:a:b", 1));
        connection.offerEvent(created("group:g1", 1));
        connection.completeOutbound(null);

        List<ServerFrame> frames = connection.outboundFlux().collectList().block(Duration.ofSeconds(1));

        assertEquals(3, frames.size());
        assertNull(frames.get(0).getLate());
        assertEquals(Boolean.TRUE, frames.get(1).getLate());
        assertNull(frames.get(2).getLate(), "sequences are tracked per conversation");
    }

    @Test
    void testUpdatesAreNeverLate() {
        connection.offerEvent(created("group:g1", 5));
        connection.offerEvent(created("group:g1", 2).withKind(EventKind.MESSAGE_UPDATED));
        connection.completeOutbound(null);

        List<ServerFrame> frames = connection.outboundFlux().collectList().block(Duration.ofSeconds(1));

        assertNull(frames.get(1).getLate());
    }

    @Test
    void testFullQueue_RejectsAndRequestsOverflowClose() {
        for (int i = 1; i <= 8; i++) {
            assertTrue(connection.offerEvent(created("group:g1", i)), "frame " + i + " fits");
        }

        assertFalse(connection.offerEvent(created("group:g1", 9)));

        StepVerifier.create(connection.closeRequested())
            .assertNext(reason -> {
                assertEquals(CloseReason.QUEUE_OVERFLOW, reason.getCode());
                assertFalse(reason.isGraceful());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(1));
    }

    @Test
    void testCapacityIsExactForNonPowerOfTwo() {
        for (int capacity : new int[]{3, 5, 300}) {
            Connection bounded = new ConnectionFactory(
                TestConfigs.config().toBuilder().queueCapacity(capacity).build()
            ).createConnection();

            int accepted = 0;
            for (int i = 1; i <= capacity + 20; i++) {
                if (bounded.offer(ServerFrame.heartbeatAck())) {
                    accepted++;
                }
            }

            assertEquals(capacity, accepted, "capacity " + capacity);
            assertEquals(capacity, bounded.getPendingFrames());
        }
    }

    @Test
    void testConsumedFramesFreeCapacity() {
        Connection bounded = new ConnectionFactory(
            TestConfigs.config().toBuilder().queueCapacity(3).build()
        ).createConnection();
        for (int i = 0; i < 3; i++) {
            assertTrue(bounded.offer(ServerFrame.heartbeatAck()));
        }

        StepVerifier.create(bounded.outboundFlux(), 2)
            .expectNextCount(2)
            .then(() -> {
                assertEquals(1, bounded.getPendingFrames());
                assertTrue(bounded.offer(ServerFrame.heartbeatAck()));
                assertTrue(bounded.offer(ServerFrame.heartbeatAck()));
                assertFalse(bounded.offer(ServerFrame.heartbeatAck()), "back at capacity");
            })
            .thenCancel()
            .verify(Duration.ofSeconds(1));
    }

    @Test
    void testClosingFrameFitsInFullQueue() {
        for (int i = 1; i <= 8; i++) {
            connection.offerEvent(created("group:g1", i));
        }
        connection.completeOutbound(ServerFrame.closing("DRAIN", null, 1000L));

        List<ServerFrame> frames = connection.outboundFlux().collectList().block(Duration.ofSeconds(1));

        assertEquals(9, frames.size());
        assertEquals(ServerFrame.CLOSING, frames.get(8).getType());
    }

    @Test
    void testFirstCloseRequestWins() {
        connection.requestClose(CloseReason.drain(1500));
        connection.requestClose(CloseReason.queueOverflow());

        StepVerifier.create(connection.closeRequested())
            .assertNext(reason -> {
                assertEquals(CloseReason.GOING_AWAY, reason.getCode());
                assertEquals(1500L, reason.getRetryAfterMs());
            })
            .verifyComplete();
    }

    @Test
    void testClosingConnectionRejectsOffers() {
        connection.beginClosing();

        assertFalse(connection.offer(ServerFrame.heartbeatAck()));
    }

    @Test
    void testCompleteOutboundAppendsLastFrame() {
        connection.offer(ServerFrame.heartbeatAck());
        connection.completeOutbound(ServerFrame.closing("DRAIN", null, 2000L));

        StepVerifier.create(connection.outboundFlux().map(ServerFrame::getType))
            .expectNext(ServerFrame.HEARTBEAT_ACK, ServerFrame.CLOSING)
            .verifyComplete();
    }

    private static DeliveryEvent created(String conversationId, long sequence) {
        return DeliveryEvent.builder()
            .eventId(conversationId + "#" + sequence)
            .kind(EventKind.MESSAGE_CREATED)
            .messageId(String.valueOf(sequence))
            .conversationId(conversationId)
            .senderId("a")
            .sequence(sequence)
            .payload("m" + sequence)
            .recipients(Set.of("a", "b"))
            .ts(System.currentTimeMillis())
            .originNodeId("node-1")
            .build();
    }
}
