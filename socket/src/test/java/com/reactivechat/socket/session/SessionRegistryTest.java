package com.reactivechat.socket.session;

import com.reactivechat.socket.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SessionRegistry} including concurrent register/unregister.
 */
class SessionRegistryTest {

    private SessionRegistry registry;
    private ConnectionFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry();
        factory = new ConnectionFactory(TestConfigs.config());
    }

    @Test
    void testMultipleConnectionsPerPrincipal() {
        Connection phone = factory.createConnection();
        Connection laptop = factory.createConnection();

        registry.register("alice", phone);
        registry.register("alice", laptop);

        assertEquals(Set.of(phone, laptop), registry.connectionsFor("alice"));
        assertEquals(2, registry.connectionCount());
        assertEquals(1, registry.principalCount());
    }

    @Test
    void testUnregisterIsIdempotent() {
        Connection phone = factory.createConnection();
        registry.register("alice", phone);

        registry.unregister("alice", phone);
        registry.unregister("alice", phone);
        registry.unregister("nobody", phone);

        assertTrue(registry.connectionsFor("alice").isEmpty());
        assertEquals(0, registry.principalCount());
    }

    @Test
    void testLookupReturnsSnapshot() {
        Connection phone = factory.createConnection();
        registry.register("alice", phone);

        Set<Connection> snapshot = registry.connectionsFor("alice");
        registry.register("alice", factory.createConnection());

        assertEquals(1, snapshot.size());
        assertEquals(2, registry.connectionsFor("alice").size());
    }

    @Test
    void testConcurrentRegisterAndUnregister() throws InterruptedException {
        int threads = 8;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        List<Connection> survivors = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            Connection survivor = factory.createConnection();
            survivors.add(survivor);
            executor.submit(() -> {
                try {
                    start.await();
                    registry.register("shared", survivor);
                    for (int i = 0; i < perThread; i++) {
                        Connection temporary = factory.createConnection();
                        registry.register("shared", temporary);
                        registry.unregister("shared", temporary);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(Set.copyOf(survivors), registry.connectionsFor("shared"));
        assertEquals(threads, registry.connectionCount());
    }
}
