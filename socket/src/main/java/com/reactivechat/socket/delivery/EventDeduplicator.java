package com.reactivechat.socket.delivery;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.reactivechat.socket.config.SocketConfig;

/**
 * Bounded, time-windowed set of recently seen event ids.
 * <p>
 * Suppresses the second local push of an event this node already pushed before publishing it,
 * when the broker echoes it back, and broker redeliveries within the window.
 * </p>
 */
public class EventDeduplicator {

    private final Cache<String, Boolean> seen;

    public EventDeduplicator(SocketConfig config) {
        this.seen = Caffeine.newBuilder()
            .maximumSize(config.getDedupMaxEntries())
            .expireAfterWrite(config.getDedupWindow())
            .build();
    }

    /**
     * Atomically records the id.
     *
     * @return true the first time an id is seen within the window
     */
    public boolean markSeen(String eventId) {
        return seen.asMap().putIfAbsent(eventId, Boolean.TRUE) == null;
    }

    public long size() {
        return seen.estimatedSize();
    }
}
