package com.reactivechat.socket.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local map from principal id to that principal's live connections.
 * <p>
 * Shared between connection supervisors (register/unregister) and the delivery router
 * (lookup). Per-principal sets are concurrent; adding the first and removing the last
 * connection of a principal happen inside {@code compute} so a set is never dropped while
 * another thread is adding to it.
 * </p>
 */
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, Set<Connection>> connections = new ConcurrentHashMap<>();

    public void register(String principalId, Connection connection) {
        connections.compute(principalId, (id, current) -> {
            Set<Connection> set = current != null ? current : ConcurrentHashMap.newKeySet();
            set.add(connection);
            return set;
        });
        log.debug("Registered connection {} for principal {}", connection.getId(), principalId);
    }

    /**
     * Removes the connection; no-op if it is not registered.
     */
    public void unregister(String principalId, Connection connection) {
        connections.computeIfPresent(principalId, (id, current) -> {
            current.remove(connection);
            return current.isEmpty() ? null : current;
        });
    }

    /**
     * @return a snapshot of the principal's live connections, empty if none
     */
    public Set<Connection> connectionsFor(String principalId) {
        Set<Connection> current = connections.get(principalId);
        return current == null ? Set.of() : Set.copyOf(current);
    }

    public List<Connection> allConnections() {
        return connections.values().stream()
            .flatMap(Set::stream)
            .collect(Collectors.toList());
    }

    public int connectionCount() {
        return connections.values().stream().mapToInt(Set::size).sum();
    }

    public int principalCount() {
        return connections.size();
    }
}
