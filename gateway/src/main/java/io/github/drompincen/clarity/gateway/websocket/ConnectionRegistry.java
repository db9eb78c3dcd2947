package io.github.drompincen.clarity.gateway.websocket;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connections by connection id. Entries are added on open and evicted on close.
 */
@Component
public class ConnectionRegistry {

    public record Entry(SessionConnection connection, ConnectionState state) {}

    private final Map<String, Entry> connections = new ConcurrentHashMap<>();

    public void register(SessionConnection connection, ConnectionState state) {
        connections.put(connection.id(), new Entry(connection, state));
    }

    public Optional<Entry> get(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Optional<Entry> remove(String connectionId) {
        return Optional.ofNullable(connections.remove(connectionId));
    }

    public List<Entry> snapshot() {
        return List.copyOf(connections.values());
    }

    public int size() {
        return connections.size();
    }
}
