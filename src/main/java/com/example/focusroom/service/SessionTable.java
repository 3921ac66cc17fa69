package com.example.focusroom.service;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Live connection → (room, name) it joined as. Inbound events are resolved through this table only. */
@Component
public class SessionTable {

    /** Small immutable session record. */
    public record Session(String roomCode, String displayName) {
        public Session {
            Objects.requireNonNull(roomCode, "roomCode");
            Objects.requireNonNull(displayName, "displayName");
        }
    }

    private final ConcurrentMap<String, Session> byConnection = new ConcurrentHashMap<>();

    public void put(String connectionId, String roomCode, String displayName) {
        byConnection.put(connectionId, new Session(roomCode, displayName));
    }

    public Optional<Session> get(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(byConnection.get(connectionId));
    }

    /** Removes the entry only if it still maps to {@code expected}. */
    public boolean remove(String connectionId, Session expected) {
        return connectionId != null && byConnection.remove(connectionId, expected);
    }

    public Optional<Session> remove(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(byConnection.remove(connectionId));
    }

    public int size() {
        return byConnection.size();
    }
}
