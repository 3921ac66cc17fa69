package com.example.focusroom.service;

/**
 * Bidirectional event channel to connected clients with room-based multicast.
 * Emits never throw for a single unreachable connection; failures come back in the report.
 */
public interface EventTransport {

    DeliveryReport emitToOne(String connectionId, String event, Object payload);

    /** Sends to every connection in the room except {@code excludedConnectionId} (may be null). */
    DeliveryReport emitToRoom(String roomCode, String event, Object payload, String excludedConnectionId);

    default DeliveryReport emitToRoom(String roomCode, String event, Object payload) {
        return emitToRoom(roomCode, event, payload, null);
    }

    void joinRoom(String connectionId, String roomCode);

    void leaveRoom(String connectionId, String roomCode);
}
