package com.example.focusroom.handler;

import com.example.focusroom.service.DeliveryReport;
import com.example.focusroom.service.EventTransport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * EventTransport over raw WebSocket sessions.
 * Frames are JSON objects {@code {"event": ..., "data": ...}}. Each session is wrapped in a
 * ConcurrentWebSocketSessionDecorator, so a slow client hits its own send limits instead of
 * blocking the others.
 */
@Component
public class WebSocketEventTransport implements EventTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEventTransport.class);

    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int sendBufferLimitBytes;

    /** connection id → decorated session */
    private final ConcurrentMap<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    /** room code → member connection ids */
    private final ConcurrentMap<String, Set<String>> rooms = new ConcurrentHashMap<>();

    public WebSocketEventTransport(
            ObjectMapper objectMapper,
            @Value("${app.websocket.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${app.websocket.send-buffer-limit-bytes:524288}") int sendBufferLimitBytes
    ) {
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferLimitBytes = sendBufferLimitBytes;
    }

    // ---------------------------------------------------------------------
    // Connection lifecycle (driven by FocusWebSocketHandler)
    // ---------------------------------------------------------------------

    public void register(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferLimitBytes));
    }

    public void unregister(String connectionId) {
        sessions.remove(connectionId);
        for (String roomCode : List.copyOf(rooms.keySet())) {
            leaveRoom(connectionId, roomCode);
        }
    }

    public int connectionCount() {
        return sessions.size();
    }

    int roomCount() {
        return rooms.size();
    }

    // ---------------------------------------------------------------------
    // EventTransport
    // ---------------------------------------------------------------------

    @Override
    public void joinRoom(String connectionId, String roomCode) {
        rooms.compute(roomCode, (k, members) -> {
            Set<String> set = members == null ? ConcurrentHashMap.newKeySet() : members;
            set.add(connectionId);
            return set;
        });
    }

    @Override
    public void leaveRoom(String connectionId, String roomCode) {
        rooms.computeIfPresent(roomCode, (k, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
    }

    @Override
    public DeliveryReport emitToOne(String connectionId, String event, Object payload) {
        String json = encode(event, payload);
        if (json == null) return new DeliveryReport(event, 0, List.of(connectionId));
        return send(connectionId, null, event, json)
                ? new DeliveryReport(event, 1, List.of())
                : new DeliveryReport(event, 0, List.of(connectionId));
    }

    @Override
    public DeliveryReport emitToRoom(String roomCode, String event, Object payload, String excludedConnectionId) {
        Set<String> members = rooms.get(roomCode);
        if (members == null || members.isEmpty()) return DeliveryReport.none(event);

        String json = encode(event, payload);
        List<String> targets = new ArrayList<>(members);
        targets.remove(excludedConnectionId);
        if (json == null) return new DeliveryReport(event, 0, targets);

        int delivered = 0;
        List<String> failed = new ArrayList<>();
        for (String cid : targets) {
            if (send(cid, roomCode, event, json)) delivered++;
            else failed.add(cid);
        }
        return new DeliveryReport(event, delivered, failed);
    }

    /** Sends a raw text frame (heartbeat replies). */
    public boolean sendRaw(String connectionId, String text) {
        return send(connectionId, null, "raw", text);
    }

    // ---------------------------------------------------------------------
    // helpers
    // ---------------------------------------------------------------------

    private String encode(String event, Object payload) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", event);
        frame.put("data", payload == null ? Map.of() : payload);
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.warn("WS encode failed (event={}): {}", event, e.toString());
            return null;
        }
    }

    private boolean send(String connectionId, String roomCode, String event, String json) {
        WebSocketSession session = sessions.get(connectionId);
        if (session == null || !session.isOpen()) {
            if (roomCode != null) leaveRoom(connectionId, roomCode);
            return false;
        }
        try {
            session.sendMessage(new TextMessage(json));
            return true;
        } catch (Exception e) {
            // IOException, or SessionLimitExceededException once the decorator gives up on a slow client
            log.warn("WS send failed (event={}, cid={}): {}", event, connectionId, e.toString());
            if (roomCode != null) leaveRoom(connectionId, roomCode);
            return false;
        }
    }
}
