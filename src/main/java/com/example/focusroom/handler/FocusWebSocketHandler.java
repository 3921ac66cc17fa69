package com.example.focusroom.handler;

import com.example.focusroom.service.Events;
import com.example.focusroom.service.FocusSessionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;

/**
 * WebSocket handler for the focus room endpoint.
 * - Frames are {@code {"event": "<name>", "data": {...}}}; see {@link Events}
 * - Heartbeat: replies "pong" to a bare "ping"
 * - Undecodable frames and unknown events are logged and dropped; the connection stays open
 * - On close: the connection leaves its room (no grace period)
 */
@Component
public class FocusWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(FocusWebSocketHandler.class);

    private static final TypeReference<Map<String, Object>> FRAME_TYPE = new TypeReference<>() { };

    private final FocusSessionService sessionService;
    private final WebSocketEventTransport transport;
    private final ObjectMapper objectMapper;

    public FocusWebSocketHandler(FocusSessionService sessionService,
                                 WebSocketEventTransport transport,
                                 ObjectMapper objectMapper) {
        this.sessionService = sessionService;
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        transport.register(session);
        sessionService.connect(session.getId());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        final String cid = session.getId();
        final String payload = message.getPayload();

        if ("ping".equals(payload)) {
            transport.sendRaw(cid, "pong");
            return;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("WS undecodable frame cid={}: {}", cid, e.getOriginalMessage());
            return;
        }
        if (root == null || !root.isObject()) {
            log.debug("WS ignored non-object frame cid={}", cid);
            return;
        }

        String event = text(root, "event");
        JsonNode data = root.path("data");

        try {
            dispatch(cid, event, data);
        } catch (RuntimeException e) {
            log.error("WS handleTextMessage failed (cid={}, event={})", cid, event, e);
        }
    }

    private void dispatch(String cid, String event, JsonNode data) {
        if (event == null) {
            log.debug("WS frame without event cid={}", cid);
            return;
        }
        switch (event) {
            case Events.ROOM_JOIN -> sessionService.join(cid,
                    text(data, "roomCode"), text(data, "username"), text(data, "avatarUrl"));
            case Events.ROOM_LEAVE -> sessionService.leave(cid, text(data, "roomCode"));
            case Events.TIMER_START -> sessionService.startTimer(cid, text(data, "phase"));
            case Events.TIMER_STOP -> sessionService.stopTimer(cid);
            case Events.USER_DISTRACTED -> sessionService.markDistracted(cid);
            case Events.USER_FOCUSED -> sessionService.markFocused(cid);
            case Events.BLEND_SHAPES -> {
                if (!data.isObject()) {
                    log.debug("WS blend shapes ignored: not an object (cid={})", cid);
                    return;
                }
                sessionService.expressionFrame(cid, objectMapper.convertValue(data, FRAME_TYPE));
            }
            default -> log.debug("WS ignored event '{}' (cid={})", event, cid);
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("WS ERROR cid={} : {}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        String cid = session.getId();
        log.info("WS CLOSE cid={} code={} reason={}", cid, status.getCode(), status.getReason());
        try {
            sessionService.disconnect(cid);
        } catch (RuntimeException e) {
            log.error("WS afterConnectionClosed handling failed (cid={})", cid, e);
        } finally {
            transport.unregister(cid);
        }
    }

    /** Text field or null when missing, null or blank. */
    private static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }
}
