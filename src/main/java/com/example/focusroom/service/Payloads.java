package com.example.focusroom.service;

import com.example.focusroom.model.DepartureMetrics;
import com.example.focusroom.model.Participant;
import com.example.focusroom.model.Room;
import com.example.focusroom.model.TimerStart;

import java.util.*;

/** Outbound payload builders. Callers hold the room's monitor while building room state. */
final class Payloads {

    private Payloads() { }

    static Map<String, Object> roomState(Room room) {
        long now = room.now();

        List<Map<String, Object>> participants = new ArrayList<>();
        for (Participant p : room.getParticipants()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("username", p.getDisplayName());
            m.put("avatarUrl", p.getAvatarRef());
            m.put("isDistracted", p.isDistracted());
            m.put("isHost", room.isHost(p.getConnectionId()));
            m.put("isConfused", p.isConfused());
            m.put("confusionEventCount", p.getConfusionEventCount());
            m.put("score", p.getScore());
            m.put("focusedMs", p.focusedMsAt(now));
            m.put("distractedMs", p.distractedMsAt(now));
            participants.add(m);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("participants", participants);
        payload.put("timerRunning", room.isTimerRunning());
        payload.put("endTime", room.getTimerEndTimestamp());
        payload.put("phase", room.getTimerPhase().wireName());
        payload.put("groupScore", room.getGroupScore());
        payload.put("groupDps", room.groupDps());
        payload.put("distractedCount", room.currentDistractedCount());
        payload.put("serverTime", now);
        return payload;
    }

    static Map<String, Object> userJoined(Participant p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("username", p.getDisplayName());
        m.put("avatarUrl", p.getAvatarRef());
        return m;
    }

    static Map<String, Object> userLeft(String displayName) {
        return Map.of("username", displayName);
    }

    static Map<String, Object> statusChanged(String displayName, boolean distracted) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("username", displayName);
        m.put("isDistracted", distracted);
        return m;
    }

    static Map<String, Object> confused(String displayName, int count) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("username", displayName);
        m.put("confusionEventCount", count);
        return m;
    }

    static Map<String, Object> timerStarted(TimerStart start) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("endTime", start.endTimestamp());
        m.put("phase", start.phase().wireName());
        m.put("durationMins", start.durationMinutes());
        return m;
    }

    static Map<String, Object> groupScore(double groupScore) {
        return Map.of("groupScore", groupScore);
    }

    static Map<String, Object> groupDps(double groupDps) {
        return Map.of("groupDps", groupDps);
    }

    static Map<String, Object> metrics(DepartureMetrics m) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("username", m.displayName());
        out.put("focusedMs", m.focusedMs());
        out.put("distractedMs", m.distractedMs());
        out.put("focusPercentage", m.focusPercentage());
        out.put("score", m.score());
        out.put("confusionEventCount", m.confusionEventCount());
        out.put("sessionDurationMs", m.sessionDurationMs());
        return out;
    }

    static Map<String, Object> blendShapes(String displayName, Map<String, Object> frame) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("username", displayName);
        m.put("blendShapes", frame);
        return m;
    }
}
