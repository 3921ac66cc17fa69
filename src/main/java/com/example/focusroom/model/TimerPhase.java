package com.example.focusroom.model;

import java.util.Locale;
import java.util.Optional;

/** Countdown phase shared by everyone in a room. */
public enum TimerPhase {
    FOCUS("focus"),
    BREAK("break");

    private final String wireName;

    TimerPhase(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    /**
     * Parses a client-supplied phase. Missing or blank means focus; unknown values are empty.
     */
    public static Optional<TimerPhase> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.of(FOCUS);
        String s = raw.trim().toLowerCase(Locale.ROOT);
        for (TimerPhase p : values()) {
            if (p.wireName.equals(s)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
