package com.example.focusroom.model;

/** Finalized metrics of a participant leaving a room. */
public record DepartureMetrics(
        String displayName,
        long focusedMs,
        long distractedMs,
        double focusPercentage,
        long score,
        int confusionEventCount,
        long sessionDurationMs
) {

    static double focusPercentage(long focusedMs, long distractedMs) {
        long total = focusedMs + distractedMs;
        if (total <= 0) return 0.0;
        return focusedMs * 100.0 / total;
    }
}
