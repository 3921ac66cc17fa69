package com.example.focusroom.model;

/**
 * Result of a successful timer start.
 *
 * @param endTimestamp    epoch millis at which the countdown ends
 * @param phase           phase that was started
 * @param durationMinutes configured duration of the phase
 * @param generation      timer generation the deferred completion must match
 */
public record TimerStart(long endTimestamp, TimerPhase phase, int durationMinutes, long generation) { }
