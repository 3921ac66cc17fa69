package com.example.focusroom.model;

import java.time.Clock;
import java.util.*;

/**
 * Focus room: participants, host, shared countdown and group score.
 * FocusSessionService, TimerScheduler and MetricsBroadcaster synchronize on Room instances,
 * so this class itself does not add extra locking.
 */
public class Room {

    /** Distraction penalty never removes more than this share of the base rate. */
    static final double MAX_PENALTY = 0.95;

    // ---------------------------------------------------------------------
    // Core identity
    // ---------------------------------------------------------------------

    private final String code;
    private final Clock clock;

    /** Participants by connection id, in join order (first entry is the next host candidate). */
    private final Map<String, Participant> participants = new LinkedHashMap<>();

    private String hostId;

    /** Set once the last participant left; a closed room is never reused. */
    private boolean closed = false;

    // ---------------------------------------------------------------------
    // Timer state (end timestamp and phase always change together)
    // ---------------------------------------------------------------------

    private Long timerEndTimestamp;
    private TimerPhase timerPhase = TimerPhase.FOCUS;
    private long timerGeneration = 0L;

    // ---------------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------------

    private final double baseRatePerSecond;
    private final double penaltyPerDistractedParticipant;
    private double groupScore = 0.0;

    public Room(String code, double baseRatePerSecond, double penaltyPerDistractedParticipant, Clock clock) {
        if (code == null || code.isBlank()) throw new IllegalArgumentException("room code must not be blank");
        this.code = code.trim();
        this.baseRatePerSecond = baseRatePerSecond;
        this.penaltyPerDistractedParticipant = penaltyPerDistractedParticipant;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getCode() { return code; }

    public long now() { return clock.millis(); }

    public boolean isClosed() { return closed; }

    public boolean isEmpty() { return participants.isEmpty(); }

    public int size() { return participants.size(); }

    public double getGroupScore() { return groupScore; }

    public double getBaseRatePerSecond() { return baseRatePerSecond; }

    public double getPenaltyPerDistractedParticipant() { return penaltyPerDistractedParticipant; }

    // ---------------------------------------------------------------------
    // Participants
    // ---------------------------------------------------------------------

    /** Snapshot list of participants in join order. */
    public List<Participant> getParticipants() {
        return new ArrayList<>(participants.values());
    }

    public Optional<Participant> getParticipant(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(participants.get(connectionId));
    }

    public String getHostId() { return hostId; }

    public boolean isHost(String connectionId) {
        return connectionId != null && connectionId.equals(hostId);
    }

    /**
     * Adds a focused participant. Blank names are rejected (empty result).
     * The first participant of an empty room becomes host.
     */
    public Optional<Participant> addParticipant(String connectionId, String displayName, String avatarRef) {
        if (closed || connectionId == null || displayName == null || displayName.isBlank()) {
            return Optional.empty();
        }
        Participant existing = participants.get(connectionId);
        if (existing != null) return Optional.of(existing);

        Participant p = new Participant(connectionId, displayName.trim(), avatarRef, now());
        participants.put(connectionId, p);
        if (hostId == null) hostId = connectionId;
        return Optional.of(p);
    }

    /**
     * Removes a participant and returns its finalized metrics.
     * Hands the host role to the earliest remaining participant; the last departure closes the room.
     */
    public Optional<DepartureMetrics> removeParticipant(String connectionId) {
        if (connectionId == null) return Optional.empty();
        Participant p = participants.remove(connectionId);
        if (p == null) return Optional.empty();

        long now = now();
        p.closeOpenInterval(now);
        long focused = p.getAccumulatedFocusedMs();
        long distracted = p.getAccumulatedDistractedMs();
        DepartureMetrics metrics = new DepartureMetrics(
                p.getDisplayName(),
                focused,
                distracted,
                DepartureMetrics.focusPercentage(focused, distracted),
                Math.round(p.getScore()),
                p.getConfusionEventCount(),
                Math.max(0L, now - p.getJoinedAt())
        );

        if (connectionId.equals(hostId)) {
            Iterator<String> it = participants.keySet().iterator();
            hostId = it.hasNext() ? it.next() : null;
        }
        if (participants.isEmpty()) {
            closed = true;
            clearTimer();
        }
        return Optional.of(metrics);
    }

    // ---------------------------------------------------------------------
    // Focus / distraction / confusion
    // ---------------------------------------------------------------------

    /** Returns true if the participant actually switched to distracted. */
    public boolean markDistracted(String connectionId) {
        return transition(connectionId, FocusState.DISTRACTED);
    }

    /** Returns true if the participant actually switched to focused. */
    public boolean markFocused(String connectionId) {
        return transition(connectionId, FocusState.FOCUSED);
    }

    private boolean transition(String connectionId, FocusState target) {
        Participant p = connectionId == null ? null : participants.get(connectionId);
        if (p == null) return false;
        return p.transitionTo(target, now());
    }

    /** Flags the participant as confused; returns the new confusion count, or empty if unknown. */
    public OptionalInt markConfused(String connectionId) {
        Participant p = connectionId == null ? null : participants.get(connectionId);
        if (p == null) return OptionalInt.empty();
        p.recordConfusion();
        return OptionalInt.of(p.getConfusionEventCount());
    }

    // ---------------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------------

    public int currentDistractedCount() {
        int n = 0;
        for (Participant p : participants.values()) {
            if (p.isDistracted()) n++;
        }
        return n;
    }

    public int currentFocusedCount() {
        return participants.size() - currentDistractedCount();
    }

    /** Shared accrual rate, floored at 5% of the base rate. */
    public double groupDps() {
        double penalty = Math.min(penaltyPerDistractedParticipant * currentDistractedCount(), MAX_PENALTY);
        return baseRatePerSecond * Math.max(0.0, 1.0 - penalty);
    }

    /**
     * Accrues {@code seconds} worth of points and splits them evenly across focused participants.
     * With nobody focused the points are dropped.
     */
    public double tickAndDistribute(double seconds) {
        if (!Double.isFinite(seconds) || seconds < 0) seconds = 0;
        double points = groupDps() * seconds;

        List<Participant> focused = new ArrayList<>();
        for (Participant p : participants.values()) {
            if (!p.isDistracted()) focused.add(p);
        }
        if (focused.isEmpty() || points <= 0) return 0.0;

        double share = points / focused.size();
        for (Participant p : focused) p.addScore(share);
        groupScore += points;
        return points;
    }

    // ---------------------------------------------------------------------
    // Timer
    // ---------------------------------------------------------------------

    public Long getTimerEndTimestamp() { return timerEndTimestamp; }

    public TimerPhase getTimerPhase() { return timerPhase; }

    public long getTimerGeneration() { return timerGeneration; }

    /** A countdown is set and has not passed yet. */
    public boolean isTimerRunning() {
        return timerEndTimestamp != null && timerEndTimestamp > now();
    }

    /** Host-only. Starts (or restarts) the countdown and invalidates earlier completions. */
    public Optional<TimerStart> startTimer(String requesterId, TimerPhase phase, int durationMinutes) {
        if (!isHost(requesterId) || phase == null || durationMinutes <= 0) return Optional.empty();
        long end = now() + durationMinutes * 60_000L;
        timerEndTimestamp = end;
        timerPhase = phase;
        timerGeneration++;
        return Optional.of(new TimerStart(end, phase, durationMinutes, timerGeneration));
    }

    /** Host-only. Stops any countdown and invalidates pending completions. */
    public boolean stopTimer(String requesterId) {
        if (!isHost(requesterId)) return false;
        clearTimer();
        return true;
    }

    /**
     * Completes the countdown scheduled under {@code generation}.
     * Returns false when a later start or stop superseded it.
     */
    public boolean completeTimer(long generation) {
        if (timerEndTimestamp == null || generation != timerGeneration) return false;
        timerEndTimestamp = null;
        return true;
    }

    private void clearTimer() {
        timerEndTimestamp = null;
        timerGeneration++;
    }
}
