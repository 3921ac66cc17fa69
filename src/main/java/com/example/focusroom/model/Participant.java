package com.example.focusroom.model;

import java.util.Objects;

/**
 * Per-connection participant state used by Room.
 * Not thread-safe on its own: Room callers synchronize on the owning Room.
 */
public class Participant {

    private final String connectionId;
    private final String displayName;
    private final String avatarRef;          // optional
    private final long joinedAt;

    private FocusState focusState = FocusState.FOCUSED;
    private Long focusedSince;
    private Long distractedSince;

    private long accumulatedFocusedMs;
    private long accumulatedDistractedMs;

    private double score;

    private boolean confused;
    private int confusionEventCount;

    public Participant(String connectionId, String displayName, String avatarRef, long now) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.avatarRef = (avatarRef == null || avatarRef.isBlank()) ? null : avatarRef;
        this.joinedAt = now;
        this.focusedSince = now;
    }

    // identity
    public String getConnectionId() { return connectionId; }
    public String getDisplayName() { return displayName; }
    public String getAvatarRef() { return avatarRef; }
    public long getJoinedAt() { return joinedAt; }

    // focus
    public FocusState getFocusState() { return focusState; }
    public boolean isDistracted() { return focusState == FocusState.DISTRACTED; }
    public Long getFocusedSince() { return focusedSince; }
    public Long getDistractedSince() { return distractedSince; }

    /** Closed intervals only. */
    public long getAccumulatedFocusedMs() { return accumulatedFocusedMs; }
    public long getAccumulatedDistractedMs() { return accumulatedDistractedMs; }

    /** Focused time including the open interval up to {@code now}. */
    public long focusedMsAt(long now) {
        return accumulatedFocusedMs + (focusedSince != null ? elapsed(focusedSince, now) : 0L);
    }

    /** Distracted time including the open interval up to {@code now}. */
    public long distractedMsAt(long now) {
        return accumulatedDistractedMs + (distractedSince != null ? elapsed(distractedSince, now) : 0L);
    }

    /**
     * Switches to {@code target}, closing the open interval.
     * Returns false if already in that state.
     */
    boolean transitionTo(FocusState target, long now) {
        if (target == focusState) return false;
        if (focusState == FocusState.FOCUSED) {
            accumulatedFocusedMs += elapsed(focusedSince, now);
            focusedSince = null;
            distractedSince = now;
        } else {
            accumulatedDistractedMs += elapsed(distractedSince, now);
            distractedSince = null;
            focusedSince = now;
        }
        focusState = target;
        return true;
    }

    /** Closes the open interval and reopens it at {@code now}; used on departure. */
    void closeOpenInterval(long now) {
        if (focusState == FocusState.FOCUSED) {
            accumulatedFocusedMs += elapsed(focusedSince, now);
            focusedSince = now;
        } else {
            accumulatedDistractedMs += elapsed(distractedSince, now);
            distractedSince = now;
        }
    }

    // score
    public double getScore() { return score; }

    void addScore(double points) {
        if (points > 0) score += points;
    }

    // confusion
    public boolean isConfused() { return confused; }
    public int getConfusionEventCount() { return confusionEventCount; }

    void recordConfusion() {
        confused = true;
        confusionEventCount++;
    }

    private static long elapsed(Long since, long now) {
        return since == null ? 0L : Math.max(0L, now - since);
    }

    @Override
    public String toString() {
        return "Participant{" +
                "connectionId='" + connectionId + '\'' +
                ", displayName='" + displayName + '\'' +
                ", avatarRef='" + avatarRef + '\'' +
                ", joinedAt=" + joinedAt +
                ", focusState=" + focusState +
                ", accumulatedFocusedMs=" + accumulatedFocusedMs +
                ", accumulatedDistractedMs=" + accumulatedDistractedMs +
                ", score=" + score +
                ", confused=" + confused +
                ", confusionEventCount=" + confusionEventCount +
                '}';
    }
}
