package com.example.focusroom.model;

import com.example.focusroom.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoomTest {

    private final MutableClock clock = new MutableClock(1_000_000L);

    private Room room(double base, double penalty) {
        return new Room("X", base, penalty, clock);
    }

    @Test
    void addParticipant_firstJoinerBecomesHost_andStartsFocused() {
        Room r = room(1.0, 0.25);
        Participant alice = r.addParticipant("c1", "Alice", "https://avatars.test/a.glb").orElseThrow();
        r.addParticipant("c2", "Bob", null);

        assertEquals("c1", r.getHostId());
        assertEquals(FocusState.FOCUSED, alice.getFocusState());
        assertEquals(1_000_000L, alice.getFocusedSince());
        assertNull(alice.getDistractedSince());
        assertEquals(2, r.size());
    }

    @Test
    void participantToString_showsAvatarAndAccumulatedTime() {
        Room r = room(1.0, 0.25);
        Participant alice = r.addParticipant("c1", "Alice", "https://avatars.test/a.glb").orElseThrow();
        clock.advance(2_000);
        r.markDistracted("c1");
        clock.advance(500);
        r.markFocused("c1");

        String text = alice.toString();

        assertTrue(text.contains("avatarRef='https://avatars.test/a.glb'"), text);
        assertTrue(text.contains("accumulatedFocusedMs=2000"), text);
        assertTrue(text.contains("accumulatedDistractedMs=500"), text);
    }

    @Test
    void addParticipant_rejectsBlankName() {
        Room r = room(1.0, 0.25);
        assertTrue(r.addParticipant("c1", "  ", null).isEmpty());
        assertTrue(r.addParticipant("c1", null, null).isEmpty());
        assertTrue(r.isEmpty());
        assertNull(r.getHostId());
    }

    @Test
    @DisplayName("Removing the host of three hands the role to one of the remaining two")
    void removeHost_reassignsToRemainingParticipant() {
        Room r = room(1.0, 0.25);
        r.addParticipant("c1", "Alice", null);
        r.addParticipant("c2", "Bob", null);
        r.addParticipant("c3", "Cleo", null);

        assertTrue(r.removeParticipant("c1").isPresent());

        assertTrue(Set.of("c2", "c3").contains(r.getHostId()));
        assertTrue(r.getParticipant(r.getHostId()).isPresent());
        assertFalse(r.isClosed());
    }

    @Test
    void removeLastParticipant_clearsHost_andClosesRoom() {
        Room r = room(1.0, 0.25);
        r.addParticipant("c1", "Alice", null);

        r.removeParticipant("c1");

        assertNull(r.getHostId());
        assertTrue(r.isClosed());
        assertTrue(r.addParticipant("c2", "Bob", null).isEmpty(), "closed room is never reused");
    }

    @Test
    void removeUnknown_isEmpty() {
        Room r = room(1.0, 0.25);
        assertEquals(Optional.empty(), r.removeParticipant("nope"));
    }

    @Test
    void departureMetrics_closeOpenInterval_andComputeFocusPercentage() {
        Room r = room(1.0, 0.25);
        r.addParticipant("c1", "Alice", null);
        clock.advance(1_000);
        r.markDistracted("c1");
        clock.advance(1_000);

        DepartureMetrics m = r.removeParticipant("c1").orElseThrow();

        assertEquals(1_000L, m.focusedMs());
        assertEquals(1_000L, m.distractedMs());
        assertEquals(50.0, m.focusPercentage(), 1e-9);
        assertEquals(2_000L, m.sessionDurationMs());
        assertEquals("Alice", m.displayName());
    }

    @Test
    void departureMetrics_zeroDuration_hasZeroPercentage() {
        Room r = room(1.0, 0.25);
        r.addParticipant("c1", "Alice", null);
        DepartureMetrics m = r.removeParticipant("c1").orElseThrow();
        assertEquals(0.0, m.focusPercentage());
    }

    @Test
    void markDistracted_isIdempotent() {
        Room r = room(1.0, 0.25);
        Participant p = r.addParticipant("c1", "Alice", null).orElseThrow();
        clock.advance(500);

        assertTrue(r.markDistracted("c1"));
        long focusedAfterFirst = p.getAccumulatedFocusedMs();
        clock.advance(300);
        assertFalse(r.markDistracted("c1"));

        assertEquals(500L, focusedAfterFirst);
        assertEquals(500L, p.getAccumulatedFocusedMs());
        assertEquals(0L, p.getAccumulatedDistractedMs());
        assertEquals(1_000_500L, p.getDistractedSince());

        clock.advance(200);
        assertTrue(r.markFocused("c1"));
        assertFalse(r.markFocused("c1"));
        assertEquals(500L, p.getAccumulatedDistractedMs());
        assertNull(p.getDistractedSince());
        assertNotNull(p.getFocusedSince());
    }

    @Test
    void accumulatorsPlusOpenInterval_equalSessionDuration() {
        Room r = room(1.0, 0.25);
        Participant p = r.addParticipant("c1", "Alice", null).orElseThrow();
        clock.advance(700);
        r.markDistracted("c1");
        clock.advance(1_100);
        r.markFocused("c1");
        clock.advance(250);

        long now = clock.millis();
        assertEquals(now - p.getJoinedAt(), p.focusedMsAt(now) + p.distractedMsAt(now));
    }

    @Test
    void markUnknownConnection_isNoOp() {
        Room r = room(1.0, 0.25);
        assertFalse(r.markDistracted("ghost"));
        assertFalse(r.markFocused("ghost"));
        assertTrue(r.markConfused("ghost").isEmpty());
    }

    @Test
    void groupDps_penaltyIsCappedAtNinetyFivePercent() {
        Room r = room(1.0, 0.25);
        for (String c : List.of("a", "b", "c", "d")) {
            r.addParticipant(c, c.toUpperCase(), null);
            r.markDistracted(c);
        }
        assertEquals(4, r.currentDistractedCount());
        assertEquals(0.05, r.groupDps(), 1e-9);
    }

    @Test
    void groupDps_scalesWithDistractedCount() {
        Room r = room(2.0, 0.25);
        r.addParticipant("a", "A", null);
        r.addParticipant("b", "B", null);
        assertEquals(2.0, r.groupDps(), 1e-9);
        r.markDistracted("a");
        assertEquals(1.5, r.groupDps(), 1e-9);
    }

    @Test
    void tickAndDistribute_withNobodyFocused_dropsPoints() {
        Room r = room(1.0, 0.25);
        r.addParticipant("a", "A", null);
        r.markDistracted("a");

        assertEquals(0.0, r.tickAndDistribute(1.0));
        assertEquals(0.0, r.getGroupScore());
    }

    @Test
    void tickAndDistribute_splitsPointsEvenlyAcrossFocused() {
        Room r = room(0.5, 0.0);
        Participant a = r.addParticipant("a", "A", null).orElseThrow();
        Participant b = r.addParticipant("b", "B", null).orElseThrow();

        r.tickAndDistribute(2.0);

        assertEquals(0.5, a.getScore(), 1e-9);
        assertEquals(0.5, b.getScore(), 1e-9);
        assertEquals(1.0, r.getGroupScore(), 1e-9);
    }

    @Test
    void tickAndDistribute_skipsDistractedParticipants() {
        Room r = room(1.0, 0.5);
        Participant a = r.addParticipant("a", "A", null).orElseThrow();
        Participant b = r.addParticipant("b", "B", null).orElseThrow();
        r.markDistracted("b");

        r.tickAndDistribute(4.0);

        assertEquals(2.0, a.getScore(), 1e-9);
        assertEquals(0.0, b.getScore());
        assertEquals(2.0, r.getGroupScore(), 1e-9);
    }

    @Test
    void tickAndDistribute_zeroOrNegativeSeconds_changesNothing() {
        Room r = room(1.0, 0.25);
        r.addParticipant("a", "A", null);
        r.tickAndDistribute(0);
        r.tickAndDistribute(-3);
        r.tickAndDistribute(Double.NaN);
        assertEquals(0.0, r.getGroupScore());
    }

    @Test
    void startTimer_onlyHost() {
        Room r = room(1.0, 0.25);
        r.addParticipant("host", "Alice", null);
        r.addParticipant("guest", "Bob", null);

        assertTrue(r.startTimer("guest", TimerPhase.FOCUS, 25).isEmpty());
        assertNull(r.getTimerEndTimestamp());

        TimerStart start = r.startTimer("host", TimerPhase.BREAK, 5).orElseThrow();
        assertEquals(clock.millis() + 5 * 60_000L, start.endTimestamp());
        assertEquals(TimerPhase.BREAK, r.getTimerPhase());
        assertTrue(r.isTimerRunning());
    }

    @Test
    void completeTimer_afterStop_isDiscarded() {
        Room r = room(1.0, 0.25);
        r.addParticipant("host", "Alice", null);
        TimerStart start = r.startTimer("host", TimerPhase.FOCUS, 25).orElseThrow();

        assertTrue(r.stopTimer("host"));

        assertFalse(r.completeTimer(start.generation()));
        assertNull(r.getTimerEndTimestamp());
    }

    @Test
    void completeTimer_onlyLatestStartCanComplete() {
        Room r = room(1.0, 0.25);
        r.addParticipant("host", "Alice", null);
        TimerStart first = r.startTimer("host", TimerPhase.FOCUS, 25).orElseThrow();
        TimerStart second = r.startTimer("host", TimerPhase.FOCUS, 25).orElseThrow();

        assertFalse(r.completeTimer(first.generation()));
        assertNotNull(r.getTimerEndTimestamp());
        assertTrue(r.completeTimer(second.generation()));
        assertNull(r.getTimerEndTimestamp());
        assertFalse(r.completeTimer(second.generation()), "completion fires once");
    }

    @Test
    void stopTimer_byGuest_isIgnored() {
        Room r = room(1.0, 0.25);
        r.addParticipant("host", "Alice", null);
        r.addParticipant("guest", "Bob", null);
        TimerStart start = r.startTimer("host", TimerPhase.FOCUS, 25).orElseThrow();

        assertFalse(r.stopTimer("guest"));
        assertEquals(start.endTimestamp(), r.getTimerEndTimestamp());
    }

    @Test
    void markConfused_neverClears_andCounts() {
        Room r = room(1.0, 0.25);
        Participant p = r.addParticipant("a", "A", null).orElseThrow();
        assertEquals(1, r.markConfused("a").getAsInt());
        assertEquals(2, r.markConfused("a").getAsInt());
        assertTrue(p.isConfused());
    }
}
