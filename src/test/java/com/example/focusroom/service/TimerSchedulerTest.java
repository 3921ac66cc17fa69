package com.example.focusroom.service;

import com.example.focusroom.MutableClock;
import com.example.focusroom.model.Room;
import com.example.focusroom.model.TimerPhase;
import com.example.focusroom.model.TimerStart;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Deferred completions are captured from a mocked executor and run by hand,
 * so "fires later" is deterministic.
 */
class TimerSchedulerTest {

    private ScheduledExecutorService executor;
    private TimerScheduler timers;
    private Room room;
    private final AtomicInteger ended = new AtomicInteger();

    @BeforeEach
    void setUp() {
        executor = mock(ScheduledExecutorService.class);
        when(executor.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class)))
                .thenAnswer(inv -> mock(ScheduledFuture.class));
        timers = new TimerScheduler(executor);

        room = new Room("R", 1.0, 0.25, new MutableClock(0L));
        room.addParticipant("host", "Alice", null);
    }

    @AfterEach
    void tearDown() {
        timers.shutdown();
    }

    private TimerStart startAndSchedule() {
        TimerStart start = room.startTimer("host", TimerPhase.FOCUS, 25).orElseThrow();
        timers.schedule(room, start.generation(), Duration.ofMinutes(25), ended::incrementAndGet);
        return start;
    }

    private List<Runnable> scheduledTasks() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(executor, atLeastOnce()).schedule(task.capture(), anyLong(), any(TimeUnit.class));
        return task.getAllValues();
    }

    @Test
    void completion_firesTimerEnded_andClearsRoomTimer() {
        startAndSchedule();
        verify(executor).schedule(any(Runnable.class), eq(25 * 60_000L), eq(TimeUnit.MILLISECONDS));

        scheduledTasks().get(0).run();

        assertEquals(1, ended.get());
        assertNull(room.getTimerEndTimestamp());
        assertEquals(0, timers.pendingCount());
    }

    @Test
    @DisplayName("start then stop: the deferred completion never ends the timer")
    void stop_invalidatesPendingCompletion() {
        startAndSchedule();
        synchronized (room) {
            assertTrue(room.stopTimer("host"));
        }
        timers.cancel(room);

        scheduledTasks().get(0).run();

        assertEquals(0, ended.get());
        assertEquals(0, timers.pendingCount());
    }

    @Test
    @DisplayName("two rapid starts: only the second completion can fire")
    void restart_discardsFirstCompletion() {
        startAndSchedule();
        startAndSchedule();

        List<Runnable> tasks = scheduledTasks();
        assertEquals(2, tasks.size());

        tasks.get(0).run();
        assertEquals(0, ended.get());
        assertNotNull(room.getTimerEndTimestamp());

        tasks.get(1).run();
        assertEquals(1, ended.get());
        assertNull(room.getTimerEndTimestamp());
    }

    @Test
    void restart_cancelsPreviousFuture() {
        startAndSchedule();
        ScheduledFuture<?> first = timers.pendingFuture(room);
        startAndSchedule();

        verify(first).cancel(false);
        assertEquals(1, timers.pendingCount());
    }

    @Test
    @DisplayName("an older start scheduled after a newer one is dropped")
    void outOfOrderSchedule_keepsNewestGeneration() {
        TimerStart first = room.startTimer("host", TimerPhase.FOCUS, 25).orElseThrow();
        TimerStart second = room.startTimer("host", TimerPhase.FOCUS, 25).orElseThrow();

        timers.schedule(room, second.generation(), Duration.ofMinutes(25), ended::incrementAndGet);
        ScheduledFuture<?> current = timers.pendingFuture(room);
        timers.schedule(room, first.generation(), Duration.ofMinutes(25), ended::incrementAndGet);

        assertSame(current, timers.pendingFuture(room));
        verify(current, never()).cancel(anyBoolean());
        List<Runnable> tasks = scheduledTasks();
        assertEquals(1, tasks.size());

        tasks.get(0).run();
        assertEquals(1, ended.get());
        assertNull(room.getTimerEndTimestamp());
    }

    @Test
    @DisplayName("a late stop does not cancel a countdown started after it")
    void cancelBefore_leavesNewerCountdownPending() {
        startAndSchedule();
        long afterStop;
        synchronized (room) {
            assertTrue(room.stopTimer("host"));
            afterStop = room.getTimerGeneration();
        }
        startAndSchedule();
        ScheduledFuture<?> restarted = timers.pendingFuture(room);

        timers.cancelBefore(room, afterStop);

        assertSame(restarted, timers.pendingFuture(room));
        verify(restarted, never()).cancel(anyBoolean());
        scheduledTasks().get(1).run();
        assertEquals(1, ended.get());
    }

    @Test
    void cancelBefore_cancelsOlderCountdown() {
        startAndSchedule();
        ScheduledFuture<?> first = timers.pendingFuture(room);

        timers.cancelBefore(room, room.getTimerGeneration() + 1);

        verify(first).cancel(false);
        assertEquals(0, timers.pendingCount());
    }

    @Test
    void realExecutor_outOfOrderSchedule_stillEndsCurrentCountdown() throws Exception {
        TimerScheduler real = new TimerScheduler();
        try {
            CountDownLatch latch = new CountDownLatch(1);
            TimerStart first = room.startTimer("host", TimerPhase.FOCUS, 1).orElseThrow();
            TimerStart second = room.startTimer("host", TimerPhase.FOCUS, 1).orElseThrow();
            real.schedule(room, second.generation(), Duration.ofMillis(50), latch::countDown);
            real.schedule(room, first.generation(), Duration.ofMillis(50), latch::countDown);

            assertTrue(latch.await(2, TimeUnit.SECONDS));
            synchronized (room) {
                assertNull(room.getTimerEndTimestamp());
            }
        } finally {
            real.shutdown();
        }
    }

    @Test
    void failingCallback_isContained() {
        TimerStart start = room.startTimer("host", TimerPhase.BREAK, 5).orElseThrow();
        timers.schedule(room, start.generation(), Duration.ofMinutes(5), () -> { throw new IllegalStateException("boom"); });

        assertDoesNotThrow(() -> scheduledTasks().get(0).run());
        assertNull(room.getTimerEndTimestamp());
    }

    @Test
    void realExecutor_firesAfterDelay() throws Exception {
        TimerScheduler real = new TimerScheduler();
        try {
            CountDownLatch latch = new CountDownLatch(1);
            TimerStart start = room.startTimer("host", TimerPhase.FOCUS, 25).orElseThrow();
            real.schedule(room, start.generation(), Duration.ofMillis(20), latch::countDown);

            assertTrue(latch.await(2, TimeUnit.SECONDS));
            synchronized (room) {
                assertNull(room.getTimerEndTimestamp());
            }
        } finally {
            real.shutdown();
        }
    }
}
