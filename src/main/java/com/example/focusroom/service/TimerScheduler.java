package com.example.focusroom.service;

import com.example.focusroom.model.Room;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deferred countdown completion per room.
 * A completion only takes effect if the room's timer generation is still the one it was scheduled
 * under; the tracked future per room is cancelled on restart, stop and room destruction.
 */
@Component
public class TimerScheduler {

    private static final Logger log = LoggerFactory.getLogger(TimerScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final ConcurrentMap<Room, Pending> pending = new ConcurrentHashMap<>();

    private record Pending(long generation, ScheduledFuture<?> future) { }

    public TimerScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
            private final AtomicInteger c = new AtomicInteger();
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "room-timer-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        }));
    }

    TimerScheduler(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Schedules completion of the countdown started under {@code generation}.
     * {@code onEnded} runs outside the room monitor and only if the completion was still current.
     * A request older than the one already tracked for the room is dropped.
     */
    public void schedule(Room room, long generation, Duration delay, Runnable onEnded) {
        long delayMs = Math.max(0L, delay.toMillis());
        pending.compute(room, (k, prev) -> {
            if (prev != null && prev.generation() > generation) {
                log.debug("TIMER SCHEDULE skipped room={} gen={} (gen={} already pending)",
                        room.getCode(), generation, prev.generation());
                return prev;
            }
            if (prev != null) prev.future().cancel(false);
            ScheduledFuture<?> future = scheduler.schedule(
                    () -> fire(room, generation, onEnded), delayMs, TimeUnit.MILLISECONDS);
            log.debug("TIMER SCHEDULE room={} gen={} delayMs={}", room.getCode(), generation, delayMs);
            return new Pending(generation, future);
        });
    }

    /** Cancels the pending completion of {@code room}, if any. */
    public void cancel(Room room) {
        if (room == null) return;
        Pending prev = pending.remove(room);
        if (prev != null) {
            prev.future().cancel(false);
            log.debug("TIMER CANCEL room={} gen={}", room.getCode(), prev.generation());
        }
    }

    /**
     * Cancels the pending completion of {@code room} only if it was scheduled before {@code generation}.
     * A countdown started after the stop keeps its completion.
     */
    public void cancelBefore(Room room, long generation) {
        if (room == null) return;
        pending.computeIfPresent(room, (k, prev) -> {
            if (prev.generation() >= generation) return prev;
            prev.future().cancel(false);
            log.debug("TIMER CANCEL room={} gen={}", room.getCode(), prev.generation());
            return null;
        });
    }

    public int pendingCount() {
        return pending.size();
    }

    ScheduledFuture<?> pendingFuture(Room room) {
        Pending p = pending.get(room);
        return p == null ? null : p.future();
    }

    private void fire(Room room, long generation, Runnable onEnded) {
        pending.computeIfPresent(room, (k, v) -> v.generation() == generation ? null : v);
        try {
            boolean ended;
            synchronized (room) {
                ended = room.completeTimer(generation);
            }
            if (!ended) {
                log.debug("TIMER STALE room={} gen={} (superseded)", room.getCode(), generation);
                return;
            }
            log.info("TIMER END room={}", room.getCode());
            onEnded.run();
        } catch (RuntimeException e) {
            log.warn("TIMER completion failed (room={}, gen={})", room.getCode(), generation, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        pending.clear();
    }
}
