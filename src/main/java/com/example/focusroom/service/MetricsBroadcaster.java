package com.example.focusroom.service;

import com.example.focusroom.config.SessionProperties;
import com.example.focusroom.model.Room;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.*;

/**
 * Fixed-rate score tick and state republish for every live room.
 * A failing room is logged and skipped; the loop keeps its schedule.
 */
@Component
public class MetricsBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(MetricsBroadcaster.class);

    private final RoomRegistry registry;
    private final EventTransport transport;
    private final long intervalMs;

    private ScheduledExecutorService scheduler;

    public MetricsBroadcaster(RoomRegistry registry, EventTransport transport, SessionProperties props) {
        this.registry = registry;
        this.transport = transport;
        this.intervalMs = props.metricsIntervalMs();
    }

    @PostConstruct
    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-broadcast");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("MetricsBroadcaster started (intervalMs={})", intervalMs);
    }

    /** One pass over all rooms. Never throws. */
    public void tick() {
        double seconds = intervalMs / 1000.0;
        for (Room room : registry.rooms()) {
            try {
                tickRoom(room, seconds);
            } catch (Throwable t) {
                log.warn("METRICS tick failed (room={}): {}", room.getCode(), t.toString());
            }
        }
    }

    private void tickRoom(Room room, double seconds) {
        Map<String, Object> state;
        double groupScore;
        double groupDps;
        synchronized (room) {
            if (room.isClosed()) return;
            room.tickAndDistribute(seconds);
            state = Payloads.roomState(room);
            groupScore = room.getGroupScore();
            groupDps = room.groupDps();
        }
        String code = room.getCode();
        logFailures(transport.emitToRoom(code, Events.ROOM_STATE, state), code);
        logFailures(transport.emitToRoom(code, Events.GROUP_SCORE_UPDATED, Payloads.groupScore(groupScore)), code);
        logFailures(transport.emitToRoom(code, Events.GROUP_DPS_UPDATED, Payloads.groupDps(groupDps)), code);
    }

    private static void logFailures(DeliveryReport report, String roomCode) {
        if (report != null && report.hasFailures()) {
            log.warn("METRICS {} to room={} failed for {} of {} connection(s): {}",
                    report.event(), roomCode, report.failed().size(),
                    report.delivered() + report.failed().size(), report.failed());
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
