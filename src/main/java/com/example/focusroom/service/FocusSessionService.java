package com.example.focusroom.service;

import com.example.focusroom.config.SessionProperties;
import com.example.focusroom.model.DepartureMetrics;
import com.example.focusroom.model.Participant;
import com.example.focusroom.model.Room;
import com.example.focusroom.model.TimerPhase;
import com.example.focusroom.model.TimerStart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Focus session orchestration: join/leave, shared timer, focus toggles and expression frames.
 * Room state is mutated under {@code synchronized (room)}; events are emitted after the monitor is released.
 * Malformed input, stale connections and non-host timer requests are ignored, never surfaced to clients.
 */
@Service
public class FocusSessionService {

    private static final Logger log = LoggerFactory.getLogger(FocusSessionService.class);

    private final RoomRegistry registry;
    private final SessionTable sessions;
    private final EventTransport transport;
    private final TimerScheduler timerScheduler;
    private final ConfusionDetector confusionDetector;
    private final SessionProperties props;

    public FocusSessionService(RoomRegistry registry,
                               SessionTable sessions,
                               EventTransport transport,
                               TimerScheduler timerScheduler,
                               ConfusionDetector confusionDetector,
                               SessionProperties props) {
        this.registry = registry;
        this.sessions = sessions;
        this.transport = transport;
        this.timerScheduler = timerScheduler;
        this.confusionDetector = confusionDetector;
        this.props = props;
    }

    // ========================================================================
    //  CONNECT / JOIN / LEAVE
    // ========================================================================

    public void connect(String connectionId) {
        log.info("CONNECT cid={}", connectionId);
    }

    public void disconnect(String connectionId) {
        Optional<SessionTable.Session> session = sessions.remove(connectionId);
        log.info("DISCONNECT cid={} room={}", connectionId, session.map(SessionTable.Session::roomCode).orElse(null));
        session.ifPresent(s -> depart(connectionId, s.roomCode(), false));
    }

    /**
     * Adds the connection to {@code roomCode}. A connection already in a room leaves it first.
     * Returns the room joined, or empty if the request was malformed.
     */
    public Optional<Room> join(String connectionId, String roomCode, String displayName, String avatarRef) {
        String code = trimToNull(roomCode);
        String name = trimToNull(displayName);
        if (connectionId == null || code == null || name == null) {
            log.debug("JOIN ignored: missing roomCode/username (cid={})", connectionId);
            return Optional.empty();
        }

        sessions.remove(connectionId).ifPresent(prev -> depart(connectionId, prev.roomCode(), true));

        Room room;
        Participant participant;
        Map<String, Object> state;
        while (true) {
            room = registry.getOrCreate(code);
            synchronized (room) {
                // lost a race with the last leave; that instance is gone from the registry
                if (room.isClosed()) continue;
                participant = room.addParticipant(connectionId, name, trimToNull(avatarRef)).orElse(null);
                if (participant == null) return Optional.empty();
                state = Payloads.roomState(room);
            }
            break;
        }

        sessions.put(connectionId, code, participant.getDisplayName());
        transport.joinRoom(connectionId, code);

        log.info("JOIN room={} name={} cid={} avatar={}", code, participant.getDisplayName(), connectionId,
                participant.getAvatarRef());

        check(transport.emitToOne(connectionId, Events.ROOM_STATE, state), code);
        check(transport.emitToRoom(code, Events.USER_JOINED, Payloads.userJoined(participant), connectionId), code);
        return Optional.of(room);
    }

    /**
     * Explicit leave. The room comes from the session table; a differing {@code roomCode} is stale and ignored.
     */
    public void leave(String connectionId, String roomCode) {
        SessionTable.Session s = sessions.get(connectionId).orElse(null);
        if (s == null) return;
        String requested = trimToNull(roomCode);
        if (requested != null && !requested.equals(s.roomCode())) {
            log.debug("LEAVE ignored: cid={} is in room={}, not {}", connectionId, s.roomCode(), requested);
            return;
        }
        if (sessions.remove(connectionId, s)) {
            depart(connectionId, s.roomCode(), true);
        }
    }

    private void depart(String connectionId, String roomCode, boolean notifyDeparting) {
        Room room = registry.get(roomCode).orElse(null);
        if (room == null) return;

        DepartureMetrics metrics;
        boolean destroyed;
        boolean hostChanged;
        Map<String, Object> state = null;
        synchronized (room) {
            String hostBefore = room.getHostId();
            metrics = room.removeParticipant(connectionId).orElse(null);
            if (metrics == null) return;
            destroyed = room.isClosed();
            hostChanged = !destroyed && !Objects.equals(hostBefore, room.getHostId());
            if (destroyed) {
                registry.delete(room);
            } else if (hostChanged) {
                state = Payloads.roomState(room);
            }
        }

        transport.leaveRoom(connectionId, roomCode);
        if (destroyed) timerScheduler.cancel(room);

        log.info("LEAVE room={} name={} focus={}% score={} confusions={}",
                roomCode, metrics.displayName(), Math.round(metrics.focusPercentage()),
                metrics.score(), metrics.confusionEventCount());

        if (notifyDeparting) {
            check(transport.emitToOne(connectionId, Events.USER_METRICS, Payloads.metrics(metrics)), roomCode);
        }
        if (!destroyed) {
            check(transport.emitToRoom(roomCode, Events.USER_LEFT, Payloads.userLeft(metrics.displayName())), roomCode);
            if (hostChanged) check(transport.emitToRoom(roomCode, Events.ROOM_STATE, state), roomCode);
        }
    }

    // ========================================================================
    //  TIMER
    // ========================================================================

    public void startTimer(String connectionId, String rawPhase) {
        Room room = roomOf(connectionId).orElse(null);
        if (room == null) return;

        TimerPhase phase = TimerPhase.parse(rawPhase).orElse(null);
        if (phase == null) {
            log.debug("TIMER START ignored: unknown phase '{}' (room={})", rawPhase, room.getCode());
            return;
        }

        TimerStart start;
        synchronized (room) {
            start = room.startTimer(connectionId, phase, props.durationMinutes(phase)).orElse(null);
        }
        if (start == null) {
            log.info("TIMER START ignored: cid={} is not host of room={}", connectionId, room.getCode());
            return;
        }

        String code = room.getCode();
        log.info("TIMER START room={} phase={} mins={}", code, phase.wireName(), start.durationMinutes());
        timerScheduler.schedule(room, start.generation(), Duration.ofMinutes(start.durationMinutes()),
                () -> check(transport.emitToRoom(code, Events.TIMER_ENDED, Map.of()), code));
        check(transport.emitToRoom(code, Events.TIMER_STARTED, Payloads.timerStarted(start)), code);
    }

    public void stopTimer(String connectionId) {
        Room room = roomOf(connectionId).orElse(null);
        if (room == null) return;

        boolean stopped;
        long generation;
        synchronized (room) {
            stopped = room.stopTimer(connectionId);
            generation = room.getTimerGeneration();
        }
        if (!stopped) {
            log.info("TIMER STOP ignored: cid={} is not host of room={}", connectionId, room.getCode());
            return;
        }
        timerScheduler.cancelBefore(room, generation);
        log.info("TIMER STOP room={}", room.getCode());
        check(transport.emitToRoom(room.getCode(), Events.TIMER_STOPPED, Map.of()), room.getCode());
    }

    // ========================================================================
    //  FOCUS / DISTRACTION
    // ========================================================================

    public void markDistracted(String connectionId) {
        changeFocus(connectionId, true);
    }

    public void markFocused(String connectionId) {
        changeFocus(connectionId, false);
    }

    private void changeFocus(String connectionId, boolean distracted) {
        SessionTable.Session s = sessions.get(connectionId).orElse(null);
        if (s == null) return;
        Room room = registry.get(s.roomCode()).orElse(null);
        if (room == null) return;

        boolean changed;
        double groupScore;
        double groupDps;
        synchronized (room) {
            if (room.getParticipant(connectionId).isEmpty()) return;
            changed = distracted ? room.markDistracted(connectionId) : room.markFocused(connectionId);
            // zero-length tick: re-publishes score and rate on every toggle
            room.tickAndDistribute(0);
            groupScore = room.getGroupScore();
            groupDps = room.groupDps();
        }

        String code = room.getCode();
        if (changed) log.info("STATUS room={} name={} distracted={}", code, s.displayName(), distracted);
        check(transport.emitToRoom(code, Events.USER_STATUS_CHANGED, Payloads.statusChanged(s.displayName(), distracted)), code);
        check(transport.emitToRoom(code, Events.GROUP_SCORE_UPDATED, Payloads.groupScore(groupScore)), code);
        check(transport.emitToRoom(code, Events.GROUP_DPS_UPDATED, Payloads.groupDps(groupDps)), code);
    }

    // ========================================================================
    //  EXPRESSION FRAMES
    // ========================================================================

    /** Relays the frame to the rest of the room and runs confusion detection on it. */
    public void expressionFrame(String connectionId, Map<String, Object> frame) {
        SessionTable.Session s = sessions.get(connectionId).orElse(null);
        if (s == null || frame == null) return;
        Room room = registry.get(s.roomCode()).orElse(null);
        if (room == null) return;
        String code = room.getCode();

        check(transport.emitToRoom(code, Events.BLEND_SHAPES_UPDATE, Payloads.blendShapes(s.displayName(), frame), connectionId), code);

        boolean confused;
        try {
            confused = confusionDetector.isConfused(frame);
        } catch (RuntimeException e) {
            log.warn("CONFUSION detection failed (room={}, name={}): {}", code, s.displayName(), e.toString());
            return;
        }
        if (!confused) return;

        OptionalInt count;
        synchronized (room) {
            count = room.markConfused(connectionId);
        }
        if (count.isEmpty()) return;
        log.debug("CONFUSED room={} name={} count={}", code, s.displayName(), count.getAsInt());
        check(transport.emitToRoom(code, Events.USER_CONFUSED, Payloads.confused(s.displayName(), count.getAsInt())), code);
    }

    // ========================================================================
    //  HELPERS
    // ========================================================================

    public Optional<Room> roomOf(String connectionId) {
        return sessions.get(connectionId).flatMap(s -> registry.get(s.roomCode()));
    }

    private static void check(DeliveryReport report, String roomCode) {
        if (report != null && report.hasFailures()) {
            log.warn("EMIT {} to room={} failed for {}", report.event(), roomCode, report.failed());
        }
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
