package com.example.focusroom.service;

import com.example.focusroom.config.SessionProperties;
import com.example.focusroom.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide room code → Room mapping.
 * A room is registered from its first join until its last leave; callers delete it while
 * holding the room's monitor so no empty room stays visible.
 */
@Service
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final ConcurrentMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final SessionProperties props;
    private final Clock clock;

    public RoomRegistry(SessionProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    public Room getOrCreate(String code) {
        return rooms.computeIfAbsent(code, c -> {
            log.info("ROOM CREATE room={}", c);
            return new Room(c, props.baseRatePerSecond(), props.penaltyPerDistracted(), clock);
        });
    }

    public Optional<Room> get(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(rooms.get(code));
    }

    public void delete(String code) {
        if (code == null) return;
        if (rooms.remove(code) != null) log.info("ROOM DELETE room={}", code);
    }

    /** Removes the room only if {@code room} is still the registered instance for its code. */
    public boolean delete(Room room) {
        if (room == null) return false;
        boolean removed = rooms.remove(room.getCode(), room);
        if (removed) log.info("ROOM DELETE room={} (empty)", room.getCode());
        return removed;
    }

    /** Snapshot of the live rooms. */
    public List<Room> rooms() {
        return new ArrayList<>(rooms.values());
    }

    public int size() {
        return rooms.size();
    }
}
