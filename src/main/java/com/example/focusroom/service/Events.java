package com.example.focusroom.service;

/** Event names on the wire. */
public final class Events {

    private Events() { }

    // Client -> server
    public static final String ROOM_JOIN = "room:join";
    public static final String ROOM_LEAVE = "room:leave";
    public static final String TIMER_START = "timer:start";
    public static final String TIMER_STOP = "timer:stop";
    public static final String USER_DISTRACTED = "user:distracted";
    public static final String USER_FOCUSED = "user:focused";
    public static final String BLEND_SHAPES = "avatar:blend-shapes";

    // Server -> client
    public static final String ROOM_STATE = "room:state";
    public static final String USER_JOINED = "user:joined";
    public static final String USER_LEFT = "user:left";
    public static final String USER_STATUS_CHANGED = "user:status-changed";
    public static final String USER_CONFUSED = "user:confused";
    public static final String USER_METRICS = "user:metrics";
    public static final String TIMER_STARTED = "timer:started";
    public static final String TIMER_STOPPED = "timer:stopped";
    public static final String TIMER_ENDED = "timer:ended";
    public static final String GROUP_SCORE_UPDATED = "group:score-updated";
    public static final String GROUP_DPS_UPDATED = "group:dps-updated";
    public static final String BLEND_SHAPES_UPDATE = "avatar:blend-shapes-update";
}
