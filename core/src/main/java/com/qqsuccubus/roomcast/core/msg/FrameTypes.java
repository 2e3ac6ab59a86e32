package com.qqsuccubus.roomcast.core.msg;

/**
 * Wire values of the {@code type} field.
 */
public final class FrameTypes {
    private FrameTypes() {
    }

    // client -> server

    public static final String AUTH = "auth";
    public static final String HEARTBEAT = "heartbeat";
    public static final String JOIN_ROOM = "join_room";
    public static final String JOIN_GATED = "join_gated";
    public static final String LEAVE_ROOM = "leave_room";
    public static final String LEAVE_GATED = "leave_gated";
    public static final String ROOM_MESSAGE = "room_message";
    public static final String GATED_MESSAGE = "gated_message";
    public static final String PRIVATE_MESSAGE = "private_message";
    public static final String GET_ONLINE_USERS = "get_online_users";
    public static final String STATS = "stats";
    public static final String GET_RECENT = "get_recent";
    public static final String LOGOUT = "logout";

    // server -> client (room_message, gated_message, private_message and stats are shared)

    public static final String WELCOME = "welcome";
    public static final String ERROR = "error";
    public static final String HEARTBEAT_ACK = "heartbeat_ack";
    public static final String ROOM_JOINED = "room_joined";
    public static final String ROOM_LEFT = "room_left";
    public static final String MESSAGE_SENT = "message_sent";
    public static final String STATUS = "status";
    public static final String ONLINE_USERS = "online_users";
    public static final String RECENT_MESSAGES = "recent_messages";
    public static final String LOGGED_OUT = "logged_out";
}
