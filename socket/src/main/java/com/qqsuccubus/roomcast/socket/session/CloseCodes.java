package com.qqsuccubus.roomcast.socket.session;

/**
 * WebSocket close codes sent by the server.
 */
public final class CloseCodes {
    private CloseCodes() {
    }

    public static final int NORMAL = 1000;

    /**
     * Node is draining; clients should reconnect elsewhere.
     */
    public static final int GOING_AWAY = 1001;

    public static final int AUTH_TIMEOUT = 4001;
    public static final int AUTH_FAILED = 4003;
}
