package com.qqsuccubus.roomcast.socket.session;

/**
 * Per-connection router state.
 * <pre>
 * CONNECTING → AUTHENTICATED → (PROCESSING → AUTHENTICATED)* → CLOSED
 * </pre>
 * Any state may move to {@link #CLOSED}; nothing leaves it.
 */
public enum ConnectionState {
    /**
     * Accepted, waiting for credentials. Only {@code auth} frames are processed.
     */
    CONNECTING,
    AUTHENTICATED,
    /**
     * Handling one inbound frame.
     */
    PROCESSING,
    CLOSED
}
