package com.qqsuccubus.roomcast.core.error;

/**
 * Gating requirement or membership not met. Nothing is mutated.
 */
public class AuthorizationException extends RoomcastException {

    public AuthorizationException(ErrorCode code, String message) {
        super(code, message);
    }
}
