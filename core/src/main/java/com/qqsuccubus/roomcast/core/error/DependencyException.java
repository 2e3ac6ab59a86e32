package com.qqsuccubus.roomcast.core.error;

/**
 * An external collaborator (store, identity service, Redis) failed or is unavailable.
 * The client gets a generic internal error and may retry.
 */
public class DependencyException extends RoomcastException {

    public DependencyException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, message, cause);
    }

    public DependencyException(String message) {
        super(ErrorCode.INTERNAL_ERROR, message);
    }
}
