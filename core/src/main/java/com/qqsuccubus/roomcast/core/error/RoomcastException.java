package com.qqsuccubus.roomcast.core.error;

import lombok.Getter;

/**
 * Base of the error taxonomy. Each subtype maps to one reply policy in the router.
 */
@Getter
public abstract class RoomcastException extends RuntimeException {
    private final ErrorCode code;

    protected RoomcastException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected RoomcastException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Whether the connection must be closed after replying.
     */
    public boolean isFatal() {
        return false;
    }
}
