package com.qqsuccubus.roomcast.core.error;

/**
 * Frame malformed, of unknown type, or missing required fields. The connection stays open.
 */
public class ValidationException extends RoomcastException {

    public ValidationException(String message) {
        super(ErrorCode.INVALID_FRAME, message);
    }

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
