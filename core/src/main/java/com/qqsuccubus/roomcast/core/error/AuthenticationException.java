package com.qqsuccubus.roomcast.core.error;

/**
 * Credentials missing, invalid or expired. Fatal to the connection.
 */
public class AuthenticationException extends RoomcastException {

    public AuthenticationException(String message) {
        super(ErrorCode.AUTHENTICATION_FAILED, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorCode.AUTHENTICATION_FAILED, message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
