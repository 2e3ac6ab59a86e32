package com.qqsuccubus.roomcast.core.error;

/**
 * Machine-readable {@code code} of error frames.
 */
public enum ErrorCode {
    AUTH_REQUIRED,
    AUTHENTICATION_FAILED,
    INVALID_FRAME,
    UNKNOWN_TYPE,
    NOT_FOUND,
    ACCESS_DENIED,
    NOT_A_MEMBER,
    RATE_LIMITED,
    INTERNAL_ERROR
}
