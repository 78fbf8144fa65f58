package com.yoursp.attendance.exception;

import lombok.Getter;

/**
 * Base class for every error the engine reports to its callers.
 * <p>
 * The {@code errorCode} is stable and safe to expose to API clients; the
 * message is for logs.
 * </p>
 */
@Getter
public class AttendanceException extends RuntimeException {

    private final String errorCode;

    public AttendanceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AttendanceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
