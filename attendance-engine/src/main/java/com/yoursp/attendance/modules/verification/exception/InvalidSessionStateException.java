package com.yoursp.attendance.modules.verification.exception;

import com.yoursp.attendance.exception.AttendanceException;

/**
 * Thrown when an event is not legal in the session's current state.
 */
public class InvalidSessionStateException extends AttendanceException {

    public InvalidSessionStateException(String message) {
        super("INVALID_SESSION_STATE", message);
    }
}
