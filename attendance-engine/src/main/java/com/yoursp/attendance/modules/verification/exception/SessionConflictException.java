package com.yoursp.attendance.modules.verification.exception;

import com.yoursp.attendance.exception.AttendanceException;

/**
 * Thrown when a verification session is already open (or being opened) for the
 * same user and attendance event.
 */
public class SessionConflictException extends AttendanceException {

    public SessionConflictException(String message) {
        super("SESSION_CONFLICT", message);
    }
}
