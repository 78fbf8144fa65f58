package com.yoursp.attendance.modules.punch.exception;

import com.yoursp.attendance.exception.AttendanceException;

/**
 * Thrown when the zone a punch resolved to does not accept the punch method.
 */
public class MethodNotAllowedException extends AttendanceException {

    public MethodNotAllowedException(String message) {
        super("METHOD_NOT_ALLOWED", message);
    }
}
