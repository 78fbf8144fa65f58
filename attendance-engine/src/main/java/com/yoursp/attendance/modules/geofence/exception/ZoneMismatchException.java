package com.yoursp.attendance.modules.geofence.exception;

import com.yoursp.attendance.exception.AttendanceException;

/**
 * Thrown when a fix lies outside every active zone and the temporary workplace
 * path is not open to the user.
 */
public class ZoneMismatchException extends AttendanceException {

    public ZoneMismatchException(String message) {
        super("ZONE_MISMATCH", message);
    }
}
