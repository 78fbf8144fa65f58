package com.yoursp.attendance.modules.temporary.exception;

import com.yoursp.attendance.exception.AttendanceException;

/**
 * Thrown when a temporary punch is farther from the nearest registered
 * workplace than policy allows.
 */
public class TemporaryWorkplaceOutOfRangeException extends AttendanceException {

    public TemporaryWorkplaceOutOfRangeException(double distanceMeters, double maxMeters) {
        super("OUT_OF_RANGE", String.format(
                "Location is %.0fm from the nearest workplace (limit %.0fm)", distanceMeters, maxMeters));
    }
}
