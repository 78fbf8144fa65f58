package com.yoursp.attendance.modules.geofence.exception;

import com.yoursp.attendance.exception.AttendanceException;
import lombok.Getter;

/**
 * Thrown when no usable location fix could be obtained. The punch is rejected
 * and nothing is recorded; callers may retry.
 */
@Getter
public class LocationUnavailableException extends AttendanceException {

    private final LocationFailureReason reason;

    public LocationUnavailableException(LocationFailureReason reason, String message) {
        super("LOCATION_UNAVAILABLE", message);
        this.reason = reason;
    }

    public LocationUnavailableException(LocationFailureReason reason, String message, Throwable cause) {
        super("LOCATION_UNAVAILABLE", message, cause);
        this.reason = reason;
    }
}
