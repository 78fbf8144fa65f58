package com.yoursp.attendance.modules.geofence.exception;

/**
 * Why no usable location fix could be obtained.
 */
public enum LocationFailureReason {
    PERMISSION_DENIED,
    UNAVAILABLE,
    TIMEOUT,
    /** A fix was delivered but failed validation (range, accuracy or age). */
    UNUSABLE
}
