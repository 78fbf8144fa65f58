package com.yoursp.attendance.model;

/**
 * How an employee proves presence at a zone.
 */
public enum PunchMethod {
    GEOLOCATION,
    QR,
    FACIAL
}
