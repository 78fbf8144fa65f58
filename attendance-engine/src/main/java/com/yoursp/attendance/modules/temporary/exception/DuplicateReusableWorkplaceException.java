package com.yoursp.attendance.modules.temporary.exception;

import com.yoursp.attendance.exception.AttendanceException;

/**
 * Thrown when a user saves a second reusable workplace under a name they
 * already use.
 */
public class DuplicateReusableWorkplaceException extends AttendanceException {

    public DuplicateReusableWorkplaceException(String name) {
        super("DUPLICATE_REUSABLE", "A reusable workplace named '" + name + "' already exists");
    }
}
