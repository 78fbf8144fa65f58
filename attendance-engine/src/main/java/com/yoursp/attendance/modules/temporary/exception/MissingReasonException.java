package com.yoursp.attendance.modules.temporary.exception;

import com.yoursp.attendance.exception.AttendanceException;

public class MissingReasonException extends AttendanceException {

    public MissingReasonException() {
        super("MISSING_REASON", "A reason is required for temporary workplace punches");
    }
}
