package com.yoursp.attendance.modules.temporary.exception;

import com.yoursp.attendance.exception.AttendanceException;

import java.util.UUID;

public class ReusableWorkplaceNotFoundException extends AttendanceException {

    public ReusableWorkplaceNotFoundException(UUID reusableId) {
        super("REUSABLE_NOT_FOUND", "Reusable workplace not found: " + reusableId);
    }
}
