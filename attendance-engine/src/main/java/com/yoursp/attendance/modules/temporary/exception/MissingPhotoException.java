package com.yoursp.attendance.modules.temporary.exception;

import com.yoursp.attendance.exception.AttendanceException;

public class MissingPhotoException extends AttendanceException {

    public MissingPhotoException() {
        super("MISSING_PHOTO", "A photo is required for temporary workplace punches");
    }
}
