package com.yoursp.attendance.modules.verification.exception;

import com.yoursp.attendance.exception.AttendanceException;

import java.util.UUID;

public class SessionNotFoundException extends AttendanceException {

    public SessionNotFoundException(UUID sessionId) {
        super("SESSION_NOT_FOUND", "Verification session not found: " + sessionId);
    }
}
