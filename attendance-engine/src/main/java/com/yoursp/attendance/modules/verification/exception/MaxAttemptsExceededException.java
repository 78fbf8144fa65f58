package com.yoursp.attendance.modules.verification.exception;

import com.yoursp.attendance.exception.AttendanceException;
import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a caller keeps submitting to a session that already failed.
 * The user must re-register their face; an administrator has to intervene.
 */
@Getter
public class MaxAttemptsExceededException extends AttendanceException {

    private final UUID sessionId;

    public MaxAttemptsExceededException(UUID sessionId, int maxAttempts) {
        super("MAX_ATTEMPTS_EXCEEDED",
                "Verification session " + sessionId + " used all " + maxAttempts
                        + " attempts. Face re-registration is required.");
        this.sessionId = sessionId;
    }
}
