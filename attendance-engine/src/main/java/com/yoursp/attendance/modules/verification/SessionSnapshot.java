package com.yoursp.attendance.modules.verification;

import com.yoursp.attendance.model.SessionState;
import com.yoursp.attendance.model.entity.VerificationSession;

/**
 * The part of a session the state machine reasons about.
 */
public record SessionSnapshot(SessionState state, int attemptsUsed, int maxAttempts) {

    public static SessionSnapshot of(VerificationSession session) {
        return new SessionSnapshot(session.getState(), session.getAttempts().size(), session.getMaxAttempts());
    }

    public int remainingAttempts() {
        return Math.max(0, maxAttempts - attemptsUsed);
    }
}
