package com.yoursp.attendance.modules.verification.dto;

import com.yoursp.attendance.model.SessionState;

import java.util.UUID;

public record VerificationProgress(
        UUID sessionId,
        SessionState state,
        int attemptNumber,
        int remainingAttempts,
        int confidencePercent,
        String failureReason,
        boolean reRegistrationRequired) {
}
