package com.yoursp.attendance.modules.punch.dto;

import lombok.Builder;

import java.util.UUID;

/**
 * Handed to the attendance-ledger writer. Only {@code accepted} punches are
 * written.
 *
 * @param distanceMeters distance to the nearest active zone, null when unknown
 */
@Builder
public record PunchResult(
        boolean accepted,
        PunchOutcome outcome,
        UUID attendanceEventId,
        UUID sessionId,
        UUID recordId,
        UUID pendingApprovalId,
        Long zoneId,
        Double distanceMeters,
        Integer remainingAttempts,
        boolean reRegistrationRequired) {
}
