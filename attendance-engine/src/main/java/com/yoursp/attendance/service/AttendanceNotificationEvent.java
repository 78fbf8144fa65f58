package com.yoursp.attendance.service;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Published for downstream alerting. {@code detail} carries the approval type,
 * approval status or session state depending on {@code eventType}.
 */
public record AttendanceNotificationEvent(
        String eventType,
        UUID entityId,
        UUID userId,
        String detail,
        OffsetDateTime occurredAt) {

    public static final String APPROVAL_REQUESTED = "approval.requested";
    public static final String APPROVAL_DECIDED = "approval.decided";
    public static final String VERIFICATION_FAILED = "verification.failed";
}
