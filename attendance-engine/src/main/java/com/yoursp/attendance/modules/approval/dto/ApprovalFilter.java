package com.yoursp.attendance.modules.approval.dto;

import com.yoursp.attendance.model.ApprovalType;
import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Criteria for the pending queue. Null fields do not restrict.
 */
@Builder
public record ApprovalFilter(
        ApprovalType type,
        UUID userId,
        UUID managerId,
        OffsetDateTime requestedFrom,
        OffsetDateTime requestedTo) {

    public static ApprovalFilter all() {
        return ApprovalFilter.builder().build();
    }
}
