package com.yoursp.attendance.modules.temporary.dto;

import com.yoursp.attendance.model.entity.TemporaryWorkplaceRecord;

import java.util.UUID;

/**
 * @param approvalRequestId null when the record was self-approved
 */
public record TemporaryPunchResult(TemporaryWorkplaceRecord record, UUID approvalRequestId) {

    public boolean pendingApproval() {
        return approvalRequestId != null;
    }
}
