package com.yoursp.attendance.modules.approval.exception;

import com.yoursp.attendance.exception.AttendanceException;
import lombok.Getter;

import java.util.UUID;

@Getter
public class ApprovalNotFoundException extends AttendanceException {

    private final UUID requestId;

    public ApprovalNotFoundException(UUID requestId) {
        super("NOT_FOUND", "Approval request not found: " + requestId);
        this.requestId = requestId;
    }
}
