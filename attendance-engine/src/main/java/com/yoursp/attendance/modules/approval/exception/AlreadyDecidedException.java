package com.yoursp.attendance.modules.approval.exception;

import com.yoursp.attendance.exception.AttendanceException;
import lombok.Getter;

import java.util.UUID;

@Getter
public class AlreadyDecidedException extends AttendanceException {

    private final UUID requestId;

    public AlreadyDecidedException(UUID requestId) {
        super("ALREADY_DECIDED", "Approval request already decided: " + requestId);
        this.requestId = requestId;
    }
}
