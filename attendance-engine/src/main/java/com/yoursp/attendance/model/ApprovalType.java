package com.yoursp.attendance.model;

public enum ApprovalType {
    OVERTIME,
    LATE,
    EARLY_LEAVE,
    TEMPORARY_WORKPLACE,
    VERIFICATION_FAILURE
}
