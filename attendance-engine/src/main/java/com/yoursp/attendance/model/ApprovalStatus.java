package com.yoursp.attendance.model;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
