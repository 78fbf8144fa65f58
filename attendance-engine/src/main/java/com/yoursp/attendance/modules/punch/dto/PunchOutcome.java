package com.yoursp.attendance.modules.punch.dto;

public enum PunchOutcome {
    /** The attendance ledger may write the punch. */
    ACCEPTED,
    VERIFICATION_REQUIRED,
    PENDING_APPROVAL,
    ZONE_MISMATCH,
    VERIFICATION_RETRY,
    /** Attempts exhausted; the user has to re-register their face. */
    VERIFICATION_FAILED
}
