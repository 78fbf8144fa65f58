package com.yoursp.attendance.modules.verification;

public enum VerificationEvent {
    START,
    SUBMIT_SAMPLE,
    VERIFICATION_SUCCEEDED,
    VERIFICATION_FAILED,
    PROVIDER_UNAVAILABLE,
    CANCEL
}
