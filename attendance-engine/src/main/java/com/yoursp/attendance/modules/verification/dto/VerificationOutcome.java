package com.yoursp.attendance.modules.verification.dto;

/**
 * Result of one provider call. {@code failureReason} is null on success.
 */
public record VerificationOutcome(boolean success, int confidencePercent, String failureReason) {

    public static final String LOW_CONFIDENCE = "LOW_CONFIDENCE";

    public VerificationOutcome {
        if (confidencePercent < 0 || confidencePercent > 100) {
            throw new IllegalArgumentException("confidencePercent must be within 0..100: " + confidencePercent);
        }
    }

    public static VerificationOutcome success(int confidencePercent) {
        return new VerificationOutcome(true, confidencePercent, null);
    }

    public static VerificationOutcome failure(int confidencePercent, String failureReason) {
        return new VerificationOutcome(false, confidencePercent, failureReason);
    }
}
