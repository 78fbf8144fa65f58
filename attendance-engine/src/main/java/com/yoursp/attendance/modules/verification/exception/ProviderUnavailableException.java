package com.yoursp.attendance.modules.verification.exception;

import com.yoursp.attendance.exception.AttendanceException;

/**
 * Thrown when the verification provider cannot be reached (timeout, circuit
 * open, no camera). Does not consume an attempt.
 */
public class ProviderUnavailableException extends AttendanceException {

    public ProviderUnavailableException(String message) {
        super("PROVIDER_UNAVAILABLE", message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super("PROVIDER_UNAVAILABLE", message, cause);
    }
}
