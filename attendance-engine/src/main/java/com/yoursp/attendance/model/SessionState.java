package com.yoursp.attendance.model;

/**
 * Lifecycle of a verification session.
 * <p>
 * PENDING → CAPTURING → VERIFYING → (COMPLETED | FAILED). CANCELLED is reached
 * only through an explicit caller cancellation.
 * </p>
 */
public enum SessionState {
    PENDING,
    CAPTURING,
    VERIFYING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
