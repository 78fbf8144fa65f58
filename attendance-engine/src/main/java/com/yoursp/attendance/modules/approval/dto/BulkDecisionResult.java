package com.yoursp.attendance.modules.approval.dto;

import java.util.List;
import java.util.UUID;

/**
 * Per-id outcome of a bulk decision, in the order the ids were given.
 */
public record BulkDecisionResult(List<UUID> succeeded, List<Failure> failed) {

    public record Failure(UUID id, String errorCode) {
    }
}
