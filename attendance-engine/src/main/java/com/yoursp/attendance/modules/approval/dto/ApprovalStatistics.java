package com.yoursp.attendance.modules.approval.dto;

/**
 * Queue summary for the manager dashboard.
 *
 * @param approvalRatePercent    approved / decided x 100, 0 when nothing was decided
 * @param averageResponseMinutes mean of (decidedAt - requestedAt) over decided requests
 */
public record ApprovalStatistics(
        long total,
        long pending,
        long approved,
        long rejected,
        double approvalRatePercent,
        double averageResponseMinutes) {
}
