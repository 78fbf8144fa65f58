package com.yoursp.attendance.model.entity;

import com.yoursp.attendance.model.ApprovalStatus;
import com.yoursp.attendance.model.ApprovalType;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A manager-facing decision item. The id is assigned by whoever raises the
 * request so that retried submissions collapse onto one row.
 * <p>
 * Status moves only through
 * {@link com.yoursp.attendance.repository.ApprovalRequestRepository#decide}.
 * </p>
 */
@Entity
@Table(name = "approval_requests", indexes = {
        @Index(name = "idx_approval_status_manager", columnList = "status, manager_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApprovalRequest {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "source_event_id")
    private UUID sourceEventId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "manager_id")
    private UUID managerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", length = 30, nullable = false)
    private ApprovalType type;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private ApprovalStatus status;

    @Column(name = "requested_at", updatable = false)
    private OffsetDateTime requestedAt;

    @Column(name = "decided_at")
    private OffsetDateTime decidedAt;

    @Column(name = "decision_note", columnDefinition = "TEXT")
    private String decisionNote;

    @PrePersist
    protected void onCreate() {
        if (requestedAt == null)
            requestedAt = OffsetDateTime.now();
        if (status == null)
            status = ApprovalStatus.PENDING;
    }
}
