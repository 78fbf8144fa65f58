package com.yoursp.attendance.model.entity;

import com.yoursp.attendance.model.PunchType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A punch from an unregistered location. Written once together with its
 * approval request (if any) and never modified.
 */
@Entity
@Immutable
@Table(name = "temporary_workplace_records", indexes = {
        @Index(name = "idx_temp_records_user_date", columnList = "user_id, record_date")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class TemporaryWorkplaceRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "record_date", nullable = false)
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(name = "punch_type", length = 20, nullable = false)
    private PunchType type;

    @Column(name = "punch_time", nullable = false)
    private LocalTime time;

    @Embedded
    private LocationFix locationFix;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "photo_ref", columnDefinition = "TEXT")
    private String photoRef;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "is_reusable", nullable = false)
    private boolean reusable;

    @Column(name = "reusable_location_id")
    private UUID reusableLocationId;

    /** Set when the punch needs manager sign-off. */
    @Column(name = "approval_request_id")
    private UUID approvalRequestId;

    @Column(name = "self_approved", nullable = false)
    private boolean selfApproved;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
    }
}
