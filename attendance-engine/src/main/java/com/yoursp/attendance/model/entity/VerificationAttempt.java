package com.yoursp.attendance.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One counted verification attempt. Rows are never updated once written.
 */
@Entity
@Immutable
@Table(name = "verification_attempts", uniqueConstraints = {
        @UniqueConstraint(name = "uq_attempt_number", columnNames = { "session_id", "attempt_number" })
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class VerificationAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false, updatable = false)
    private VerificationSession session;

    @Column(name = "attempt_number", nullable = false, updatable = false)
    private int attemptNumber;

    @Column(name = "captured_image_ref", columnDefinition = "TEXT", updatable = false)
    private String capturedImageRef;

    @Column(name = "success", nullable = false, updatable = false)
    private boolean success;

    @Column(name = "confidence_percent", updatable = false)
    private int confidencePercent;

    @Column(name = "failure_reason", length = 120, updatable = false)
    private String failureReason;

    @Column(name = "captured_at", updatable = false)
    private OffsetDateTime capturedAt;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "capturedAt", column = @Column(name = "fix_captured_at", updatable = false))
    })
    private LocationFix locationFix;

    public UUID getSessionId() {
        return session != null ? session.getId() : null;
    }
}
