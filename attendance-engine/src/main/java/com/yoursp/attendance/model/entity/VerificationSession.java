package com.yoursp.attendance.model.entity;

import com.yoursp.attendance.model.PunchType;
import com.yoursp.attendance.model.SessionState;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "verification_sessions", indexes = {
        @Index(name = "idx_verification_sessions_user_event", columnList = "user_id, attendance_event_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VerificationSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "attendance_event_id", nullable = false)
    private UUID attendanceEventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "session_type", length = 20, nullable = false)
    private PunchType sessionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", length = 20, nullable = false)
    private SessionState state;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    /** Append-only; use {@link #appendAttempt}. */
    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, fetch = FetchType.EAGER)
    @OrderBy("attemptNumber ASC")
    private List<VerificationAttempt> attempts = new ArrayList<>();

    @Column(name = "total_attempts", nullable = false)
    private int totalAttempts;

    @Column(name = "final_image_ref", columnDefinition = "TEXT")
    private String finalImageRef;

    /** Average confidence of successful attempts; null unless COMPLETED. */
    @Column(name = "average_confidence")
    private Double averageConfidence;

    @Column(name = "started_at", updatable = false)
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public List<VerificationAttempt> getAttempts() {
        return Collections.unmodifiableList(attempts);
    }

    public void appendAttempt(VerificationAttempt attempt) {
        int expected = attempts.size() + 1;
        if (attempt.getAttemptNumber() != expected) {
            throw new IllegalArgumentException("Attempt number " + attempt.getAttemptNumber()
                    + " out of sequence, expected " + expected);
        }
        attempts.add(attempt);
    }

    @PrePersist
    protected void onCreate() {
        if (startedAt == null)
            startedAt = OffsetDateTime.now();
    }
}
