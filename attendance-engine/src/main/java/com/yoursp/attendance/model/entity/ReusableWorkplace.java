package com.yoursp.attendance.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * A temporary location a user saved for later punches. Matched by id only.
 */
@Entity
@Table(name = "reusable_workplaces", uniqueConstraints = {
        @UniqueConstraint(name = "uq_reusable_user_name", columnNames = { "user_id", "name_key" })
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReusableWorkplace {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    /** Trimmed, lower-cased name; backs the per-user uniqueness of names. */
    @Column(name = "name_key", nullable = false, length = 120)
    private String nameKey;

    @Embedded
    private LocationFix locationFix;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "usage_count", nullable = false)
    private int usageCount;

    @Column(name = "last_used_at")
    private OffsetDateTime lastUsedAt;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    public void recordUsage(OffsetDateTime usedAt) {
        usageCount++;
        lastUsedAt = usedAt;
    }

    public static String nameKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
        nameKey = nameKey(name);
    }

    @PreUpdate
    protected void onUpdate() {
        nameKey = nameKey(name);
    }
}
