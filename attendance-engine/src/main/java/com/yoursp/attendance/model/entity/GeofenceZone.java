package com.yoursp.attendance.model.entity;

import com.yoursp.attendance.model.PunchMethod;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * A circular work zone. Written by the administrative surface; the engine only
 * reads it. Ascending id is insertion order.
 */
@Entity
@Table(name = "geofence_zones")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceZone {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "center_lat", nullable = false)
    private double centerLat;

    @Column(name = "center_lng", nullable = false)
    private double centerLng;

    @Column(name = "radius_meters", nullable = false)
    private double radiusMeters;

    @Column(name = "address", columnDefinition = "TEXT")
    private String address;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "geofence_zone_methods", joinColumns = @JoinColumn(name = "zone_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "method", length = 20)
    private Set<PunchMethod> allowedMethods = new HashSet<>();

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (radiusMeters <= 0) {
            throw new IllegalStateException("Zone radius must be positive: " + radiusMeters);
        }
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
    }
}
