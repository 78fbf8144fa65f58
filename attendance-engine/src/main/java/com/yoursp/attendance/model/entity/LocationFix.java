package com.yoursp.attendance.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A position reported by the device. Immutable once captured.
 */
@Embeddable
@Getter
@Builder
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class LocationFix {

    @Column(name = "latitude")
    private double latitude;

    @Column(name = "longitude")
    private double longitude;

    @Column(name = "accuracy_meters")
    private double accuracyMeters;

    @Column(name = "captured_at")
    private OffsetDateTime capturedAt;

    public static LocationFix of(double latitude, double longitude, double accuracyMeters,
            OffsetDateTime capturedAt) {
        return new LocationFix(latitude, longitude, accuracyMeters, capturedAt);
    }

    @Override
    public String toString() {
        return "LocationFix(lat=" + latitude + ", lng=" + longitude + ", accuracy=" + accuracyMeters + ")";
    }
}
