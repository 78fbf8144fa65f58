package com.yoursp.attendance.modules.geofence.dto;

import com.yoursp.attendance.model.entity.GeofenceZone;

/**
 * Result of matching a fix against the zone registry.
 *
 * @param zone           nearest active zone, or null when none is active
 * @param distanceMeters distance to that zone's center; +∞ when zone is null
 * @param withinZone     whether the fix lies inside the nearest zone's radius
 */
public record ZoneMatch(GeofenceZone zone, double distanceMeters, boolean withinZone) {

    public static ZoneMatch noActiveZone() {
        return new ZoneMatch(null, Double.POSITIVE_INFINITY, false);
    }
}
