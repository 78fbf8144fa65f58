package com.yoursp.attendance.modules.geofence;

import com.yoursp.attendance.model.entity.GeofenceZone;
import com.yoursp.attendance.model.entity.LocationFix;
import com.yoursp.attendance.modules.geofence.dto.ZoneMatch;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classifies a location fix against a list of work zones.
 * <p>
 * Stateless and side-effect free: the zone list is only read, so the engine
 * can be called concurrently without locking.
 * </p>
 */
@Component
public class GeofenceEngine {

    /**
     * Find the nearest active zone and whether the fix lies inside it.
     * <ul>
     * <li>Inactive zones are skipped</li>
     * <li>The radius boundary is inclusive</li>
     * <li>Equal distances keep the zone that comes first in {@code zones}</li>
     * </ul>
     *
     * @param fix   the device position
     * @param zones registry snapshot, in insertion order
     * @return the match; {@link ZoneMatch#noActiveZone()} when nothing is active
     */
    public ZoneMatch matchZone(LocationFix fix, List<GeofenceZone> zones) {
        GeofenceZone nearest = null;
        double minDistance = Double.POSITIVE_INFINITY;

        for (GeofenceZone zone : zones) {
            if (!zone.isActive()) {
                continue;
            }
            double distance = distanceTo(fix, zone);
            // strict < keeps the earlier zone on ties
            if (nearest == null || distance < minDistance) {
                nearest = zone;
                minDistance = distance;
            }
        }

        if (nearest == null) {
            return ZoneMatch.noActiveZone();
        }
        return new ZoneMatch(nearest, minDistance, minDistance <= nearest.getRadiusMeters());
    }

    public double distanceTo(LocationFix fix, GeofenceZone zone) {
        return GeoDistance.haversineMeters(fix.getLatitude(), fix.getLongitude(),
                zone.getCenterLat(), zone.getCenterLng());
    }
}
