package com.yoursp.attendance.modules.geofence;

import com.yoursp.attendance.model.entity.GeofenceZone;
import com.yoursp.attendance.model.entity.LocationFix;
import com.yoursp.attendance.modules.geofence.dto.ZoneMatch;
import com.yoursp.attendance.repository.GeofenceZoneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads the current zone registry and classifies fixes against it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeofenceService {

    private final GeofenceZoneRepository zoneRepository;
    private final GeofenceEngine geofenceEngine;

    public ZoneMatch classify(LocationFix fix) {
        List<GeofenceZone> zones = zoneRepository.findByActiveTrueOrderByIdAsc();
        ZoneMatch match = geofenceEngine.matchZone(fix, zones);

        log.debug("Geofence classify: zones={}, nearestZone={}, distance={}m, within={}",
                zones.size(),
                match.zone() != null ? match.zone().getId() : null,
                Math.round(match.distanceMeters()),
                match.withinZone());
        return match;
    }
}
