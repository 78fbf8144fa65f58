package com.yoursp.attendance.modules.temporary.dto;

import com.yoursp.attendance.model.PunchType;
import com.yoursp.attendance.model.entity.LocationFix;
import lombok.Builder;

import java.util.UUID;

/**
 * A punch from a location outside every registered zone.
 *
 * @param reusableLocationId        select a previously saved workplace instead of saving a new one
 * @param nearestZoneDistanceMeters distance to the nearest registered zone, if any zone exists
 */
@Builder
public record TemporaryPunchRequest(
        UUID userId,
        UUID managerId,
        PunchType type,
        LocationFix fix,
        String reason,
        String photoRef,
        String notes,
        boolean saveAsReusable,
        String reusableName,
        UUID reusableLocationId,
        Double nearestZoneDistanceMeters) {
}
