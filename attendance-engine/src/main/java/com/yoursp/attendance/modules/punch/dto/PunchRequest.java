package com.yoursp.attendance.modules.punch.dto;

import com.yoursp.attendance.model.PunchMethod;
import com.yoursp.attendance.model.PunchType;
import com.yoursp.attendance.model.entity.LocationFix;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.UUID;

/**
 * A clock-in or clock-out attempt.
 *
 * @param attendanceEventId identifies the clock event; generated when null
 * @param fix               device position, or null to ask the location provider
 * @param temporary         justification used when the fix is outside every zone
 */
@Builder
public record PunchRequest(
        @NotNull UUID userId,
        UUID managerId,
        UUID attendanceEventId,
        @NotNull PunchType type,
        PunchMethod method,
        LocationFix fix,
        TemporaryDetails temporary) {

    @Builder
    public record TemporaryDetails(
            String reason,
            String photoRef,
            String notes,
            boolean saveAsReusable,
            String reusableName,
            UUID reusableLocationId) {
    }
}
