package com.yoursp.attendance.modules.punch;

import com.yoursp.attendance.config.AttendanceProperties;
import com.yoursp.attendance.model.PunchMethod;
import com.yoursp.attendance.model.SessionState;
import com.yoursp.attendance.model.entity.GeofenceZone;
import com.yoursp.attendance.model.entity.LocationFix;
import com.yoursp.attendance.model.entity.VerificationSession;
import com.yoursp.attendance.modules.geofence.GeofenceService;
import com.yoursp.attendance.modules.geofence.LocationResolver;
import com.yoursp.attendance.modules.geofence.dto.ZoneMatch;
import com.yoursp.attendance.modules.punch.dto.PunchOutcome;
import com.yoursp.attendance.modules.punch.dto.PunchRequest;
import com.yoursp.attendance.modules.punch.dto.PunchResult;
import com.yoursp.attendance.modules.punch.exception.MethodNotAllowedException;
import com.yoursp.attendance.modules.temporary.TemporaryWorkplaceService;
import com.yoursp.attendance.modules.temporary.dto.TemporaryPunchRequest;
import com.yoursp.attendance.modules.temporary.dto.TemporaryPunchResult;
import com.yoursp.attendance.modules.verification.VerificationSessionService;
import com.yoursp.attendance.modules.verification.dto.VerificationProgress;
import com.yoursp.attendance.service.AuditService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for clock-in and clock-out.
 * <ol>
 * <li>Resolve and validate the location fix</li>
 * <li>Classify it against the active zones</li>
 * <li>In-zone: check the method, then accept or open a verification session</li>
 * <li>Out-of-zone: record a temporary workplace punch, or report the mismatch</li>
 * </ol>
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class PunchService {

    private final LocationResolver locationResolver;
    private final GeofenceService geofenceService;
    private final VerificationSessionService verificationSessionService;
    private final TemporaryWorkplaceService temporaryWorkplaceService;
    private final AuditService auditService;
    private final AttendanceProperties properties;

    public PunchResult punch(@Valid PunchRequest request) {
        UUID eventId = request.attendanceEventId() != null ? request.attendanceEventId() : UUID.randomUUID();
        LocationFix fix = locationResolver.resolve(request.userId(), request.fix());
        ZoneMatch match = geofenceService.classify(fix);

        log.info("Punch {}: userId={}, eventId={}, zone={}, distance={}m, within={}",
                request.type(), request.userId(), eventId,
                match.zone() != null ? match.zone().getId() : null,
                Math.round(match.distanceMeters()), match.withinZone());

        return match.withinZone()
                ? inZone(request, eventId, match)
                : outOfZone(request, eventId, fix, match);
    }

    private PunchResult inZone(PunchRequest request, UUID eventId, ZoneMatch match) {
        GeofenceZone zone = match.zone();
        PunchMethod method = request.method() != null ? request.method() : PunchMethod.GEOLOCATION;
        if (!zone.getAllowedMethods().isEmpty() && !zone.getAllowedMethods().contains(method)) {
            throw new MethodNotAllowedException("Punch method " + method + " is not allowed in zone '"
                    + zone.getName() + "'");
        }

        if (properties.getVerification().isRequired() || method == PunchMethod.FACIAL) {
            VerificationSession session = verificationSessionService.startSession(
                    request.userId(), eventId, request.type());
            return PunchResult.builder()
                    .accepted(false)
                    .outcome(PunchOutcome.VERIFICATION_REQUIRED)
                    .attendanceEventId(eventId)
                    .sessionId(session.getId())
                    .zoneId(zone.getId())
                    .distanceMeters(match.distanceMeters())
                    .remainingAttempts(session.getMaxAttempts())
                    .build();
        }

        auditService.log(request.userId(), "PUNCH_ACCEPTED", "GeofenceZone", String.valueOf(zone.getId()),
                Map.of("type", request.type().name(), "method", method.name(),
                        "attendanceEventId", eventId.toString()));
        return PunchResult.builder()
                .accepted(true)
                .outcome(PunchOutcome.ACCEPTED)
                .attendanceEventId(eventId)
                .zoneId(zone.getId())
                .distanceMeters(match.distanceMeters())
                .build();
    }

    private PunchResult outOfZone(PunchRequest request, UUID eventId, LocationFix fix, ZoneMatch match) {
        Long nearestZoneId = match.zone() != null ? match.zone().getId() : null;
        Double distance = match.zone() != null ? match.distanceMeters() : null;

        PunchRequest.TemporaryDetails details = request.temporary();
        if (details == null) {
            log.info("Punch outside every zone without temporary details: userId={}", request.userId());
            return PunchResult.builder()
                    .accepted(false)
                    .outcome(PunchOutcome.ZONE_MISMATCH)
                    .attendanceEventId(eventId)
                    .zoneId(nearestZoneId)
                    .distanceMeters(distance)
                    .build();
        }

        TemporaryPunchResult result = temporaryWorkplaceService.submitPunch(TemporaryPunchRequest.builder()
                .userId(request.userId())
                .managerId(request.managerId())
                .type(request.type())
                .fix(fix)
                .reason(details.reason())
                .photoRef(details.photoRef())
                .notes(details.notes())
                .saveAsReusable(details.saveAsReusable())
                .reusableName(details.reusableName())
                .reusableLocationId(details.reusableLocationId())
                .nearestZoneDistanceMeters(distance)
                .build());

        boolean selfApproved = !result.pendingApproval();
        return PunchResult.builder()
                .accepted(selfApproved)
                .outcome(selfApproved ? PunchOutcome.ACCEPTED : PunchOutcome.PENDING_APPROVAL)
                .attendanceEventId(eventId)
                .recordId(result.record().getId())
                .pendingApprovalId(result.approvalRequestId())
                .zoneId(nearestZoneId)
                .distanceMeters(distance)
                .build();
    }

    /**
     * Forward a captured sample to the open session of a punch.
     *
     * @param timeout provider wait, null for the configured default
     */
    public PunchResult submitVerificationSample(UUID sessionId, String sampleRef, LocationFix fix, Duration timeout) {
        VerificationProgress progress = verificationSessionService.submitSample(sessionId, sampleRef, fix, timeout);
        VerificationSession session = verificationSessionService.getSession(sessionId);

        PunchOutcome outcome;
        if (progress.state() == SessionState.COMPLETED) {
            outcome = PunchOutcome.ACCEPTED;
        } else if (progress.state() == SessionState.FAILED) {
            outcome = PunchOutcome.VERIFICATION_FAILED;
        } else {
            outcome = PunchOutcome.VERIFICATION_RETRY;
        }

        return PunchResult.builder()
                .accepted(outcome == PunchOutcome.ACCEPTED)
                .outcome(outcome)
                .attendanceEventId(session.getAttendanceEventId())
                .sessionId(sessionId)
                .remainingAttempts(progress.remainingAttempts())
                .reRegistrationRequired(progress.reRegistrationRequired())
                .build();
    }
}
