package com.yoursp.attendance.modules.temporary;

import com.yoursp.attendance.config.AttendanceProperties;
import com.yoursp.attendance.model.ApprovalType;
import com.yoursp.attendance.model.entity.ApprovalRequest;
import com.yoursp.attendance.model.entity.LocationFix;
import com.yoursp.attendance.model.entity.ReusableWorkplace;
import com.yoursp.attendance.model.entity.TemporaryWorkplaceRecord;
import com.yoursp.attendance.modules.approval.ApprovalWorkflowService;
import com.yoursp.attendance.modules.geofence.exception.LocationFailureReason;
import com.yoursp.attendance.modules.geofence.exception.LocationUnavailableException;
import com.yoursp.attendance.modules.geofence.exception.ZoneMismatchException;
import com.yoursp.attendance.modules.temporary.dto.RecordFilter;
import com.yoursp.attendance.modules.temporary.dto.TemporaryPunchRequest;
import com.yoursp.attendance.modules.temporary.dto.TemporaryPunchResult;
import com.yoursp.attendance.modules.temporary.exception.DuplicateReusableWorkplaceException;
import com.yoursp.attendance.modules.temporary.exception.MissingPhotoException;
import com.yoursp.attendance.modules.temporary.exception.MissingReasonException;
import com.yoursp.attendance.modules.temporary.exception.ReusableWorkplaceNotFoundException;
import com.yoursp.attendance.modules.temporary.exception.TemporaryWorkplaceOutOfRangeException;
import com.yoursp.attendance.repository.ReusableWorkplaceRepository;
import com.yoursp.attendance.repository.TemporaryWorkplaceRecordRepository;
import com.yoursp.attendance.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Captures punches from unregistered locations.
 * <p>
 * Every policy check runs before the first write, so a rejected punch leaves
 * nothing behind. The record, the reusable workplace change and the approval
 * request are written in one transaction.
 * </p>
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class TemporaryWorkplaceService {

    private final TemporaryWorkplaceRecordRepository recordRepository;
    private final ReusableWorkplaceRepository reusableRepository;
    private final ApprovalWorkflowService approvalWorkflowService;
    private final AuditService auditService;
    private final AttendanceProperties properties;

    // ================================================================
    // Submit
    // ================================================================

    @Transactional
    public TemporaryPunchResult submitPunch(TemporaryPunchRequest request) {
        AttendanceProperties.TemporaryWorkplace policy = properties.getTemporaryWorkplace();

        // --- validation, no writes ---
        checkEligible(request.userId(), policy);

        if (policy.isRequireLocation() && request.fix() == null && request.reusableLocationId() == null) {
            throw new LocationUnavailableException(LocationFailureReason.UNAVAILABLE,
                    "A location fix is required for temporary workplace punches");
        }
        if (policy.isRequireReason() && isBlank(request.reason())) {
            throw new MissingReasonException();
        }
        if (policy.isRequirePhoto() && isBlank(request.photoRef())) {
            throw new MissingPhotoException();
        }

        Double maxDistance = policy.getMaxDistanceFromWorkplaceMeters();
        Double nearest = request.nearestZoneDistanceMeters();
        if (maxDistance != null && nearest != null && nearest > maxDistance) {
            throw new TemporaryWorkplaceOutOfRangeException(nearest, maxDistance);
        }

        ReusableWorkplace selected = null;
        ReusableWorkplace revived = null;
        if (request.reusableLocationId() != null) {
            selected = reusableRepository.findByIdAndUserId(request.reusableLocationId(), request.userId())
                    .filter(ReusableWorkplace::isActive)
                    .orElseThrow(() -> new ReusableWorkplaceNotFoundException(request.reusableLocationId()));
        } else if (request.saveAsReusable()) {
            if (isBlank(request.reusableName())) {
                throw new IllegalArgumentException("A name is required to save a reusable workplace");
            }
            Optional<ReusableWorkplace> existing = reusableRepository.findByUserIdAndNameKey(
                    request.userId(), ReusableWorkplace.nameKey(request.reusableName()));
            if (existing.isPresent() && existing.get().isActive()) {
                throw new DuplicateReusableWorkplaceException(request.reusableName().trim());
            }
            // a deactivated workplace under the same name is brought back
            revived = existing.orElse(null);
        }

        // --- writes ---
        OffsetDateTime now = OffsetDateTime.now();
        LocationFix fix = request.fix() != null ? request.fix() : (selected != null ? selected.getLocationFix() : null);

        UUID reusableId = null;
        if (selected != null) {
            selected.recordUsage(now);
            reusableId = reusableRepository.save(selected).getId();
        } else if (revived != null) {
            revived.setName(request.reusableName().trim());
            revived.setLocationFix(fix);
            revived.setReason(request.reason());
            revived.setActive(true);
            revived.recordUsage(now);
            reusableId = reusableRepository.save(revived).getId();
            log.info("Reusable workplace reactivated: id={}, userId={}, name={}", reusableId, request.userId(),
                    revived.getName());
        } else if (request.saveAsReusable()) {
            ReusableWorkplace created = reusableRepository.save(ReusableWorkplace.builder()
                    .userId(request.userId())
                    .name(request.reusableName().trim())
                    .nameKey(ReusableWorkplace.nameKey(request.reusableName()))
                    .locationFix(fix)
                    .reason(request.reason())
                    .active(true)
                    .usageCount(1)
                    .lastUsedAt(now)
                    .createdAt(now)
                    .build());
            reusableId = created.getId();
            log.info("Reusable workplace saved: id={}, userId={}, name={}", reusableId, request.userId(),
                    created.getName());
        }

        boolean approvalRequired = policy.isRequireApproval();
        UUID approvalRequestId = approvalRequired ? UUID.randomUUID() : null;

        TemporaryWorkplaceRecord record = recordRepository.save(TemporaryWorkplaceRecord.builder()
                .userId(request.userId())
                .date(now.toLocalDate())
                .type(request.type())
                .time(now.toLocalTime().truncatedTo(ChronoUnit.SECONDS))
                .locationFix(fix)
                .reason(request.reason())
                .photoRef(request.photoRef())
                .notes(request.notes())
                .reusable(request.saveAsReusable())
                .reusableLocationId(reusableId)
                .approvalRequestId(approvalRequestId)
                .selfApproved(!approvalRequired)
                .createdAt(now)
                .build());

        if (approvalRequired) {
            UUID managerId = request.managerId() != null
                    ? request.managerId()
                    : properties.getApproval().getDefaultManagerId();
            approvalWorkflowService.enqueue(ApprovalRequest.builder()
                    .id(approvalRequestId)
                    .sourceEventId(record.getId())
                    .userId(request.userId())
                    .managerId(managerId)
                    .type(ApprovalType.TEMPORARY_WORKPLACE)
                    .reason(request.reason())
                    .requestedAt(now)
                    .build());
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("type", request.type().name());
        metadata.put("selfApproved", !approvalRequired);
        if (reusableId != null)
            metadata.put("reusableLocationId", reusableId.toString());
        auditService.log(request.userId(), "TEMPORARY_WORKPLACE_PUNCH", "TemporaryWorkplaceRecord",
                record.getId().toString(), metadata);

        log.info("Temporary workplace punch recorded: recordId={}, userId={}, type={}, approvalRequestId={}",
                record.getId(), request.userId(), request.type(), approvalRequestId);
        return new TemporaryPunchResult(record, approvalRequestId);
    }

    private void checkEligible(UUID userId, AttendanceProperties.TemporaryWorkplace policy) {
        if (!policy.isEnabled()) {
            throw new ZoneMismatchException("Punch is outside every registered zone and temporary workplaces are disabled");
        }
        if (policy.getTargetType() == AttendanceProperties.TargetType.SPECIFIC_EMPLOYEES
                && !policy.getTargetEmployees().contains(userId)) {
            throw new ZoneMismatchException("Punch is outside every registered zone and the user may not "
                    + "use temporary workplaces");
        }
    }

    // ================================================================
    // Reusable workplaces
    // ================================================================

    /** Active saved workplaces, most recently used first. */
    public List<ReusableWorkplace> listReusableWorkplaces(UUID userId) {
        return reusableRepository.findByUserIdAndActiveTrueOrderByLastUsedAtDesc(userId);
    }

    @Transactional
    public ReusableWorkplace deactivateReusableWorkplace(UUID userId, UUID reusableId) {
        ReusableWorkplace workplace = reusableRepository.findByIdAndUserId(reusableId, userId)
                .orElseThrow(() -> new ReusableWorkplaceNotFoundException(reusableId));
        if (!workplace.isActive()) {
            return workplace;
        }
        workplace.setActive(false);
        ReusableWorkplace saved = reusableRepository.save(workplace);

        auditService.log(userId, "REUSABLE_WORKPLACE_DEACTIVATED", "ReusableWorkplace",
                reusableId.toString(), Map.of("name", saved.getName()));
        return saved;
    }

    // ================================================================
    // Records
    // ================================================================

    /** Records matching the filter, newest first. */
    @Transactional(readOnly = true)
    public List<TemporaryWorkplaceRecord> findRecords(RecordFilter filter) {
        List<TemporaryWorkplaceRecord> records = filter.userId() != null
                ? recordRepository.findByUserIdOrderByCreatedAtDesc(filter.userId())
                : recordRepository.findAllByOrderByCreatedAtDesc();

        String search = isBlank(filter.search()) ? null : filter.search().trim().toLowerCase(Locale.ROOT);
        Map<UUID, String> reusableNames = search == null ? Map.of() : reusableNames(records);

        return records.stream()
                .filter(r -> filter.from() == null || !r.getDate().isBefore(filter.from()))
                .filter(r -> filter.to() == null || !r.getDate().isAfter(filter.to()))
                .filter(r -> filter.type() == null || r.getType() == filter.type())
                .filter(r -> search == null
                        || contains(r.getReason(), search)
                        || contains(r.getNotes(), search)
                        || (r.getReusableLocationId() != null
                                && contains(reusableNames.get(r.getReusableLocationId()), search)))
                .toList();
    }

    private Map<UUID, String> reusableNames(List<TemporaryWorkplaceRecord> records) {
        List<UUID> ids = records.stream()
                .map(TemporaryWorkplaceRecord::getReusableLocationId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        if (ids.isEmpty()) {
            return Map.of();
        }
        return reusableRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(ReusableWorkplace::getId, ReusableWorkplace::getName,
                        (a, b) -> a));
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
