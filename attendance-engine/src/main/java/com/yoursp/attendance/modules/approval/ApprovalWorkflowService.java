package com.yoursp.attendance.modules.approval;

import com.yoursp.attendance.exception.AttendanceException;
import com.yoursp.attendance.model.ApprovalStatus;
import com.yoursp.attendance.model.entity.ApprovalRequest;
import com.yoursp.attendance.modules.approval.dto.ApprovalFilter;
import com.yoursp.attendance.modules.approval.dto.ApprovalStatistics;
import com.yoursp.attendance.modules.approval.dto.BulkDecisionResult;
import com.yoursp.attendance.modules.approval.exception.AlreadyDecidedException;
import com.yoursp.attendance.modules.approval.exception.ApprovalNotFoundException;
import com.yoursp.attendance.repository.ApprovalRequestRepository;
import com.yoursp.attendance.service.AuditService;
import com.yoursp.attendance.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Manager decision queue for attendance exceptions.
 * <ul>
 * <li>Enqueue is idempotent on the request id</li>
 * <li>A decision is a compare-and-set from PENDING, so a request is decided at most once</li>
 * <li>Bulk decisions are independent per id; one failure never undoes another id</li>
 * </ul>
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalWorkflowService {

    private final ApprovalRequestRepository approvalRepository;
    private final NotificationService notificationService;
    private final AuditService auditService;

    // ================================================================
    // Enqueue
    // ================================================================

    /**
     * Queue a request for decision. Submitting the same id again returns the
     * stored request unchanged.
     */
    public ApprovalRequest enqueue(ApprovalRequest request) {
        if (request.getId() == null) {
            throw new IllegalArgumentException("Approval request id must be assigned by the caller");
        }

        ApprovalRequest existing = approvalRepository.findById(request.getId()).orElse(null);
        if (existing != null) {
            log.debug("Approval request {} already queued, ignoring resubmission", request.getId());
            return existing;
        }

        request.setStatus(ApprovalStatus.PENDING);
        request.setDecidedAt(null);
        request.setDecisionNote(null);

        ApprovalRequest saved;
        try {
            saved = approvalRepository.saveAndFlush(request);
        } catch (DataIntegrityViolationException e) {
            // Lost the insert race to an identical submission
            log.debug("Approval request {} inserted concurrently", request.getId());
            return approvalRepository.findById(request.getId()).orElseThrow(() -> e);
        }

        auditService.log(saved.getUserId(), "APPROVAL_REQUESTED", "ApprovalRequest",
                saved.getId().toString(),
                Map.of("type", saved.getType().name(),
                        "sourceEventId", String.valueOf(saved.getSourceEventId())));
        notificationService.approvalRequested(saved);

        log.info("Approval request queued: id={}, type={}, userId={}, managerId={}",
                saved.getId(), saved.getType(), saved.getUserId(), saved.getManagerId());
        return saved;
    }

    // ================================================================
    // Decide
    // ================================================================

    public ApprovalRequest decide(UUID requestId, boolean approve) {
        return decide(requestId, approve, null);
    }

    /**
     * Move a pending request to APPROVED or REJECTED.
     *
     * @throws ApprovalNotFoundException if no request has this id
     * @throws AlreadyDecidedException   if the request left PENDING earlier
     */
    public ApprovalRequest decide(UUID requestId, boolean approve, String note) {
        if (requestId == null) {
            throw new ApprovalNotFoundException(null);
        }
        ApprovalStatus decision = approve ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED;

        int updated = approvalRepository.decide(requestId, ApprovalStatus.PENDING, decision,
                OffsetDateTime.now(), note);
        if (updated == 0) {
            if (approvalRepository.existsById(requestId)) {
                log.warn("Approval request {} already decided", requestId);
                throw new AlreadyDecidedException(requestId);
            }
            throw new ApprovalNotFoundException(requestId);
        }

        ApprovalRequest decided = approvalRepository.findById(requestId)
                .orElseThrow(() -> new ApprovalNotFoundException(requestId));

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("decision", decision.name());
        metadata.put("type", decided.getType().name());
        if (note != null)
            metadata.put("note", note);
        auditService.log(decided.getManagerId(), "APPROVAL_DECIDED", "ApprovalRequest",
                requestId.toString(), metadata);
        notificationService.approvalDecided(decided);

        log.info("Approval request decided: id={}, decision={}", requestId, decision);
        return decided;
    }

    /**
     * Decide every id in caller order. Failures are reported per id with the
     * error code of the exception that stopped it.
     */
    public BulkDecisionResult bulkDecide(List<UUID> requestIds, boolean approve) {
        List<UUID> succeeded = new ArrayList<>();
        List<BulkDecisionResult.Failure> failed = new ArrayList<>();

        for (UUID id : requestIds) {
            try {
                decide(id, approve, null);
                succeeded.add(id);
            } catch (AttendanceException e) {
                failed.add(new BulkDecisionResult.Failure(id, e.getErrorCode()));
            }
        }

        log.info("Bulk decision: requested={}, succeeded={}, failed={}",
                requestIds.size(), succeeded.size(), failed.size());
        return new BulkDecisionResult(succeeded, failed);
    }

    // ================================================================
    // Queries
    // ================================================================

    /**
     * Pending requests matching the filter, oldest first.
     */
    public List<ApprovalRequest> findPending(ApprovalFilter filter) {
        List<ApprovalRequest> pending = filter.managerId() != null
                ? approvalRepository.findByManagerIdAndStatusOrderByRequestedAtAsc(filter.managerId(),
                        ApprovalStatus.PENDING)
                : approvalRepository.findByStatusOrderByRequestedAtAsc(ApprovalStatus.PENDING);

        return pending.stream()
                .filter(r -> filter.type() == null || r.getType() == filter.type())
                .filter(r -> filter.userId() == null || filter.userId().equals(r.getUserId()))
                .filter(r -> filter.requestedFrom() == null || !r.getRequestedAt().isBefore(filter.requestedFrom()))
                .filter(r -> filter.requestedTo() == null || !r.getRequestedAt().isAfter(filter.requestedTo()))
                .toList();
    }

    /**
     * @param managerId restrict to one manager's queue, or null for all requests
     */
    public ApprovalStatistics statistics(UUID managerId) {
        List<ApprovalRequest> requests = managerId != null
                ? approvalRepository.findByManagerId(managerId)
                : approvalRepository.findAll();

        long pending = 0;
        long approved = 0;
        long rejected = 0;
        long responseMillisTotal = 0;
        long timed = 0;

        for (ApprovalRequest r : requests) {
            switch (r.getStatus()) {
                case PENDING -> pending++;
                case APPROVED -> approved++;
                case REJECTED -> rejected++;
            }
            if (r.getStatus() != ApprovalStatus.PENDING && r.getRequestedAt() != null && r.getDecidedAt() != null) {
                responseMillisTotal += Duration.between(r.getRequestedAt(), r.getDecidedAt()).toMillis();
                timed++;
            }
        }

        long decided = approved + rejected;
        double approvalRate = decided > 0 ? approved * 100.0 / decided : 0.0;
        double averageResponse = timed > 0 ? responseMillisTotal / 60_000.0 / timed : 0.0;

        return new ApprovalStatistics(requests.size(), pending, approved, rejected, approvalRate, averageResponse);
    }
}
