package com.yoursp.attendance.modules.verification;

import com.yoursp.attendance.config.AttendanceProperties;
import com.yoursp.attendance.model.ApprovalType;
import com.yoursp.attendance.model.PunchType;
import com.yoursp.attendance.model.SessionState;
import com.yoursp.attendance.model.entity.ApprovalRequest;
import com.yoursp.attendance.model.entity.LocationFix;
import com.yoursp.attendance.model.entity.VerificationAttempt;
import com.yoursp.attendance.model.entity.VerificationSession;
import com.yoursp.attendance.modules.approval.ApprovalWorkflowService;
import com.yoursp.attendance.modules.verification.dto.VerificationOutcome;
import com.yoursp.attendance.modules.verification.dto.VerificationProgress;
import com.yoursp.attendance.modules.verification.exception.InvalidSessionStateException;
import com.yoursp.attendance.modules.verification.exception.MaxAttemptsExceededException;
import com.yoursp.attendance.modules.verification.exception.ProviderUnavailableException;
import com.yoursp.attendance.modules.verification.exception.SessionConflictException;
import com.yoursp.attendance.modules.verification.exception.SessionNotFoundException;
import com.yoursp.attendance.repository.VerificationSessionRepository;
import com.yoursp.attendance.service.AuditService;
import com.yoursp.attendance.service.NotificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the bounded identity-verification protocol for a clock event.
 * <p>
 * Methods are not transactional. Session creation commits before the creation
 * lock is released, and a sample submission commits VERIFYING before the
 * provider is called, so a concurrent submission on the same session fails its
 * version check.
 * </p>
 */
@SuppressWarnings("null")
@Slf4j
@Service
public class VerificationSessionService {

    static final Set<SessionState> OPEN_STATES = EnumSet.of(
            SessionState.PENDING, SessionState.CAPTURING, SessionState.VERIFYING);

    private final VerificationSessionRepository sessionRepository;
    private final VerificationProvider verificationProvider;
    private final SessionCreationLock creationLock;
    private final ApprovalWorkflowService approvalWorkflowService;
    private final NotificationService notificationService;
    private final AuditService auditService;
    private final AttendanceProperties properties;
    private final Executor verificationExecutor;

    public VerificationSessionService(VerificationSessionRepository sessionRepository,
            VerificationProvider verificationProvider,
            SessionCreationLock creationLock,
            ApprovalWorkflowService approvalWorkflowService,
            NotificationService notificationService,
            AuditService auditService,
            AttendanceProperties properties,
            @Qualifier("verificationExecutor") Executor verificationExecutor) {
        this.sessionRepository = sessionRepository;
        this.verificationProvider = verificationProvider;
        this.creationLock = creationLock;
        this.approvalWorkflowService = approvalWorkflowService;
        this.notificationService = notificationService;
        this.auditService = auditService;
        this.properties = properties;
        this.verificationExecutor = verificationExecutor;
    }

    // ================================================================
    // Start
    // ================================================================

    /**
     * Open a session for one clock event.
     *
     * @throws SessionConflictException if a session for the same user and event
     *                                  is open or being created right now
     */
    public VerificationSession startSession(UUID userId, UUID attendanceEventId, PunchType sessionType) {
        String token = creationLock.tryAcquire(userId, attendanceEventId)
                .orElseThrow(() -> new SessionConflictException(
                        "A verification session for this clock event is already being created"));
        try {
            Optional<VerificationSession> open = findOpenSession(userId, attendanceEventId);
            if (open.isPresent()) {
                throw new SessionConflictException("Verification session " + open.get().getId()
                        + " is already open for this clock event");
            }

            int maxAttempts = properties.getVerification().getMaxAttempts();
            SessionSnapshot started = VerificationStateMachine.transition(
                    new SessionSnapshot(SessionState.PENDING, 0, maxAttempts), VerificationEvent.START);

            VerificationSession session = VerificationSession.builder()
                    .userId(userId)
                    .attendanceEventId(attendanceEventId)
                    .sessionType(sessionType)
                    .state(started.state())
                    .maxAttempts(maxAttempts)
                    .totalAttempts(0)
                    .build();
            VerificationSession saved = sessionRepository.saveAndFlush(session);

            auditService.log(userId, "VERIFICATION_SESSION_STARTED", "VerificationSession",
                    saved.getId().toString(),
                    Map.of("attendanceEventId", attendanceEventId.toString(),
                            "sessionType", sessionType.name(),
                            "maxAttempts", maxAttempts));
            log.info("Verification session started: sessionId={}, userId={}, type={}",
                    saved.getId(), userId, sessionType);
            return saved;
        } finally {
            creationLock.release(userId, attendanceEventId, token);
        }
    }

    // ================================================================
    // Submit
    // ================================================================

    public VerificationProgress submitSample(UUID sessionId, String sampleRef, LocationFix fix) {
        return submitSample(sessionId, sampleRef, fix, null);
    }

    /**
     * Verify one captured sample.
     *
     * @param timeout how long to wait for the provider; null uses the configured default
     * @throws ProviderUnavailableException  on provider timeout or failure; no attempt is counted
     * @throws MaxAttemptsExceededException  if the session already failed
     * @throws InvalidSessionStateException  if the session completed or was cancelled
     * @throws SessionConflictException      if another sample is being verified
     */
    public VerificationProgress submitSample(UUID sessionId, String sampleRef, LocationFix fix, Duration timeout) {
        VerificationSession session = getSession(sessionId);

        switch (session.getState()) {
            case FAILED -> throw new MaxAttemptsExceededException(sessionId, session.getMaxAttempts());
            case VERIFYING -> throw new SessionConflictException(
                    "A sample is already being verified for session " + sessionId);
            default -> {
                // remaining states are checked by the state machine
            }
        }

        SessionSnapshot verifying = VerificationStateMachine.transition(
                SessionSnapshot.of(session), VerificationEvent.SUBMIT_SAMPLE);
        session.setState(verifying.state());
        session = saveOrConflict(session);

        try {
            VerificationOutcome outcome = applyConfidenceThreshold(callProvider(session.getUserId(), sampleRef, timeout));
            return recordAttempt(session, verifying, outcome, sampleRef, fix);
        } catch (ProviderUnavailableException e) {
            SessionSnapshot back = VerificationStateMachine.transition(verifying, VerificationEvent.PROVIDER_UNAVAILABLE);
            session.setState(back.state());
            sessionRepository.save(session);
            log.warn("Verification provider unavailable: sessionId={}, reason={}", sessionId, e.getMessage());
            throw e;
        } catch (SessionConflictException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Verification attempt could not be recorded: sessionId={}", sessionId, e);
            releaseVerifying(sessionId, e);
            throw e;
        }
    }

    /**
     * Put a session left in VERIFYING back to CAPTURING from its stored copy.
     * The in-memory entity may already carry an unsaved attempt.
     */
    private void releaseVerifying(UUID sessionId, RuntimeException cause) {
        try {
            sessionRepository.findById(sessionId)
                    .filter(stored -> stored.getState() == SessionState.VERIFYING)
                    .ifPresent(stored -> {
                        SessionSnapshot back = VerificationStateMachine.transition(
                                SessionSnapshot.of(stored), VerificationEvent.PROVIDER_UNAVAILABLE);
                        stored.setState(back.state());
                        sessionRepository.save(stored);
                    });
        } catch (RuntimeException restoreFailure) {
            log.error("Could not release VERIFYING state: sessionId={}", sessionId, restoreFailure);
            cause.addSuppressed(restoreFailure);
        }
    }

    private VerificationOutcome callProvider(UUID userId, String sampleRef, Duration timeout) {
        Duration wait = timeout != null ? timeout : properties.getVerification().getProviderTimeout();
        CompletableFuture<VerificationOutcome> future;
        try {
            future = CompletableFuture.supplyAsync(
                    () -> verificationProvider.verify(userId, sampleRef), verificationExecutor);
        } catch (RejectedExecutionException e) {
            throw new ProviderUnavailableException("Verification executor is saturated", e);
        }
        VerificationOutcome outcome;
        try {
            outcome = future.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderUnavailableException(
                    "Verification provider did not answer within " + wait.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderUnavailableException unavailable) {
                throw unavailable;
            }
            throw new ProviderUnavailableException("Verification provider failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("Interrupted while waiting for the verification provider", e);
        }
        if (outcome == null) {
            throw new ProviderUnavailableException("Verification provider returned no outcome");
        }
        return outcome;
    }

    private VerificationOutcome applyConfidenceThreshold(VerificationOutcome outcome) {
        int min = properties.getVerification().getMinConfidencePercent();
        if (outcome.success() && outcome.confidencePercent() < min) {
            return VerificationOutcome.failure(outcome.confidencePercent(), VerificationOutcome.LOW_CONFIDENCE);
        }
        return outcome;
    }

    private VerificationProgress recordAttempt(VerificationSession session, SessionSnapshot verifying,
            VerificationOutcome outcome, String sampleRef, LocationFix fix) {
        VerificationEvent event = outcome.success()
                ? VerificationEvent.VERIFICATION_SUCCEEDED
                : VerificationEvent.VERIFICATION_FAILED;
        SessionSnapshot next = VerificationStateMachine.transition(verifying, event);
        OffsetDateTime now = OffsetDateTime.now();

        VerificationAttempt attempt = VerificationAttempt.builder()
                .session(session)
                .attemptNumber(next.attemptsUsed())
                .capturedImageRef(sampleRef)
                .success(outcome.success())
                .confidencePercent(outcome.confidencePercent())
                .failureReason(outcome.failureReason())
                .capturedAt(now)
                .locationFix(fix)
                .build();
        session.appendAttempt(attempt);
        session.setState(next.state());
        session.setTotalAttempts(next.attemptsUsed());

        if (next.state() == SessionState.COMPLETED) {
            session.setFinalImageRef(sampleRef);
            session.setCompletedAt(now);
            session.setAverageConfidence(session.getAttempts().stream()
                    .filter(VerificationAttempt::isSuccess)
                    .mapToInt(VerificationAttempt::getConfidencePercent)
                    .average()
                    .orElse(outcome.confidencePercent()));
        } else if (next.state() == SessionState.FAILED) {
            session.setCompletedAt(now);
        }

        VerificationSession saved = saveOrConflict(session);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("attemptNumber", attempt.getAttemptNumber());
        metadata.put("success", outcome.success());
        metadata.put("confidencePercent", outcome.confidencePercent());
        metadata.put("state", next.state().name());
        if (outcome.failureReason() != null)
            metadata.put("failureReason", outcome.failureReason());
        auditService.log(saved.getUserId(), "VERIFICATION_ATTEMPT", "VerificationSession",
                saved.getId().toString(), metadata);

        boolean reRegistrationRequired = next.state() == SessionState.FAILED;
        if (reRegistrationRequired) {
            onSessionFailed(saved);
        }

        log.info("Verification attempt {}/{}: sessionId={}, success={}, confidence={}, state={}",
                attempt.getAttemptNumber(), next.maxAttempts(), saved.getId(), outcome.success(),
                outcome.confidencePercent(), next.state());

        return new VerificationProgress(saved.getId(), next.state(), attempt.getAttemptNumber(),
                next.remainingAttempts(), outcome.confidencePercent(), outcome.failureReason(),
                reRegistrationRequired);
    }

    private void onSessionFailed(VerificationSession session) {
        log.error("Verification session FAILED after {} attempts: sessionId={}, userId={}",
                session.getTotalAttempts(), session.getId(), session.getUserId());
        notificationService.verificationFailed(session);

        if (properties.getVerification().isEscalateToApproval()) {
            approvalWorkflowService.enqueue(ApprovalRequest.builder()
                    .id(escalationRequestId(session.getId()))
                    .sourceEventId(session.getAttendanceEventId())
                    .userId(session.getUserId())
                    .managerId(properties.getApproval().getDefaultManagerId())
                    .type(ApprovalType.VERIFICATION_FAILURE)
                    .reason("Face verification failed after " + session.getTotalAttempts() + " attempts")
                    .build());
        }
    }

    /** Stable per session so a retried escalation collapses onto one request. */
    static UUID escalationRequestId(UUID sessionId) {
        return UUID.nameUUIDFromBytes(("verification-failure:" + sessionId).getBytes(StandardCharsets.UTF_8));
    }

    private VerificationSession saveOrConflict(VerificationSession session) {
        try {
            return sessionRepository.saveAndFlush(session);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new SessionConflictException("Verification session " + session.getId()
                    + " was modified concurrently");
        }
    }

    // ================================================================
    // Cancel / lookup
    // ================================================================

    /**
     * Discard a session. No approval request and no attendance record result
     * from it; counted attempts remain for the audit trail.
     */
    public VerificationSession cancelSession(UUID sessionId) {
        VerificationSession session = getSession(sessionId);
        SessionSnapshot cancelled = VerificationStateMachine.transition(
                SessionSnapshot.of(session), VerificationEvent.CANCEL);

        session.setState(cancelled.state());
        session.setCompletedAt(OffsetDateTime.now());
        VerificationSession saved = saveOrConflict(session);

        auditService.log(saved.getUserId(), "VERIFICATION_SESSION_CANCELLED", "VerificationSession",
                saved.getId().toString(), Map.of("attempts", saved.getAttempts().size()));
        log.info("Verification session cancelled: sessionId={}", sessionId);
        return saved;
    }

    public VerificationSession getSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<VerificationSession> findOpenSession(UUID userId, UUID attendanceEventId) {
        return sessionRepository.findFirstByUserIdAndAttendanceEventIdAndStateIn(
                userId, attendanceEventId, OPEN_STATES);
    }
}
