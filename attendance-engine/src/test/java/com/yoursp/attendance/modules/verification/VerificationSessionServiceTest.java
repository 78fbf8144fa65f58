package com.yoursp.attendance.modules.verification;

import com.yoursp.attendance.config.AttendanceProperties;
import com.yoursp.attendance.model.ApprovalType;
import com.yoursp.attendance.model.PunchType;
import com.yoursp.attendance.model.SessionState;
import com.yoursp.attendance.model.entity.ApprovalRequest;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class VerificationSessionServiceTest {

    @Mock
    private VerificationSessionRepository sessionRepository;

    @Mock
    private VerificationProvider verificationProvider;

    @Mock
    private SessionCreationLock creationLock;

    @Mock
    private ApprovalWorkflowService approvalWorkflowService;

    @Mock
    private NotificationService notificationService;

    @Mock
    private AuditService auditService;

    private final AttendanceProperties properties = new AttendanceProperties();
    private VerificationSessionService service;

    private final UUID userId = UUID.randomUUID();
    private final UUID eventId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = serviceWith(Runnable::run);
    }

    private VerificationSessionService serviceWith(Executor executor) {
        return new VerificationSessionService(sessionRepository, verificationProvider, creationLock,
                approvalWorkflowService, notificationService, auditService, properties, executor);
    }

    private VerificationSession session(SessionState state, int maxAttempts) {
        return VerificationSession.builder()
                .id(UUID.randomUUID())
                .userId(userId)
                .attendanceEventId(eventId)
                .sessionType(PunchType.CLOCK_IN)
                .state(state)
                .maxAttempts(maxAttempts)
                .build();
    }

    private void stubPersistence(VerificationSession session) {
        when(sessionRepository.findById(session.getId())).thenReturn(Optional.of(session));
        when(sessionRepository.saveAndFlush(any(VerificationSession.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    // ================================================================
    // startSession
    // ================================================================

    @Test
    @DisplayName("startSession creates a CAPTURING session and releases the lock")
    void startSessionCreates() {
        when(creationLock.tryAcquire(userId, eventId)).thenReturn(Optional.of("token"));
        when(sessionRepository.findFirstByUserIdAndAttendanceEventIdAndStateIn(eq(userId), eq(eventId), anyCollection()))
                .thenReturn(Optional.empty());
        when(sessionRepository.saveAndFlush(any(VerificationSession.class))).thenAnswer(inv -> {
            VerificationSession s = inv.getArgument(0);
            s.setId(UUID.randomUUID());
            return s;
        });

        VerificationSession session = service.startSession(userId, eventId, PunchType.CLOCK_IN);

        assertEquals(SessionState.CAPTURING, session.getState());
        assertEquals(3, session.getMaxAttempts());
        assertTrue(session.getAttempts().isEmpty());
        verify(creationLock).release(userId, eventId, "token");
    }

    @Test
    @DisplayName("Concurrent creation for the same key is refused without touching the database")
    void startSessionLockBusy() {
        when(creationLock.tryAcquire(userId, eventId)).thenReturn(Optional.empty());

        SessionConflictException ex = assertThrows(SessionConflictException.class,
                () -> service.startSession(userId, eventId, PunchType.CLOCK_IN));

        assertEquals("SESSION_CONFLICT", ex.getErrorCode());
        verifyNoInteractions(sessionRepository);
        verify(creationLock, never()).release(any(), any(), any());
    }

    @Test
    @DisplayName("An open session for the key is a conflict; the lock is still released")
    void startSessionAlreadyOpen() {
        when(creationLock.tryAcquire(userId, eventId)).thenReturn(Optional.of("token"));
        when(sessionRepository.findFirstByUserIdAndAttendanceEventIdAndStateIn(eq(userId), eq(eventId), anyCollection()))
                .thenReturn(Optional.of(session(SessionState.CAPTURING, 3)));

        assertThrows(SessionConflictException.class,
                () -> service.startSession(userId, eventId, PunchType.CLOCK_IN));

        verify(sessionRepository, never()).saveAndFlush(any());
        verify(creationLock).release(userId, eventId, "token");
    }

    // ================================================================
    // submitSample
    // ================================================================

    @Test
    @DisplayName("maxAttempts=3 with three failures → FAILED with exactly 3 attempts")
    void threeFailuresFailSession() {
        VerificationSession session = session(SessionState.CAPTURING, 3);
        stubPersistence(session);
        when(verificationProvider.verify(userId, "sample")).thenReturn(VerificationOutcome.failure(30, "NO_MATCH"));

        VerificationProgress first = service.submitSample(session.getId(), "sample", null);
        VerificationProgress second = service.submitSample(session.getId(), "sample", null);
        VerificationProgress third = service.submitSample(session.getId(), "sample", null);

        assertEquals(SessionState.CAPTURING, first.state());
        assertEquals(2, first.remainingAttempts());
        assertEquals(SessionState.CAPTURING, second.state());
        assertEquals(SessionState.FAILED, third.state());
        assertTrue(third.reRegistrationRequired());
        assertEquals(3, session.getAttempts().size());
        assertEquals(3, session.getTotalAttempts());
        assertNotNull(session.getCompletedAt());
        verify(notificationService).verificationFailed(session);
        verifyNoInteractions(approvalWorkflowService);

        assertThrows(MaxAttemptsExceededException.class,
                () -> service.submitSample(session.getId(), "sample", null));
        assertEquals(3, session.getAttempts().size());
    }

    @Test
    @DisplayName("Success completes the session with image, count and average confidence")
    void successCompletes() {
        VerificationSession session = session(SessionState.CAPTURING, 3);
        stubPersistence(session);
        when(verificationProvider.verify(userId, "s1")).thenReturn(VerificationOutcome.failure(20, "NO_MATCH"));
        when(verificationProvider.verify(userId, "s2")).thenReturn(VerificationOutcome.success(90));

        service.submitSample(session.getId(), "s1", null);
        VerificationProgress progress = service.submitSample(session.getId(), "s2", null);

        assertEquals(SessionState.COMPLETED, progress.state());
        assertEquals(2, progress.attemptNumber());
        assertEquals("s2", session.getFinalImageRef());
        assertEquals(2, session.getTotalAttempts());
        assertEquals(90.0, session.getAverageConfidence());
        assertEquals(1, session.getAttempts().get(0).getAttemptNumber());
        assertEquals(2, session.getAttempts().get(1).getAttemptNumber());
    }

    @Test
    @DisplayName("Provider timeout does not consume an attempt")
    void timeoutDoesNotConsumeAttempt() {
        VerificationSession session = session(SessionState.CAPTURING, 3);
        stubPersistence(session);
        Executor neverRuns = task -> {
        };
        VerificationSessionService slowService = serviceWith(neverRuns);

        ProviderUnavailableException ex = assertThrows(ProviderUnavailableException.class,
                () -> slowService.submitSample(session.getId(), "sample", null, Duration.ofMillis(50)));

        assertEquals("PROVIDER_UNAVAILABLE", ex.getErrorCode());
        assertEquals(SessionState.CAPTURING, session.getState());
        assertTrue(session.getAttempts().isEmpty());
        verify(sessionRepository).save(session);
    }

    @Test
    @DisplayName("Provider failure is surfaced as PROVIDER_UNAVAILABLE and leaves the session capturing")
    void providerFailureDoesNotConsumeAttempt() {
        VerificationSession session = session(SessionState.CAPTURING, 3);
        stubPersistence(session);
        when(verificationProvider.verify(any(), any())).thenThrow(new ProviderUnavailableException("down"));

        assertThrows(ProviderUnavailableException.class,
                () -> service.submitSample(session.getId(), "sample", null));

        assertEquals(SessionState.CAPTURING, session.getState());
        assertEquals(0, session.getTotalAttempts());
    }

    @Test
    @DisplayName("A provider answering with no outcome leaves the session open for a retry")
    void nullOutcomeDoesNotStrandSession() {
        VerificationSession session = session(SessionState.CAPTURING, 3);
        stubPersistence(session);
        when(verificationProvider.verify(userId, "sample"))
                .thenReturn(null)
                .thenReturn(VerificationOutcome.success(95));

        assertThrows(ProviderUnavailableException.class,
                () -> service.submitSample(session.getId(), "sample", null));
        assertEquals(SessionState.CAPTURING, session.getState());
        assertTrue(session.getAttempts().isEmpty());

        VerificationProgress retry = service.submitSample(session.getId(), "sample", null);

        assertEquals(SessionState.COMPLETED, retry.state());
        assertEquals(1, retry.attemptNumber());
    }

    @Test
    @DisplayName("A storage failure while recording the attempt puts the stored session back to CAPTURING")
    void recordFailureReleasesVerifying() {
        VerificationSession session = session(SessionState.CAPTURING, 3);
        VerificationSession stored = session(SessionState.VERIFYING, 3);
        stored.setId(session.getId());
        when(sessionRepository.findById(session.getId()))
                .thenReturn(Optional.of(session))
                .thenReturn(Optional.of(stored));
        when(sessionRepository.saveAndFlush(any(VerificationSession.class)))
                .thenAnswer(inv -> inv.getArgument(0))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));
        when(verificationProvider.verify(any(), any())).thenReturn(VerificationOutcome.failure(30, "NO_MATCH"));

        assertThrows(DataAccessResourceFailureException.class,
                () -> service.submitSample(session.getId(), "sample", null));

        assertEquals(SessionState.CAPTURING, stored.getState());
        assertTrue(stored.getAttempts().isEmpty());
        verify(sessionRepository).save(stored);
        verifyNoInteractions(auditService);
    }

    @Test
    @DisplayName("A success below the confidence threshold counts as LOW_CONFIDENCE failure")
    void lowConfidenceCountsAsFailure() {
        properties.getVerification().setMinConfidencePercent(80);
        VerificationSession session = session(SessionState.CAPTURING, 3);
        stubPersistence(session);
        when(verificationProvider.verify(any(), any())).thenReturn(VerificationOutcome.success(60));

        VerificationProgress progress = service.submitSample(session.getId(), "sample", null);

        assertEquals(SessionState.CAPTURING, progress.state());
        assertEquals(VerificationOutcome.LOW_CONFIDENCE, progress.failureReason());
        assertFalse(session.getAttempts().get(0).isSuccess());
    }

    @Test
    @DisplayName("Terminal failure escalates to a VERIFICATION_FAILURE approval when enabled")
    void failureEscalatesWhenEnabled() {
        properties.getVerification().setEscalateToApproval(true);
        VerificationSession session = session(SessionState.CAPTURING, 1);
        stubPersistence(session);
        when(verificationProvider.verify(any(), any())).thenReturn(VerificationOutcome.failure(10, "NO_FACE"));

        service.submitSample(session.getId(), "sample", null);

        ArgumentCaptor<ApprovalRequest> captor = ArgumentCaptor.forClass(ApprovalRequest.class);
        verify(approvalWorkflowService).enqueue(captor.capture());
        assertEquals(ApprovalType.VERIFICATION_FAILURE, captor.getValue().getType());
        assertEquals(VerificationSessionService.escalationRequestId(session.getId()), captor.getValue().getId());
        assertEquals(userId, captor.getValue().getUserId());
    }

    @Test
    @DisplayName("Submitting to a completed session is an invalid state")
    void submitToCompletedRejected() {
        VerificationSession session = session(SessionState.COMPLETED, 3);
        when(sessionRepository.findById(session.getId())).thenReturn(Optional.of(session));

        assertThrows(InvalidSessionStateException.class,
                () -> service.submitSample(session.getId(), "sample", null));
        verifyNoInteractions(verificationProvider);
    }

    @Test
    @DisplayName("Concurrent submission on the same session → SESSION_CONFLICT")
    void concurrentSubmissionConflicts() {
        VerificationSession session = session(SessionState.CAPTURING, 3);
        when(sessionRepository.findById(session.getId())).thenReturn(Optional.of(session));
        when(sessionRepository.saveAndFlush(any(VerificationSession.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(VerificationSession.class, session.getId()));

        assertThrows(SessionConflictException.class,
                () -> service.submitSample(session.getId(), "sample", null));
        verifyNoInteractions(verificationProvider);
    }

    @Test
    @DisplayName("Unknown session → SESSION_NOT_FOUND")
    void unknownSession() {
        UUID id = UUID.randomUUID();
        when(sessionRepository.findById(id)).thenReturn(Optional.empty());

        assertThrows(SessionNotFoundException.class, () -> service.submitSample(id, "sample", null));
    }

    // ================================================================
    // cancelSession
    // ================================================================

    @Test
    @DisplayName("Cancellation discards the session without creating an approval")
    void cancelCreatesNoApproval() {
        VerificationSession session = session(SessionState.CAPTURING, 3);
        stubPersistence(session);

        VerificationSession cancelled = service.cancelSession(session.getId());

        assertEquals(SessionState.CANCELLED, cancelled.getState());
        assertNotNull(cancelled.getCompletedAt());
        verifyNoInteractions(approvalWorkflowService, notificationService, verificationProvider);
    }

    @Test
    @DisplayName("A finished session cannot be cancelled")
    void cancelTerminalRejected() {
        VerificationSession session = session(SessionState.FAILED, 3);
        when(sessionRepository.findById(session.getId())).thenReturn(Optional.of(session));

        assertThrows(InvalidSessionStateException.class, () -> service.cancelSession(session.getId()));
    }
}
