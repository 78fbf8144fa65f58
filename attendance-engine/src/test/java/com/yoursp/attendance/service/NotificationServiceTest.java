package com.yoursp.attendance.service;

import com.yoursp.attendance.model.ApprovalStatus;
import com.yoursp.attendance.model.ApprovalType;
import com.yoursp.attendance.model.SessionState;
import com.yoursp.attendance.model.entity.ApprovalRequest;
import com.yoursp.attendance.model.entity.VerificationSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private NotificationService notificationService;

    @Test
    @DisplayName("approvalDecided publishes approval.decided with the new status")
    void approvalDecided() {
        ApprovalRequest request = ApprovalRequest.builder()
                .id(UUID.randomUUID())
                .userId(UUID.randomUUID())
                .type(ApprovalType.LATE)
                .status(ApprovalStatus.REJECTED)
                .build();

        notificationService.approvalDecided(request);

        ArgumentCaptor<AttendanceNotificationEvent> captor = ArgumentCaptor.forClass(AttendanceNotificationEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertEquals(AttendanceNotificationEvent.APPROVAL_DECIDED, captor.getValue().eventType());
        assertEquals(request.getId(), captor.getValue().entityId());
        assertEquals("REJECTED", captor.getValue().detail());
    }

    @Test
    @DisplayName("verificationFailed publishes verification.failed for the session")
    void verificationFailed() {
        VerificationSession session = VerificationSession.builder()
                .id(UUID.randomUUID())
                .userId(UUID.randomUUID())
                .state(SessionState.FAILED)
                .build();

        notificationService.verificationFailed(session);

        ArgumentCaptor<AttendanceNotificationEvent> captor = ArgumentCaptor.forClass(AttendanceNotificationEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertEquals(AttendanceNotificationEvent.VERIFICATION_FAILED, captor.getValue().eventType());
        assertEquals(session.getUserId(), captor.getValue().userId());
    }
}
