package com.yoursp.attendance.service;

import com.yoursp.attendance.model.entity.ApprovalRequest;
import com.yoursp.attendance.model.entity.VerificationSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;

/**
 * Emits notification events as Spring application events.
 * <p>
 * Delivery (push, email, chat) belongs to listeners outside the engine.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final ApplicationEventPublisher eventPublisher;

    public void approvalRequested(ApprovalRequest request) {
        publish(new AttendanceNotificationEvent(AttendanceNotificationEvent.APPROVAL_REQUESTED,
                request.getId(), request.getUserId(), request.getType().name(), OffsetDateTime.now()));
    }

    public void approvalDecided(ApprovalRequest request) {
        publish(new AttendanceNotificationEvent(AttendanceNotificationEvent.APPROVAL_DECIDED,
                request.getId(), request.getUserId(), request.getStatus().name(), OffsetDateTime.now()));
    }

    public void verificationFailed(VerificationSession session) {
        publish(new AttendanceNotificationEvent(AttendanceNotificationEvent.VERIFICATION_FAILED,
                session.getId(), session.getUserId(), session.getState().name(), OffsetDateTime.now()));
    }

    private void publish(AttendanceNotificationEvent event) {
        log.info("Notification [{}] entityId={}, detail={}", event.eventType(), event.entityId(), event.detail());
        eventPublisher.publishEvent(event);
    }
}
