package com.yoursp.attendance.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.attendance.model.entity.AuditLog;
import com.yoursp.attendance.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Records audit trail entries for every state change of the engine: session
 * transitions, counted attempts, temporary punches and approval decisions.
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Record an audit log entry.
     *
     * @param userId     the user the action concerns (nullable for system actions)
     * @param action     short action descriptor, e.g. "VERIFICATION_ATTEMPT"
     * @param entityType the type of entity affected, e.g. "VerificationSession"
     * @param entityId   the ID of the affected entity
     * @param metadata   arbitrary key-value metadata, serialized as JSON
     */
    public void log(UUID userId, String action, String entityType, String entityId,
            Map<String, Object> metadata) {
        AuditLog.AuditLogBuilder entry = AuditLog.builder()
                .userId(userId)
                .action(action)
                .entityType(entityType)
                .entityId(entityId);
        try {
            entry.metadata(metadata != null ? objectMapper.writeValueAsString(metadata) : null);
        } catch (JsonProcessingException e) {
            // Keep the entry without metadata rather than losing it
            log.error("Failed to serialize audit metadata for action={}: {}", action, e.getMessage());
        }

        auditLogRepository.save(entry.build());
        log.debug("Audit logged: action={}, entity={}:{}, user={}", action, entityType, entityId, userId);
    }
}
