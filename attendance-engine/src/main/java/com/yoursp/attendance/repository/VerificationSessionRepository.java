package com.yoursp.attendance.repository;

import com.yoursp.attendance.model.SessionState;
import com.yoursp.attendance.model.entity.VerificationSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VerificationSessionRepository extends JpaRepository<VerificationSession, UUID> {

    Optional<VerificationSession> findFirstByUserIdAndAttendanceEventIdAndStateIn(
            UUID userId, UUID attendanceEventId, Collection<SessionState> states);
}
