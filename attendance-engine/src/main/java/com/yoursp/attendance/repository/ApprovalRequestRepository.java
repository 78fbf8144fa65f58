package com.yoursp.attendance.repository;

import com.yoursp.attendance.model.ApprovalStatus;
import com.yoursp.attendance.model.entity.ApprovalRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface ApprovalRequestRepository extends JpaRepository<ApprovalRequest, UUID> {

    /**
     * Compare-and-set of the status. Only one caller can move a request out of
     * {@code expected}; every other concurrent caller sees 0 rows updated.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE ApprovalRequest a SET a.status = :decision, a.decidedAt = :decidedAt, a.decisionNote = :note "
            + "WHERE a.id = :id AND a.status = :expected")
    int decide(UUID id, ApprovalStatus expected, ApprovalStatus decision, OffsetDateTime decidedAt, String note);

    List<ApprovalRequest> findByStatusOrderByRequestedAtAsc(ApprovalStatus status);

    List<ApprovalRequest> findByManagerIdAndStatusOrderByRequestedAtAsc(UUID managerId, ApprovalStatus status);

    List<ApprovalRequest> findByManagerId(UUID managerId);
}
