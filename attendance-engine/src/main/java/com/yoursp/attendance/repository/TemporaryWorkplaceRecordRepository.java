package com.yoursp.attendance.repository;

import com.yoursp.attendance.model.entity.TemporaryWorkplaceRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TemporaryWorkplaceRecordRepository extends JpaRepository<TemporaryWorkplaceRecord, UUID> {

    List<TemporaryWorkplaceRecord> findAllByOrderByCreatedAtDesc();

    List<TemporaryWorkplaceRecord> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
