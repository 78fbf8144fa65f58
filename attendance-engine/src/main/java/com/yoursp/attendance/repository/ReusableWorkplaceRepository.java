package com.yoursp.attendance.repository;

import com.yoursp.attendance.model.entity.ReusableWorkplace;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReusableWorkplaceRepository extends JpaRepository<ReusableWorkplace, UUID> {

    Optional<ReusableWorkplace> findByIdAndUserId(UUID id, UUID userId);

    Optional<ReusableWorkplace> findByUserIdAndNameKey(UUID userId, String nameKey);

    List<ReusableWorkplace> findByUserIdAndActiveTrueOrderByLastUsedAtDesc(UUID userId);
}
