package com.yoursp.attendance.repository;

import com.yoursp.attendance.model.entity.GeofenceZone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read model of the zone registry. Zones are written by the administrative
 * surface, never by the engine.
 */
@Repository
public interface GeofenceZoneRepository extends JpaRepository<GeofenceZone, Long> {

    /** Active zones in insertion order, which is the tie-break order for matching. */
    List<GeofenceZone> findByActiveTrueOrderByIdAsc();
}
