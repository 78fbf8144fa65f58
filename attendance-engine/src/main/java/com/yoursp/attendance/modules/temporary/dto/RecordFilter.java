package com.yoursp.attendance.modules.temporary.dto;

import com.yoursp.attendance.model.PunchType;
import lombok.Builder;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Null fields do not restrict. {@code search} matches reason, notes and the
 * linked reusable workplace name, case insensitive.
 */
@Builder
public record RecordFilter(UUID userId, LocalDate from, LocalDate to, PunchType type, String search) {
}
