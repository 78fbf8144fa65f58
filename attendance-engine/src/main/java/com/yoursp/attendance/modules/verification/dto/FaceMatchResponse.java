package com.yoursp.attendance.modules.verification.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body returned by the face-match service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FaceMatchResponse(boolean match, double confidence, String reason) {
}
