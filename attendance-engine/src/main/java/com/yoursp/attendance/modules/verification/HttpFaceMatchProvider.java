package com.yoursp.attendance.modules.verification;

import com.yoursp.attendance.config.AttendanceProperties;
import com.yoursp.attendance.modules.verification.dto.FaceMatchResponse;
import com.yoursp.attendance.modules.verification.dto.VerificationOutcome;
import com.yoursp.attendance.modules.verification.exception.ProviderUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.UUID;

/**
 * Calls the external face-match service over HTTP.
 * <p>
 * Protected by a Resilience4j circuit breaker; every failure, including an
 * open breaker, surfaces as {@link ProviderUnavailableException} so that the
 * session does not consume an attempt.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpFaceMatchProvider implements VerificationProvider {

    private final RestTemplate faceMatchRestTemplate;
    private final AttendanceProperties properties;

    @Override
    @CircuitBreaker(name = "faceMatch", fallbackMethod = "verifyFallback")
    public VerificationOutcome verify(UUID userId, String sampleRef) {
        String url = properties.getProvider().getBaseUrl() + properties.getProvider().getVerifyPath();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(
                Map.of("userId", userId.toString(), "sample", sampleRef), headers);

        ResponseEntity<FaceMatchResponse> response;
        try {
            response = faceMatchRestTemplate.postForEntity(url, request, FaceMatchResponse.class);
        } catch (RestClientException e) {
            log.error("Face-match call failed: userId={}, error={}", userId, e.getMessage());
            throw new ProviderUnavailableException("Face-match call failed", e);
        }

        FaceMatchResponse body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful() || body == null) {
            log.error("Face-match returned HTTP {} without a usable body: userId={}",
                    response.getStatusCode().value(), userId);
            throw new ProviderUnavailableException("Face-match returned HTTP " + response.getStatusCode().value());
        }

        int confidence = (int) Math.round(Math.max(0, Math.min(100, body.confidence())));
        log.info("Face-match result: userId={}, match={}, confidence={}", userId, body.match(), confidence);

        return body.match()
                ? VerificationOutcome.success(confidence)
                : VerificationOutcome.failure(confidence, body.reason() != null ? body.reason() : "NO_MATCH");
    }

    @SuppressWarnings("unused")
    private VerificationOutcome verifyFallback(UUID userId, String sampleRef, Throwable t) {
        log.error("Face-match circuit breaker fallback: userId={}, error={}", userId, t.getMessage());
        if (t instanceof ProviderUnavailableException unavailable) {
            throw unavailable;
        }
        throw new ProviderUnavailableException("Face verification is temporarily unavailable. Please try again.", t);
    }
}
