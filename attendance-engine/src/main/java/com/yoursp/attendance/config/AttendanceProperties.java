package com.yoursp.attendance.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Binds the {@code attendance.*} YAML properties into a typed bean.
 * <p>
 * Every policy knob of the engine lives here so that services can be unit
 * tested by constructing this object directly.
 * </p>
 */
@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "attendance")
public class AttendanceProperties {

    @Valid
    private Verification verification = new Verification();
    @Valid
    private Location location = new Location();
    @Valid
    private TemporaryWorkplace temporaryWorkplace = new TemporaryWorkplace();
    @Valid
    private Approval approval = new Approval();
    @Valid
    private Provider provider = new Provider();

    @Getter
    @Setter
    public static class Verification {

        /** Face verification is required for in-zone punches. */
        private boolean required = true;

        @Min(1)
        private int maxAttempts = 3;

        /** Provider successes below this confidence count as failed attempts. 0 disables the check. */
        @Min(0)
        @Max(100)
        private int minConfidencePercent = 0;

        /** Default wait for the verification provider when the caller supplies none. */
        @NotNull
        private Duration providerTimeout = Duration.ofSeconds(10);

        /** Raise a VERIFICATION_FAILURE approval request when a session fails. */
        private boolean escalateToApproval = false;

        /** Bounds the check-and-create critical section only; sessions never expire. */
        @NotNull
        private Duration creationLockTtl = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Location {

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        /** Fixes older than this are rejected. */
        private Duration maxFixAge = Duration.ofMinutes(5);

        /** Fixes less accurate than this are rejected. Null disables the check. */
        private Double maxAccuracyMeters;
    }

    @Getter
    @Setter
    public static class TemporaryWorkplace {

        private boolean enabled = true;
        private TargetType targetType = TargetType.ALL_EMPLOYEES;
        private Set<UUID> targetEmployees = new HashSet<>();

        private boolean requireReason = true;
        private boolean requirePhoto = false;
        private boolean requireLocation = true;

        /** Manager sign-off for punches from unregistered locations. */
        private boolean requireApproval = true;

        /** Null means no distance restriction. */
        private Double maxDistanceFromWorkplaceMeters;
    }

    @Getter
    @Setter
    public static class Approval {

        /** Receives requests raised without an explicit manager, e.g. verification escalations. */
        private UUID defaultManagerId;
    }

    @Getter
    @Setter
    public static class Provider {

        @NotBlank
        private String baseUrl = "http://localhost:5000";
        private String verifyPath = "/verify";
    }

    public enum TargetType {
        ALL_EMPLOYEES,
        SPECIFIC_EMPLOYEES
    }
}
