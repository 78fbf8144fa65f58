package com.yoursp.attendance.modules.geofence;

import com.yoursp.attendance.config.AttendanceProperties;
import com.yoursp.attendance.model.entity.LocationFix;
import com.yoursp.attendance.modules.geofence.exception.LocationFailureReason;
import com.yoursp.attendance.modules.geofence.exception.LocationUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Produces a usable fix for a punch: the one the device sent, or one fetched
 * from the optional {@link LocationProvider}. Every fix is validated before
 * the geofence sees it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocationResolver {

    private final ObjectProvider<LocationProvider> locationProvider;
    private final AttendanceProperties properties;

    /**
     * @param userId   the punching user
     * @param supplied fix sent with the request, may be null
     * @return a validated fix
     * @throws LocationUnavailableException if no usable fix can be produced
     */
    public LocationFix resolve(UUID userId, LocationFix supplied) {
        LocationFix fix = supplied != null ? supplied : fetch(userId);
        validate(fix);
        return fix;
    }

    private LocationFix fetch(UUID userId) {
        LocationProvider provider = locationProvider.getIfAvailable();
        if (provider == null) {
            throw new LocationUnavailableException(LocationFailureReason.UNAVAILABLE,
                    "No location fix supplied and no location provider configured");
        }

        Duration timeout = properties.getLocation().getTimeout();
        CompletableFuture<LocationFix> future = provider.requestFix(userId);
        try {
            LocationFix fix = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (fix == null) {
                throw new LocationUnavailableException(LocationFailureReason.UNAVAILABLE,
                        "Location provider returned no fix");
            }
            return fix;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Location fix timed out after {}ms for userId={}", timeout.toMillis(), userId);
            throw new LocationUnavailableException(LocationFailureReason.TIMEOUT,
                    "Location fix timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof LocationUnavailableException unavailable) {
                throw unavailable;
            }
            throw new LocationUnavailableException(LocationFailureReason.UNAVAILABLE,
                    "Location provider failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LocationUnavailableException(LocationFailureReason.UNAVAILABLE,
                    "Interrupted while waiting for a location fix", e);
        }
    }

    void validate(LocationFix fix) {
        double lat = fix.getLatitude();
        double lng = fix.getLongitude();
        if (!Double.isFinite(lat) || !Double.isFinite(lng) || lat < -90 || lat > 90 || lng < -180 || lng > 180) {
            throw unusable("Coordinates out of range: " + fix);
        }
        if (!Double.isFinite(fix.getAccuracyMeters()) || fix.getAccuracyMeters() < 0) {
            throw unusable("Invalid accuracy: " + fix.getAccuracyMeters());
        }

        Double maxAccuracy = properties.getLocation().getMaxAccuracyMeters();
        if (maxAccuracy != null && fix.getAccuracyMeters() > maxAccuracy) {
            throw unusable(String.format("Fix accuracy %.0fm is worse than the %.0fm limit",
                    fix.getAccuracyMeters(), maxAccuracy));
        }

        if (fix.getCapturedAt() == null) {
            throw unusable("Fix has no capture time");
        }
        Duration maxAge = properties.getLocation().getMaxFixAge();
        if (maxAge != null && fix.getCapturedAt().isBefore(OffsetDateTime.now().minus(maxAge))) {
            throw unusable("Fix is older than " + maxAge.toSeconds() + "s");
        }
    }

    private LocationUnavailableException unusable(String message) {
        return new LocationUnavailableException(LocationFailureReason.UNUSABLE, message);
    }
}
