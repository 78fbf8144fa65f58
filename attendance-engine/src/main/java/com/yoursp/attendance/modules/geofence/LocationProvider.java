package com.yoursp.attendance.modules.geofence;

import com.yoursp.attendance.model.entity.LocationFix;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Supplies a location fix on demand when the punch request did not carry one.
 * <p>
 * Implementations complete the future exceptionally with
 * {@link com.yoursp.attendance.modules.geofence.exception.LocationUnavailableException}
 * on permission or hardware failures.
 * </p>
 */
public interface LocationProvider {

    CompletableFuture<LocationFix> requestFix(UUID userId);
}
