package com.yoursp.attendance.modules.geofence;

import com.yoursp.attendance.config.AttendanceProperties;
import com.yoursp.attendance.model.entity.LocationFix;
import com.yoursp.attendance.modules.geofence.exception.LocationFailureReason;
import com.yoursp.attendance.modules.geofence.exception.LocationUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class LocationResolverTest {

    @Mock
    private ObjectProvider<LocationProvider> providerLookup;

    @Mock
    private LocationProvider locationProvider;

    private final AttendanceProperties properties = new AttendanceProperties();
    private LocationResolver resolver;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        properties.getLocation().setTimeout(Duration.ofMillis(100));
        resolver = new LocationResolver(providerLookup, properties);
    }

    @Test
    @DisplayName("A supplied fix is used without asking the provider")
    void suppliedFixIsUsed() {
        LocationFix fix = LocationFix.of(25.2, 55.3, 15, OffsetDateTime.now());

        assertSame(fix, resolver.resolve(userId, fix));
        verifyNoInteractions(providerLookup);
    }

    @Test
    @DisplayName("No fix and no provider → UNAVAILABLE")
    void noProviderIsUnavailable() {
        when(providerLookup.getIfAvailable()).thenReturn(null);

        LocationUnavailableException ex = assertThrows(LocationUnavailableException.class,
                () -> resolver.resolve(userId, null));
        assertEquals(LocationFailureReason.UNAVAILABLE, ex.getReason());
        assertEquals("LOCATION_UNAVAILABLE", ex.getErrorCode());
    }

    @Test
    @DisplayName("Provider fix is awaited and returned")
    void providerFixIsReturned() {
        LocationFix fix = LocationFix.of(25.2, 55.3, 15, OffsetDateTime.now());
        when(providerLookup.getIfAvailable()).thenReturn(locationProvider);
        when(locationProvider.requestFix(userId)).thenReturn(CompletableFuture.completedFuture(fix));

        assertSame(fix, resolver.resolve(userId, null));
    }

    @Test
    @DisplayName("Provider that never answers → TIMEOUT")
    void providerTimeout() {
        when(providerLookup.getIfAvailable()).thenReturn(locationProvider);
        when(locationProvider.requestFix(any())).thenReturn(new CompletableFuture<>());

        LocationUnavailableException ex = assertThrows(LocationUnavailableException.class,
                () -> resolver.resolve(userId, null));
        assertEquals(LocationFailureReason.TIMEOUT, ex.getReason());
    }

    @Test
    @DisplayName("Permission denial from the provider keeps its reason")
    void permissionDeniedIsPropagated() {
        when(providerLookup.getIfAvailable()).thenReturn(locationProvider);
        when(locationProvider.requestFix(any())).thenReturn(CompletableFuture.failedFuture(
                new LocationUnavailableException(LocationFailureReason.PERMISSION_DENIED, "denied")));

        LocationUnavailableException ex = assertThrows(LocationUnavailableException.class,
                () -> resolver.resolve(userId, null));
        assertEquals(LocationFailureReason.PERMISSION_DENIED, ex.getReason());
    }

    @Test
    @DisplayName("Out-of-range coordinates, poor accuracy and stale fixes are UNUSABLE")
    void unusableFixesAreRejected() {
        properties.getLocation().setMaxAccuracyMeters(50.0);
        properties.getLocation().setMaxFixAge(Duration.ofMinutes(5));

        LocationFix badLatitude = LocationFix.of(91, 0, 10, OffsetDateTime.now());
        LocationFix inaccurate = LocationFix.of(25.2, 55.3, 120, OffsetDateTime.now());
        LocationFix stale = LocationFix.of(25.2, 55.3, 10, OffsetDateTime.now().minusMinutes(10));

        for (LocationFix fix : new LocationFix[] { badLatitude, inaccurate, stale }) {
            LocationUnavailableException ex = assertThrows(LocationUnavailableException.class,
                    () -> resolver.resolve(userId, fix));
            assertEquals(LocationFailureReason.UNUSABLE, ex.getReason());
        }
    }
}
