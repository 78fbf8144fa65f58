package com.yoursp.attendance.modules.geofence;

/**
 * Great-circle distance on a spherical Earth.
 */
public final class GeoDistance {

    /** Mean Earth radius in meters. */
    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private GeoDistance() {
    }

    /**
     * Haversine distance between two points given in degrees.
     *
     * @return distance in meters
     */
    public static double haversineMeters(double lat1, double lng1, double lat2, double lng2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double deltaPhi = Math.toRadians(lat2 - lat1);
        double deltaLambda = Math.toRadians(lng2 - lng1);

        double sinHalfPhi = Math.sin(deltaPhi / 2);
        double sinHalfLambda = Math.sin(deltaLambda / 2);
        // rounding can push a past 1 for near-antipodal points
        double a = Math.min(1.0, sinHalfPhi * sinHalfPhi
                + Math.cos(phi1) * Math.cos(phi2) * sinHalfLambda * sinHalfLambda);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }
}
