package com.hausbesuch.planner.util;

import com.hausbesuch.planner.planning.GeoPoint;

/**
 * Straight-line distance helpers used by routing, travel estimation and radius checks.
 */
public final class GeoDistanceUtils {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistanceUtils() {
    }

    /**
     * Great-circle distance between two points in kilometres (haversine formula).
     */
    public static double haversineKm(GeoPoint from, GeoPoint to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Both points are required for a distance calculation.");
        }
        double lat1 = Math.toRadians(from.latitude());
        double lat2 = Math.toRadians(to.latitude());
        double deltaLat = lat2 - lat1;
        double deltaLon = Math.toRadians(to.longitude() - from.longitude());

        double a = Math.pow(Math.sin(deltaLat / 2), 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.pow(Math.sin(deltaLon / 2), 2);
        double c = 2 * Math.asin(Math.min(1.0, Math.sqrt(a)));
        return EARTH_RADIUS_KM * c;
    }
}
