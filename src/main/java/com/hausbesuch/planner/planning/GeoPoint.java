package com.hausbesuch.planner.planning;

/**
 * A latitude/longitude pair in decimal degrees.
 */
public record GeoPoint(double latitude, double longitude) {

    public boolean isValid() {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
                && latitude >= -90.0 && latitude <= 90.0
                && longitude >= -180.0 && longitude <= 180.0;
    }

    /**
     * Returns a point for the given nullable coordinates, or {@code null} when either value is
     * missing or out of range.
     */
    public static GeoPoint ofNullable(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            return null;
        }
        GeoPoint point = new GeoPoint(latitude, longitude);
        return point.isValid() ? point : null;
    }
}
