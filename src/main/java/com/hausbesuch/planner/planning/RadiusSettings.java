package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.TransportMode;

/**
 * Straight-line reach limits for the non-motorised transport modes, in kilometres.
 */
public record RadiusSettings(double radiusWalkKm, double radiusBikeKm) {

    public RadiusSettings {
        if (radiusWalkKm < 0 || radiusBikeKm < 0) {
            throw new IllegalArgumentException("Radius limits must not be negative.");
        }
    }

    /**
     * Limit for the mode, or {@link Double#POSITIVE_INFINITY} when the mode has none.
     */
    public double limitFor(TransportMode mode) {
        if (mode == null) {
            return Double.POSITIVE_INFINITY;
        }
        return switch (mode) {
            case WALK -> radiusWalkKm;
            case BIKE -> radiusBikeKm;
            case CAR -> Double.POSITIVE_INFINITY;
        };
    }
}
