package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;
import com.hausbesuch.planner.model.TransportMode;
import com.hausbesuch.planner.util.GeoDistanceUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a route into patients reachable with the provider's transport mode and patients that
 * must be handed to somebody else. Route order is preserved in both halves.
 */
@Component
public class TransportRadiusFilter {

    public RadiusFilterResult filter(List<Patient> route,
                                     TransportMode mode,
                                     RadiusSettings radiusSettings,
                                     GeoPoint home) {
        if (route == null || route.isEmpty()) {
            return new RadiusFilterResult(List.of(), List.of());
        }
        double limit = radiusSettings != null ? radiusSettings.limitFor(mode) : Double.POSITIVE_INFINITY;
        if (Double.isInfinite(limit) || home == null || !home.isValid()) {
            return new RadiusFilterResult(List.copyOf(route), List.of());
        }

        List<Patient> kept = new ArrayList<>();
        List<Patient> relocated = new ArrayList<>();
        for (Patient patient : route) {
            GeoPoint location = patient.coordinates();
            // unknown distance counts as in range
            if (location == null || GeoDistanceUtils.haversineKm(home, location) <= limit) {
                kept.add(patient);
            } else {
                relocated.add(patient);
            }
        }
        return new RadiusFilterResult(kept, relocated);
    }
}
