package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.TransportMode;

import java.time.LocalDate;
import java.util.Map;

/**
 * Per-run planning parameters. Transport modes and budget overrides are keyed by provider id
 * and only live for the run they are passed to.
 */
public record PlanningSettings(LocalDate today,
                               GeoPoint home,
                               String homeAddress,
                               RadiusSettings radius,
                               Map<Long, TransportMode> transportModes,
                               Map<Long, Integer> budgetOverrides) {

    public PlanningSettings {
        if (today == null) {
            throw new IllegalArgumentException("Planning date is required.");
        }
        if (home == null || !home.isValid()) {
            throw new IllegalArgumentException("A valid home location is required.");
        }
        transportModes = transportModes != null ? Map.copyOf(transportModes) : Map.of();
        budgetOverrides = budgetOverrides != null ? Map.copyOf(budgetOverrides) : Map.of();
    }

    public TransportMode transportModeFor(Long providerId) {
        TransportMode mode = providerId != null ? transportModes.get(providerId) : null;
        return mode != null ? mode : TransportMode.CAR;
    }

    public int budgetFor(Long providerId, Integer defaultMinutes) {
        Integer override = providerId != null ? budgetOverrides.get(providerId) : null;
        if (override != null && override >= 0) {
            return override;
        }
        return defaultMinutes != null && defaultMinutes >= 0 ? defaultMinutes : 0;
    }
}
