package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;

/**
 * A patient at a position of a provider's route. {@code distanceFromHomeKm} is {@code null}
 * for patients without coordinates.
 */
public record PlanEntry(int sequence,
                        Patient patient,
                        Double distanceFromHomeKm,
                        boolean hasCoordinates,
                        boolean relocated) {
}
