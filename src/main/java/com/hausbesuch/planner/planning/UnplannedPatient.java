package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;

public record UnplannedPatient(Patient patient,
                               UnplannedReason reason,
                               Long intendedProviderId,
                               Double distanceFromHomeKm) {
}
