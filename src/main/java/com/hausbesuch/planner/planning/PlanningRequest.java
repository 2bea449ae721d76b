package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;
import com.hausbesuch.planner.model.Provider;

import java.util.List;

public record PlanningRequest(List<Patient> patients,
                              List<Provider> providers,
                              PlanningSettings settings) {

    public PlanningRequest {
        patients = patients != null ? List.copyOf(patients) : List.of();
        providers = providers != null ? List.copyOf(providers) : List.of();
        if (settings == null) {
            throw new IllegalArgumentException("Planning settings are required.");
        }
    }
}
