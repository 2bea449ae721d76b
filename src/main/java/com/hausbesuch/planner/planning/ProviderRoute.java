package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Provider;
import com.hausbesuch.planner.model.TransportMode;

import java.util.List;

public record ProviderRoute(Provider provider,
                            TransportMode transportMode,
                            List<PlanEntry> entries,
                            RouteStats stats) {

    public int patientCount() {
        return entries.size();
    }
}
