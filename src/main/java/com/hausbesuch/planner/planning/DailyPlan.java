package com.hausbesuch.planner.planning;

import java.time.LocalDate;
import java.util.List;

public record DailyPlan(LocalDate date,
                        GeoPoint home,
                        String homeAddress,
                        List<ProviderRoute> routes,
                        List<UnplannedPatient> unplanned,
                        AggregateStats aggregate,
                        List<Long> missingCoordinates,
                        List<Long> dataQualityIssues) {
}
