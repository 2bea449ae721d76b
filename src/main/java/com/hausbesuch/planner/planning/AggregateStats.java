package com.hausbesuch.planner.planning;

import java.util.List;

public record AggregateStats(int totalTravelMinutes,
                             int totalVisitMinutes,
                             int totalMinutes,
                             int totalBudgetMinutes,
                             int providersOverBudget,
                             int totalOverage,
                             int plannedPatients,
                             int unplannedPatients) {

    public static AggregateStats of(List<ProviderRoute> routes, int unplannedPatients) {
        long travel = 0;
        long visit = 0;
        long total = 0;
        long budget = 0;
        int over = 0;
        long overage = 0;
        int planned = 0;
        for (ProviderRoute route : routes) {
            RouteStats stats = route.stats();
            travel += stats.totalTravelMinutes();
            visit += stats.totalVisitMinutes();
            total += stats.totalMinutes();
            budget += stats.maxDailyMinutes();
            overage += stats.overage();
            if (stats.overBudget()) {
                over++;
            }
            planned += route.patientCount();
        }
        return new AggregateStats(TimeBudgetEvaluator.clamp(travel), TimeBudgetEvaluator.clamp(visit),
                TimeBudgetEvaluator.clamp(total), TimeBudgetEvaluator.clamp(budget), over,
                TimeBudgetEvaluator.clamp(overage), planned, unplannedPatients);
    }
}
