package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TimeBudgetEvaluator {

    public RouteStats evaluate(List<Patient> route, int travelMinutes, int maxDailyMinutes) {
        return evaluate(totalVisitMinutes(route), travelMinutes, maxDailyMinutes);
    }

    public RouteStats evaluate(int visitMinutes, int travelMinutes, int maxDailyMinutes) {
        long total = (long) visitMinutes + travelMinutes;
        boolean overBudget = total > maxDailyMinutes;
        long overage = Math.max(0L, total - maxDailyMinutes);
        return new RouteStats(travelMinutes, visitMinutes, clamp(total), maxDailyMinutes, overBudget, clamp(overage));
    }

    public int totalVisitMinutes(List<Patient> route) {
        if (route == null) {
            return 0;
        }
        long sum = 0;
        for (Patient patient : route) {
            Integer duration = patient.getVisitDurationMinutes();
            if (duration != null && duration > 0) {
                sum += duration;
            }
        }
        return clamp(sum);
    }

    // minute totals saturate at Integer.MAX_VALUE
    static int clamp(long minutes) {
        return (int) Math.min(Integer.MAX_VALUE, minutes);
    }
}
