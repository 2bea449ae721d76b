package com.hausbesuch.planner.planning;

public record RouteStats(int totalTravelMinutes,
                         int totalVisitMinutes,
                         int totalMinutes,
                         int maxDailyMinutes,
                         boolean overBudget,
                         int overage) {
}
