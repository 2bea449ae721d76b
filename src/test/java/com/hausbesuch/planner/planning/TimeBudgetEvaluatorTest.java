package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hausbesuch.planner.planning.PlanningFixtures.basePatient;
import static org.junit.jupiter.api.Assertions.*;

class TimeBudgetEvaluatorTest {

    private final TimeBudgetEvaluator evaluator = new TimeBudgetEvaluator();

    @Test
    void routeOverBudgetReportsOverage() {
        RouteStats stats = evaluator.evaluate(List.of(patient(1L, 30), patient(2L, 45)), 40, 100);

        assertEquals(75, stats.totalVisitMinutes());
        assertEquals(40, stats.totalTravelMinutes());
        assertEquals(115, stats.totalMinutes());
        assertTrue(stats.overBudget());
        assertEquals(15, stats.overage());
    }

    @Test
    void exactlyOnBudgetIsNotOver() {
        RouteStats stats = evaluator.evaluate(60, 40, 100);

        assertFalse(stats.overBudget());
        assertEquals(0, stats.overage());
    }

    @Test
    void underBudgetHasNoOverage() {
        RouteStats stats = evaluator.evaluate(120, 30, 240);

        assertEquals(150, stats.totalMinutes());
        assertFalse(stats.overBudget());
        assertEquals(0, stats.overage());
    }

    @Test
    void hugeDurationsSaturateInsteadOfWrapping() {
        RouteStats stats = evaluator.evaluate(
                List.of(patient(1L, 1_500_000_000), patient(2L, 1_500_000_000)), 10, 240);

        assertEquals(Integer.MAX_VALUE, stats.totalVisitMinutes());
        assertEquals(Integer.MAX_VALUE, stats.totalMinutes());
        assertTrue(stats.overBudget());
        assertTrue(stats.overage() > 0);
    }

    @Test
    void emptyRouteHasNoMinutes() {
        RouteStats stats = evaluator.evaluate(List.of(), 0, 240);

        assertEquals(0, evaluator.totalVisitMinutes(List.of()));
        assertEquals(new RouteStats(0, 0, 0, 240, false, 0), stats);
    }

    private Patient patient(long id, int visitDurationMinutes) {
        Patient patient = basePatient(id);
        patient.setVisitDurationMinutes(visitDurationMinutes);
        return patient;
    }
}
