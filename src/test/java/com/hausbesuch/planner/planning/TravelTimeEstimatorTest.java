package com.hausbesuch.planner.planning;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.hausbesuch.planner.planning.PlanningFixtures.HOME;
import static com.hausbesuch.planner.planning.PlanningFixtures.northOfHome;
import static org.junit.jupiter.api.Assertions.*;

class TravelTimeEstimatorTest {

    private final TravelTimeEstimator estimator = new TravelTimeEstimator(30, 1.3, 0);

    @Test
    void hopMinutesAreRoadDistanceAtAverageSpeed() {
        // 10 km * 1.3 = 13 km at 30 km/h = 26 min
        assertEquals(26, estimator.estimateHopMinutes(10.0));
        assertEquals(0, estimator.estimateHopMinutes(0.0));
        // 1 km * 1.3 / 30 * 60 = 2.6
        assertEquals(3, estimator.estimateHopMinutes(1.0));
    }

    @Test
    void loopIncludesReturnToHome() {
        assertEquals(6, estimator.estimateLoopMinutes(HOME, List.of(northOfHome(1.0))));
        assertEquals(52, estimator.estimateLoopMinutes(HOME, List.of(northOfHome(10.0))));
    }

    @Test
    void everyHopUsesTheSameConstants() {
        List<GeoPoint> loop = List.of(HOME, northOfHome(5.0), northOfHome(15.0), HOME);
        // 5 km -> 13, 10 km -> 26, 15 km -> 39
        assertEquals(13 + 26 + 39, estimator.estimateMinutes(loop));
    }

    @Test
    void emptyRouteCostsNothing() {
        assertEquals(0, estimator.estimateLoopMinutes(HOME, List.of()));
        assertEquals(0, estimator.estimateMinutes(List.of(HOME)));
        assertEquals(0, estimator.estimateMinutes(null));
    }

    @Test
    void missingPointsAreSkipped() {
        List<GeoPoint> stops = new ArrayList<>(Arrays.asList(null, northOfHome(10.0), null));
        assertEquals(52, estimator.estimateLoopMinutes(HOME, stops));
    }

    @Test
    void configuredBufferIsAddedToEveryHop() {
        TravelTimeEstimator withBuffer = new TravelTimeEstimator(30, 1.3, 5);
        assertEquals(31, withBuffer.estimateHopMinutes(10.0));
        assertEquals(16, withBuffer.estimateLoopMinutes(HOME, List.of(northOfHome(1.0))));
    }

    @Test
    void slowerSpeedGivesLongerEstimate() {
        TravelTimeEstimator walking = new TravelTimeEstimator(5, 1.0, 0);
        assertEquals(120, walking.estimateHopMinutes(10.0));
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TravelTimeEstimator(0, 1.3, 0));
        assertThrows(IllegalArgumentException.class, () -> new TravelTimeEstimator(30, 0.9, 0));
        assertThrows(IllegalArgumentException.class, () -> new TravelTimeEstimator(30, 1.3, -1));
    }
}
