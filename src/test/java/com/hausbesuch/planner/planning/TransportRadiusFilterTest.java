package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;
import com.hausbesuch.planner.model.TransportMode;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.hausbesuch.planner.planning.PlanningFixtures.HOME;
import static com.hausbesuch.planner.planning.PlanningFixtures.basePatient;
import static com.hausbesuch.planner.planning.PlanningFixtures.recurringPatient;
import static org.junit.jupiter.api.Assertions.*;

class TransportRadiusFilterTest {

    private final TransportRadiusFilter filter = new TransportRadiusFilter();
    private final RadiusSettings radius = new RadiusSettings(1.0, 5.0);

    @Test
    void walkingProviderLosesPatientBeyondWalkRadius() {
        Patient far = at(1L, 4.0);

        RadiusFilterResult result = filter.filter(List.of(far), TransportMode.WALK, radius, HOME);

        assertTrue(result.kept().isEmpty());
        assertEquals(List.of(far), result.relocated());
    }

    @Test
    void carKeepsEveryPatient() {
        Patient far = at(1L, 4.0);
        Patient veryFar = at(2L, 40.0);

        RadiusFilterResult result = filter.filter(List.of(far, veryFar), TransportMode.CAR, radius, HOME);

        assertEquals(List.of(far, veryFar), result.kept());
        assertTrue(result.relocated().isEmpty());
    }

    @Test
    void bikeUsesBikeRadiusAndKeepsRouteOrder() {
        Patient near = at(1L, 0.5);
        Patient far = at(2L, 6.0);
        Patient mid = at(3L, 4.5);

        RadiusFilterResult result = filter.filter(List.of(near, far, mid), TransportMode.BIKE, radius, HOME);

        assertEquals(List.of(near, mid), result.kept());
        assertEquals(List.of(far), result.relocated());
    }

    @Test
    void patientWithoutCoordinatesIsNeverRelocated() {
        Patient unknown = basePatient(9L);

        RadiusFilterResult result = filter.filter(List.of(unknown), TransportMode.WALK, radius, HOME);

        assertEquals(List.of(unknown), result.kept());
        assertTrue(result.relocated().isEmpty());
    }

    @Test
    void radiusLimitsPerMode() {
        assertEquals(1.0, radius.limitFor(TransportMode.WALK));
        assertEquals(5.0, radius.limitFor(TransportMode.BIKE));
        assertEquals(Double.POSITIVE_INFINITY, radius.limitFor(TransportMode.CAR));
        assertThrows(IllegalArgumentException.class, () -> new RadiusSettings(-1.0, 2.0));
    }

    private Patient at(long id, double kmNorth) {
        return recurringPatient(id, kmNorth, LocalDate.of(2024, 1, 1), 7);
    }
}
