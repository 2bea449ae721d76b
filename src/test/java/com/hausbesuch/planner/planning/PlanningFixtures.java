package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;
import com.hausbesuch.planner.model.Provider;
import com.hausbesuch.planner.util.GeoDistanceUtils;

import java.time.LocalDate;

/**
 * Test data helpers. Points are laid out along the 10°E meridian north of {@link #HOME}, where
 * one kilometre equals a fixed latitude step.
 */
final class PlanningFixtures {

    static final GeoPoint HOME = new GeoPoint(50.0, 10.0);
    static final double KM_PER_DEGREE = GeoDistanceUtils.EARTH_RADIUS_KM * Math.PI / 180.0;

    private PlanningFixtures() {
    }

    static GeoPoint northOfHome(double km) {
        return new GeoPoint(HOME.latitude() + km / KM_PER_DEGREE, HOME.longitude());
    }

    static Patient recurringPatient(long id, double kmNorth, LocalDate lastVisit, int intervalDays) {
        Patient patient = basePatient(id);
        GeoPoint location = northOfHome(kmNorth);
        patient.setLatitude(location.latitude());
        patient.setLongitude(location.longitude());
        patient.setIntervalDays(intervalDays);
        patient.setLastVisit(lastVisit.atTime(9, 30));
        return patient;
    }

    static Patient oneTimePatient(long id, LocalDate plannedDate) {
        Patient patient = basePatient(id);
        patient.setIntervalDays(0);
        patient.setPlannedVisitDate(plannedDate);
        patient.setLastVisit(LocalDate.of(2024, 1, 1).atStartOfDay());
        return patient;
    }

    static Patient basePatient(long id) {
        Patient patient = new Patient();
        patient.setId(id);
        patient.setFirstName("Patient");
        patient.setLastName(String.valueOf(id));
        patient.setAddress("Teststraße " + id);
        patient.setVisitDurationMinutes(30);
        return patient;
    }

    static Provider provider(long id, String name, int maxDailyMinutes) {
        Provider provider = new Provider();
        provider.setId(id);
        provider.setName(name);
        provider.setRole("VERAH");
        provider.setMaxDailyMinutes(maxDailyMinutes);
        return provider;
    }
}
