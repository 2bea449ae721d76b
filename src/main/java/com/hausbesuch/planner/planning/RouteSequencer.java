package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;
import com.hausbesuch.planner.util.GeoDistanceUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Orders a provider's patients with the nearest-neighbour heuristic.
 * <p>
 * Starting from {@code start}, the closest unvisited patient is appended repeatedly; ties keep
 * the input order. Patients without usable coordinates follow the sequenced ones in input
 * order. The result is not an optimal tour, but identical input always gives identical output.
 */
@Component
public class RouteSequencer {

    public List<Patient> sequence(GeoPoint start, List<Patient> patients) {
        if (patients == null || patients.isEmpty()) {
            return List.of();
        }
        List<Patient> unvisited = new ArrayList<>();
        List<Patient> withoutCoordinates = new ArrayList<>();
        for (Patient patient : patients) {
            if (patient.coordinates() != null) {
                unvisited.add(patient);
            } else {
                withoutCoordinates.add(patient);
            }
        }

        List<Patient> route = new ArrayList<>(patients.size());
        if (start == null || !start.isValid()) {
            // nothing to measure from, keep the caller's order
            route.addAll(unvisited);
            route.addAll(withoutCoordinates);
            return route;
        }

        GeoPoint current = start;
        while (!unvisited.isEmpty()) {
            int nearestIndex = 0;
            double nearestDistance = Double.MAX_VALUE;
            for (int i = 0; i < unvisited.size(); i++) {
                double distance = GeoDistanceUtils.haversineKm(current, unvisited.get(i).coordinates());
                if (distance < nearestDistance) {
                    nearestDistance = distance;
                    nearestIndex = i;
                }
            }
            Patient nearest = unvisited.remove(nearestIndex);
            route.add(nearest);
            current = nearest.coordinates();
        }
        route.addAll(withoutCoordinates);
        return route;
    }
}
