package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;
import com.hausbesuch.planner.model.Provider;
import com.hausbesuch.planner.model.TransportMode;
import com.hausbesuch.planner.util.GeoDistanceUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the day's plan from snapshots of patients, providers and settings.
 * <p>
 * Pipeline: due filter, grouping by effective provider, nearest-neighbour sequencing, travel
 * estimate, transport radius filter, final travel estimate and budget evaluation per route,
 * aggregate totals. Bad records end up flagged in the plan instead of failing the run.
 */
@Component
public class DailyPlanBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DailyPlanBuilder.class);

    private final DueDateResolver dueDateResolver;
    private final ProviderAssignmentResolver providerAssignmentResolver;
    private final RouteSequencer routeSequencer;
    private final TravelTimeEstimator travelTimeEstimator;
    private final TransportRadiusFilter transportRadiusFilter;
    private final TimeBudgetEvaluator timeBudgetEvaluator;

    public DailyPlanBuilder(DueDateResolver dueDateResolver,
                            ProviderAssignmentResolver providerAssignmentResolver,
                            RouteSequencer routeSequencer,
                            TravelTimeEstimator travelTimeEstimator,
                            TransportRadiusFilter transportRadiusFilter,
                            TimeBudgetEvaluator timeBudgetEvaluator) {
        this.dueDateResolver = dueDateResolver;
        this.providerAssignmentResolver = providerAssignmentResolver;
        this.routeSequencer = routeSequencer;
        this.travelTimeEstimator = travelTimeEstimator;
        this.transportRadiusFilter = transportRadiusFilter;
        this.timeBudgetEvaluator = timeBudgetEvaluator;
    }

    public DailyPlan build(PlanningRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Planning request is required.");
        }
        PlanningSettings settings = request.settings();
        GeoPoint home = settings.home();

        List<Long> dataQualityIssues = new ArrayList<>();
        List<Patient> due = collectDuePatients(request.patients(), settings, dataQualityIssues);

        Map<Long, Provider> providersById = new LinkedHashMap<>();
        for (Provider provider : request.providers()) {
            if (provider != null && provider.getId() != null) {
                providersById.putIfAbsent(provider.getId(), provider);
            }
        }

        Map<Long, List<Patient>> groups = new LinkedHashMap<>();
        providersById.keySet().forEach(id -> groups.put(id, new ArrayList<>()));
        List<UnplannedPatient> unplanned = new ArrayList<>();
        for (Patient patient : due) {
            Optional<Provider> provider = providerAssignmentResolver.effectiveProvider(patient, providersById);
            if (provider.isPresent()) {
                groups.get(provider.get().getId()).add(patient);
            } else {
                unplanned.add(new UnplannedPatient(patient, UnplannedReason.UNASSIGNED, null,
                        distanceFromHome(home, patient)));
            }
        }

        List<ProviderRoute> routes = new ArrayList<>(groups.size());
        for (Map.Entry<Long, List<Patient>> group : groups.entrySet()) {
            Provider provider = providersById.get(group.getKey());
            routes.add(buildRoute(provider, group.getValue(), settings, unplanned));
        }

        List<Long> missingCoordinates = new ArrayList<>();
        for (Patient patient : due) {
            if (patient.coordinates() == null) {
                missingCoordinates.add(patient.getId());
            }
        }

        AggregateStats aggregate = AggregateStats.of(routes, unplanned.size());
        LOGGER.info("Plan for {}: {} due, {} planned across {} providers, {} unplanned, {} over budget",
                settings.today(), due.size(), aggregate.plannedPatients(), routes.size(),
                aggregate.unplannedPatients(), aggregate.providersOverBudget());

        return new DailyPlan(
                settings.today(),
                home,
                settings.homeAddress(),
                List.copyOf(routes),
                List.copyOf(unplanned),
                aggregate,
                Collections.unmodifiableList(missingCoordinates),
                Collections.unmodifiableList(dataQualityIssues)
        );
    }

    private List<Patient> collectDuePatients(List<Patient> patients,
                                             PlanningSettings settings,
                                             List<Long> dataQualityIssues) {
        List<Patient> due = new ArrayList<>();
        for (Patient patient : patients) {
            if (patient == null) {
                continue;
            }
            DueStatus status;
            try {
                status = dueDateResolver.resolve(patient, settings.today());
            } catch (RuntimeException e) {
                LOGGER.warn("Could not evaluate due date of patient {}: {}", patient.getId(), e.getMessage());
                status = DueStatus.INVALID_DATES;
            }
            if (status == DueStatus.INVALID_DATES) {
                dataQualityIssues.add(patient.getId());
            } else if (status == DueStatus.DUE) {
                due.add(patient);
            }
        }
        if (!dataQualityIssues.isEmpty()) {
            LOGGER.warn("{} patient(s) skipped because of malformed visit dates: {}",
                    dataQualityIssues.size(), dataQualityIssues);
        }
        return due;
    }

    private ProviderRoute buildRoute(Provider provider,
                                     List<Patient> assigned,
                                     PlanningSettings settings,
                                     List<UnplannedPatient> unplanned) {
        GeoPoint home = settings.home();
        TransportMode mode = settings.transportModeFor(provider.getId());
        int budget = settings.budgetFor(provider.getId(), provider.getMaxDailyMinutes());

        List<Patient> sequenced = routeSequencer.sequence(home, assigned);
        int plannedTravel = travelTimeEstimator.estimateLoopMinutes(home, coordinatesOf(sequenced));

        RadiusFilterResult filtered = transportRadiusFilter.filter(sequenced, mode, settings.radius(), home);
        for (Patient patient : filtered.relocated()) {
            unplanned.add(new UnplannedPatient(patient, UnplannedReason.OUT_OF_RADIUS, provider.getId(),
                    distanceFromHome(home, patient)));
        }

        List<Patient> finalRoute = filtered.kept();
        int travel = filtered.relocated().isEmpty()
                ? plannedTravel
                : travelTimeEstimator.estimateLoopMinutes(home, coordinatesOf(finalRoute));
        RouteStats stats = timeBudgetEvaluator.evaluate(finalRoute, travel, budget);

        List<PlanEntry> entries = new ArrayList<>(finalRoute.size());
        int sequence = 1;
        for (Patient patient : finalRoute) {
            GeoPoint location = patient.coordinates();
            entries.add(new PlanEntry(sequence++, patient, distanceFromHome(home, patient), location != null, false));
        }

        if (!filtered.relocated().isEmpty()) {
            LOGGER.debug("Provider {} ({}): {} patient(s) outside the {} radius", provider.getId(),
                    provider.getName(), filtered.relocated().size(), mode);
        }
        if (stats.overBudget()) {
            LOGGER.debug("Provider {} ({}) is {} minute(s) over the daily budget of {}", provider.getId(),
                    provider.getName(), stats.overage(), budget);
        }
        return new ProviderRoute(provider, mode, List.copyOf(entries), stats);
    }

    private List<GeoPoint> coordinatesOf(List<Patient> route) {
        List<GeoPoint> points = new ArrayList<>(route.size());
        for (Patient patient : route) {
            GeoPoint location = patient.coordinates();
            if (location != null) {
                points.add(location);
            }
        }
        return points;
    }

    private Double distanceFromHome(GeoPoint home, Patient patient) {
        GeoPoint location = patient.coordinates();
        return location != null ? GeoDistanceUtils.haversineKm(home, location) : null;
    }
}
