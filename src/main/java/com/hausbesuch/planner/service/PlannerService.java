package com.hausbesuch.planner.service;

import com.hausbesuch.planner.dto.PlanningOptionsRequest;
import com.hausbesuch.planner.model.Patient;
import com.hausbesuch.planner.model.Provider;
import com.hausbesuch.planner.model.TransportMode;
import com.hausbesuch.planner.planning.DailyPlan;
import com.hausbesuch.planner.planning.DailyPlanBuilder;
import com.hausbesuch.planner.planning.PlanningRequest;
import com.hausbesuch.planner.planning.PlanningSettings;
import com.hausbesuch.planner.repository.PatientRepository;
import com.hausbesuch.planner.repository.ProviderRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the current snapshots and hands them to the planning engine. Per-run options are
 * applied to this run only.
 */
@Service
public class PlannerService {

    private final PatientRepository patientRepository;
    private final ProviderRepository providerRepository;
    private final SettingsService settingsService;
    private final DailyPlanBuilder dailyPlanBuilder;

    public PlannerService(PatientRepository patientRepository,
                          ProviderRepository providerRepository,
                          SettingsService settingsService,
                          DailyPlanBuilder dailyPlanBuilder) {
        this.patientRepository = patientRepository;
        this.providerRepository = providerRepository;
        this.settingsService = settingsService;
        this.dailyPlanBuilder = dailyPlanBuilder;
    }

    @Transactional(readOnly = true)
    public DailyPlan planFor(PlanningOptionsRequest options) {
        PlanningOptionsRequest effective = options != null ? options : new PlanningOptionsRequest();
        LocalDate today = effective.getDate() != null ? effective.getDate() : LocalDate.now();

        List<Patient> patients = patientRepository.findAllByOrderByIdAsc();
        List<Provider> providers = providerRepository.findAllByOrderByIdAsc();

        PlanningSettings settings = new PlanningSettings(
                today,
                settingsService.homeLocation(),
                settingsService.homeAddress(),
                settingsService.radiusSettings(),
                transportModes(effective.getTransportModes()),
                budgetOverrides(effective.getBudgetOverrides())
        );
        return dailyPlanBuilder.build(new PlanningRequest(patients, providers, settings));
    }

    private Map<Long, TransportMode> transportModes(Map<Long, String> raw) {
        Map<Long, TransportMode> modes = new HashMap<>();
        if (raw != null) {
            raw.forEach((providerId, mode) -> {
                if (providerId != null) {
                    modes.put(providerId, TransportMode.fromValue(mode));
                }
            });
        }
        return modes;
    }

    private Map<Long, Integer> budgetOverrides(Map<Long, Integer> raw) {
        Map<Long, Integer> overrides = new HashMap<>();
        if (raw != null) {
            raw.forEach((providerId, minutes) -> {
                if (providerId == null || minutes == null) {
                    return;
                }
                if (minutes < 0) {
                    throw new IllegalArgumentException(
                            "Budget override for provider " + providerId + " must not be negative: " + minutes);
                }
                overrides.put(providerId, minutes);
            });
        }
        return overrides;
    }
}
