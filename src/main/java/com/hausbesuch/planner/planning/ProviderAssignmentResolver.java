package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;
import com.hausbesuch.planner.model.Provider;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves which provider visits a patient, following the provider ids stored on the patient.
 * Ids that no longer resolve are treated as absent.
 */
@Component
public class ProviderAssignmentResolver {

    public Optional<Provider> effectiveProvider(Patient patient, Map<Long, Provider> providersById) {
        if (patient == null || providersById == null || providersById.isEmpty()) {
            return Optional.empty();
        }
        Long overrideId = patient.getOverrideProviderId();
        if (overrideId != null && providersById.containsKey(overrideId)) {
            return Optional.of(providersById.get(overrideId));
        }
        Long primaryId = patient.getPrimaryProviderId();
        if (primaryId != null && providersById.containsKey(primaryId)) {
            return Optional.of(providersById.get(primaryId));
        }
        return Optional.empty();
    }

    /**
     * Applies the assignment transition that follows a completed visit: a one-off override is
     * dropped, a permanent override becomes the new primary provider.
     *
     * @return {@code true} if the patient record was changed
     */
    public boolean applyVisitCompletion(Patient patient) {
        Long overrideId = patient.getOverrideProviderId();
        if (overrideId == null) {
            if (Boolean.TRUE.equals(patient.getOverridePermanent())) {
                patient.setOverridePermanent(Boolean.FALSE);
                return true;
            }
            return false;
        }
        if (Boolean.TRUE.equals(patient.getOverridePermanent())) {
            patient.setPrimaryProviderId(overrideId);
        }
        patient.setOverrideProviderId(null);
        patient.setOverridePermanent(Boolean.FALSE);
        return true;
    }
}
