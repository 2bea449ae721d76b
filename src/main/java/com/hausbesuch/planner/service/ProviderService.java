package com.hausbesuch.planner.service;

import com.hausbesuch.planner.dto.ProviderRequest;
import com.hausbesuch.planner.exception.ProviderNotFoundException;
import com.hausbesuch.planner.model.Patient;
import com.hausbesuch.planner.model.Provider;
import com.hausbesuch.planner.repository.PatientRepository;
import com.hausbesuch.planner.repository.ProviderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class ProviderService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderService.class);

    private final ProviderRepository providerRepository;
    private final PatientRepository patientRepository;

    public ProviderService(ProviderRepository providerRepository,
                           PatientRepository patientRepository) {
        this.providerRepository = providerRepository;
        this.patientRepository = patientRepository;
    }

    @Transactional(readOnly = true)
    public List<Provider> listProviders() {
        return providerRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public Provider getProvider(Long providerId) {
        return findProvider(providerId);
    }

    @Transactional
    public Provider createProvider(ProviderRequest request) {
        if (request == null || request.getName() == null || request.getName().isBlank()) {
            throw new IllegalArgumentException("Provider name is required.");
        }
        if (request.getRole() == null || request.getRole().isBlank()) {
            throw new IllegalArgumentException("Provider role is required.");
        }
        Provider provider = new Provider();
        provider.setName(request.getName().trim());
        provider.setRole(request.getRole().trim());
        if (request.getColor() != null && !request.getColor().isBlank()) {
            provider.setColor(request.getColor().trim());
        }
        if (request.getMaxDailyMinutes() != null) {
            provider.setMaxDailyMinutes(validBudget(request.getMaxDailyMinutes()));
        }
        Provider saved = providerRepository.save(provider);
        LOGGER.info("Created provider {} ({}, {} min/day)", saved.getId(), saved.getRole(), saved.getMaxDailyMinutes());
        return saved;
    }

    @Transactional
    public Provider updateProvider(Long providerId, ProviderRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Provider data is required.");
        }
        Provider provider = findProvider(providerId);
        if (request.getName() != null && !request.getName().isBlank()) {
            provider.setName(request.getName().trim());
        }
        if (request.getRole() != null && !request.getRole().isBlank()) {
            provider.setRole(request.getRole().trim());
        }
        if (request.getColor() != null && !request.getColor().isBlank()) {
            provider.setColor(request.getColor().trim());
        }
        if (request.getMaxDailyMinutes() != null) {
            provider.setMaxDailyMinutes(validBudget(request.getMaxDailyMinutes()));
        }
        return providerRepository.save(provider);
    }

    /**
     * Deletes the provider only. Patients keep their provider ids and show up as unassigned
     * until somebody reassigns them.
     */
    @Transactional
    public void deleteProvider(Long providerId) {
        Provider provider = findProvider(providerId);
        List<Patient> affected = patientRepository.findByPrimaryProviderIdOrOverrideProviderId(providerId, providerId);
        providerRepository.delete(provider);
        if (!affected.isEmpty()) {
            LOGGER.warn("Deleted provider {}; {} patient(s) still reference it and are now unassigned",
                    providerId, affected.size());
        } else {
            LOGGER.info("Deleted provider {}", providerId);
        }
    }

    private Provider findProvider(Long providerId) {
        if (providerId == null) {
            throw new IllegalArgumentException("Provider id is required.");
        }
        return providerRepository.findById(providerId)
                .orElseThrow(() -> new ProviderNotFoundException(providerId));
    }

    private int validBudget(int minutes) {
        if (minutes < 0) {
            throw new IllegalArgumentException("Daily budget must not be negative: " + minutes);
        }
        return minutes;
    }
}
