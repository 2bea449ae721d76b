package com.hausbesuch.planner.service;

import com.hausbesuch.planner.dto.PatientRequest;
import com.hausbesuch.planner.dto.PatientUpdateRequest;
import com.hausbesuch.planner.dto.PatientWriteResponse;
import com.hausbesuch.planner.dto.VisitCompletionResponse;
import com.hausbesuch.planner.exception.PatientNotFoundException;
import com.hausbesuch.planner.exception.ProviderNotFoundException;
import com.hausbesuch.planner.exception.VisitPlannerException;
import com.hausbesuch.planner.model.Patient;
import com.hausbesuch.planner.planning.DueDateResolver;
import com.hausbesuch.planner.planning.GeoPoint;
import com.hausbesuch.planner.planning.ProviderAssignmentResolver;
import com.hausbesuch.planner.repository.PatientRepository;
import com.hausbesuch.planner.repository.ProviderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Service
public class PatientService {

    public static final int MAX_VISIT_DURATION_MINUTES = 24 * 60;

    private static final Logger LOGGER = LoggerFactory.getLogger(PatientService.class);

    private final PatientRepository patientRepository;
    private final ProviderRepository providerRepository;
    private final GeocodingService geocodingService;
    private final ProviderAssignmentResolver providerAssignmentResolver;
    private final DueDateResolver dueDateResolver;

    public PatientService(PatientRepository patientRepository,
                          ProviderRepository providerRepository,
                          GeocodingService geocodingService,
                          ProviderAssignmentResolver providerAssignmentResolver,
                          DueDateResolver dueDateResolver) {
        this.patientRepository = patientRepository;
        this.providerRepository = providerRepository;
        this.geocodingService = geocodingService;
        this.providerAssignmentResolver = providerAssignmentResolver;
        this.dueDateResolver = dueDateResolver;
    }

    /**
     * All patients, the ones due soonest first. Patients without a computable due date come last.
     */
    @Transactional(readOnly = true)
    public List<Patient> listPatients() {
        List<Patient> patients = new ArrayList<>(patientRepository.findAllByOrderByIdAsc());
        patients.sort(Comparator.comparing(dueDateResolver::nextDueDate,
                Comparator.nullsLast(Comparator.<LocalDate>naturalOrder())));
        return patients;
    }

    @Transactional(readOnly = true)
    public Patient getPatient(Long patientId) {
        return findPatient(patientId);
    }

    @Transactional
    public PatientWriteResponse createPatient(PatientRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Patient data is required.");
        }
        requireText(request.getFirstName(), "First name");
        requireText(request.getLastName(), "Last name");
        requireText(request.getAddress(), "Address");
        validateProvider(request.getPrimaryProviderId());

        Patient patient = new Patient();
        patient.setFirstName(request.getFirstName().trim());
        patient.setLastName(request.getLastName().trim());
        patient.setAddress(request.getAddress().trim());
        patient.setIntervalDays(validInterval(request.getIntervalDays() != null ? request.getIntervalDays() : 0));
        patient.setVisitDurationMinutes(validDuration(
                request.getVisitDurationMinutes() != null ? request.getVisitDurationMinutes() : 30));
        patient.setPrimaryProviderId(request.getPrimaryProviderId());
        patient.setPlannedVisitDate(request.getPlannedVisitDate());
        patient.setLastVisit(LocalDateTime.now());

        List<String> warnings = new ArrayList<>();
        GeoPoint manual = GeoPoint.ofNullable(request.getLatitude(), request.getLongitude());
        if (manual != null) {
            applyCoordinates(patient, manual);
        } else {
            geocodeInto(patient, warnings);
        }
        if (patient.isOneTime() && patient.getPlannedVisitDate() == null) {
            warnings.add("One-time patient has no planned visit date and will not appear in any plan.");
        }

        Patient saved = patientRepository.save(patient);
        LOGGER.info("Created patient {} (interval {} days, provider {})",
                saved.getId(), saved.getIntervalDays(), saved.getPrimaryProviderId());
        return new PatientWriteResponse(saved, warnings);
    }

    @Transactional
    public PatientWriteResponse updatePatient(Long patientId, PatientUpdateRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Patient data is required.");
        }
        Patient patient = findPatient(patientId);
        List<String> warnings = new ArrayList<>();

        if (request.getFirstName() != null && !request.getFirstName().isBlank()) {
            patient.setFirstName(request.getFirstName().trim());
        }
        if (request.getLastName() != null && !request.getLastName().isBlank()) {
            patient.setLastName(request.getLastName().trim());
        }
        if (request.getIntervalDays() != null) {
            patient.setIntervalDays(validInterval(request.getIntervalDays()));
        }
        if (request.getVisitDurationMinutes() != null) {
            patient.setVisitDurationMinutes(validDuration(request.getVisitDurationMinutes()));
        }
        if (request.getPrimaryProviderId() != null) {
            validateProvider(request.getPrimaryProviderId());
            patient.setPrimaryProviderId(request.getPrimaryProviderId());
        }

        GeoPoint manual = GeoPoint.ofNullable(request.getLatitude(), request.getLongitude());
        boolean addressChanged = request.getAddress() != null && !request.getAddress().isBlank()
                && !request.getAddress().trim().equals(patient.getAddress());
        if (addressChanged) {
            patient.setAddress(request.getAddress().trim());
        }
        if (manual != null) {
            applyCoordinates(patient, manual);
        } else if (addressChanged) {
            // old coordinates would point to the previous address
            patient.setLatitude(null);
            patient.setLongitude(null);
            geocodeInto(patient, warnings);
        }

        return new PatientWriteResponse(patientRepository.save(patient), warnings);
    }

    @Transactional
    public void deletePatient(Long patientId) {
        Patient patient = findPatient(patientId);
        patientRepository.delete(patient);
        LOGGER.info("Deleted patient {}", patientId);
    }

    /**
     * Plans the patient for {@code date} (today when {@code null}) and lifts any snooze.
     */
    @Transactional
    public Patient schedule(Long patientId, LocalDate date) {
        Patient patient = findPatient(patientId);
        patient.setPlannedVisitDate(date != null ? date : LocalDate.now());
        patient.setSnoozeUntil(null);
        return patientRepository.save(patient);
    }

    /**
     * Takes the patient off today's plan: the planned date is cleared and the patient is hidden
     * until tomorrow.
     */
    @Transactional
    public Patient unschedule(Long patientId) {
        Patient patient = findPatient(patientId);
        patient.setPlannedVisitDate(null);
        patient.setSnoozeUntil(LocalDate.now().plusDays(1));
        return patientRepository.save(patient);
    }

    /**
     * Sets or clears ({@code providerId == null}) the provider override of a patient.
     */
    @Transactional
    public Patient setOverride(Long patientId, Long providerId, boolean permanent) {
        Patient patient = findPatient(patientId);
        if (providerId == null) {
            patient.setOverrideProviderId(null);
            patient.setOverridePermanent(Boolean.FALSE);
        } else {
            validateProvider(providerId);
            patient.setOverrideProviderId(providerId);
            patient.setOverridePermanent(permanent);
        }
        LOGGER.info("Patient {} override set to {} (permanent={})", patientId, providerId, permanent);
        return patientRepository.save(patient);
    }

    /**
     * Records a completed visit.
     * <p>
     * A one-time patient is deleted, which cannot be undone, so the caller has to pass
     * {@code confirmDeletion}. A recurring patient gets a new last-visit timestamp, loses its
     * manual planning and snooze, and has its provider override resolved.
     */
    @Transactional
    public VisitCompletionResponse completeVisit(Long patientId, boolean confirmDeletion) {
        Patient patient = findPatient(patientId);
        if (patient.isOneTime()) {
            if (!confirmDeletion) {
                throw new VisitPlannerException(
                        "Completing the visit of one-time patient " + patientId
                                + " deletes the patient. Confirm the deletion to continue.");
            }
            patientRepository.delete(patient);
            LOGGER.info("One-time patient {} visited and removed", patientId);
            return new VisitCompletionResponse(patientId, true, null);
        }

        patient.setLastVisit(LocalDateTime.now());
        patient.setPlannedVisitDate(null);
        patient.setSnoozeUntil(null);
        providerAssignmentResolver.applyVisitCompletion(patient);
        Patient saved = patientRepository.save(patient);
        LOGGER.info("Visit of patient {} recorded, next due {}", patientId, dueDateResolver.nextDueDate(saved));
        return new VisitCompletionResponse(patientId, false, saved);
    }

    private Patient findPatient(Long patientId) {
        if (patientId == null) {
            throw new IllegalArgumentException("Patient id is required.");
        }
        return patientRepository.findById(patientId)
                .orElseThrow(() -> new PatientNotFoundException(patientId));
    }

    private void validateProvider(Long providerId) {
        if (providerId != null && !providerRepository.existsById(providerId)) {
            throw new ProviderNotFoundException(providerId);
        }
    }

    private void geocodeInto(Patient patient, List<String> warnings) {
        Optional<GeoPoint> location = geocodingService.resolve(patient.getAddress());
        if (location.isPresent()) {
            applyCoordinates(patient, location.get());
        } else {
            warnings.add("Address '" + patient.getAddress()
                    + "' could not be geocoded; the patient is planned without coordinates.");
        }
    }

    private void applyCoordinates(Patient patient, GeoPoint location) {
        patient.setLatitude(location.latitude());
        patient.setLongitude(location.longitude());
    }

    private int validInterval(int intervalDays) {
        if (intervalDays < 0) {
            throw new IllegalArgumentException("Interval must not be negative: " + intervalDays);
        }
        return intervalDays;
    }

    private int validDuration(int minutes) {
        if (minutes <= 0 || minutes > MAX_VISIT_DURATION_MINUTES) {
            throw new IllegalArgumentException("Visit duration must be between 1 and "
                    + MAX_VISIT_DURATION_MINUTES + " minutes: " + minutes);
        }
        return minutes;
    }

    private void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required.");
        }
    }
}
