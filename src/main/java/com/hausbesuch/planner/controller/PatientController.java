package com.hausbesuch.planner.controller;

import com.hausbesuch.planner.dto.OverrideRequest;
import com.hausbesuch.planner.dto.PatientRequest;
import com.hausbesuch.planner.dto.PatientUpdateRequest;
import com.hausbesuch.planner.exception.PatientNotFoundException;
import com.hausbesuch.planner.exception.ProviderNotFoundException;
import com.hausbesuch.planner.exception.VisitPlannerException;
import com.hausbesuch.planner.service.PatientService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/patients")
public class PatientController {

    private static final Logger LOGGER = LoggerFactory.getLogger(PatientController.class);

    private final PatientService patientService;

    public PatientController(PatientService patientService) {
        this.patientService = patientService;
    }

    @GetMapping
    public ResponseEntity<?> listPatients() {
        return handle(() -> ResponseEntity.ok(patientService.listPatients()));
    }

    @GetMapping("/{patientId}")
    public ResponseEntity<?> getPatient(@PathVariable Long patientId) {
        return handle(() -> ResponseEntity.ok(patientService.getPatient(patientId)));
    }

    @PostMapping
    public ResponseEntity<?> createPatient(@Valid @RequestBody PatientRequest request) {
        return handle(() -> ResponseEntity.status(201).body(patientService.createPatient(request)));
    }

    @PutMapping("/{patientId}")
    public ResponseEntity<?> updatePatient(@PathVariable Long patientId,
                                           @Valid @RequestBody PatientUpdateRequest request) {
        return handle(() -> ResponseEntity.ok(patientService.updatePatient(patientId, request)));
    }

    @DeleteMapping("/{patientId}")
    public ResponseEntity<?> deletePatient(@PathVariable Long patientId) {
        return handle(() -> {
            patientService.deletePatient(patientId);
            return ResponseEntity.ok(Map.of("message", "Patient deleted"));
        });
    }

    @PostMapping("/{patientId}/schedule")
    public ResponseEntity<?> schedulePatient(@PathVariable Long patientId,
                                             @RequestParam(name = "date", required = false)
                                             @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return handle(() -> ResponseEntity.ok(patientService.schedule(patientId, date)));
    }

    @PostMapping("/{patientId}/unschedule")
    public ResponseEntity<?> unschedulePatient(@PathVariable Long patientId) {
        return handle(() -> ResponseEntity.ok(patientService.unschedule(patientId)));
    }

    @PutMapping("/{patientId}/override")
    public ResponseEntity<?> overrideProvider(@PathVariable Long patientId,
                                              @RequestBody OverrideRequest request) {
        return handle(() -> ResponseEntity.ok(
                patientService.setOverride(patientId, request.getProviderId(), request.isPermanent())));
    }

    @PostMapping("/{patientId}/visit")
    public ResponseEntity<?> completeVisit(@PathVariable Long patientId,
                                           @RequestParam(name = "confirm", defaultValue = "false") boolean confirm) {
        return handle(() -> ResponseEntity.ok(patientService.completeVisit(patientId, confirm)));
    }

    private ResponseEntity<?> handle(Supplier<ResponseEntity<?>> action) {
        try {
            return action.get();
        } catch (PatientNotFoundException | ProviderNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (VisitPlannerException e) {
            return ResponseEntity.status(409).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            LOGGER.error("Patient request failed", e);
            return ResponseEntity.status(500)
                    .body(Map.of("error", "Internal server error: " + e.getMessage()));
        }
    }
}
