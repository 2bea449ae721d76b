package com.hausbesuch.planner.dto;

import com.hausbesuch.planner.service.PatientService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.LocalDate;

@Data
public class PatientRequest {
    @NotBlank
    private String firstName;

    @NotBlank
    private String lastName;

    @NotBlank
    private String address;

    @Min(0)
    private Integer intervalDays = 0;

    @Min(1)
    @Max(PatientService.MAX_VISIT_DURATION_MINUTES)
    private Integer visitDurationMinutes = 30;

    private Long primaryProviderId;

    // only meaningful for one-time patients
    private LocalDate plannedVisitDate;

    private Double latitude;

    private Double longitude;
}
