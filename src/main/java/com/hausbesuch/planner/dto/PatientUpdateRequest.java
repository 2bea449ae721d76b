package com.hausbesuch.planner.dto;

import com.hausbesuch.planner.service.PatientService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class PatientUpdateRequest {
    private String firstName;
    private String lastName;
    private String address;

    @Min(0)
    private Integer intervalDays;

    @Min(1)
    @Max(PatientService.MAX_VISIT_DURATION_MINUTES)
    private Integer visitDurationMinutes;

    private Long primaryProviderId;
    private Double latitude;
    private Double longitude;
}
