package com.hausbesuch.planner.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LocationUpdateRequest {
    @NotBlank
    private String address;

    @NotBlank
    private String city;
}
