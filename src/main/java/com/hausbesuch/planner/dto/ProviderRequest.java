package com.hausbesuch.planner.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class ProviderRequest {
    private String name;

    private String role;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$")
    private String color;

    @Min(0)
    private Integer maxDailyMinutes;
}
