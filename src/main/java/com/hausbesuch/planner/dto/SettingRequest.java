package com.hausbesuch.planner.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SettingRequest {
    @NotNull
    private String value;
}
