package com.hausbesuch.planner.dto;

import lombok.Data;

@Data
public class OverrideRequest {
    // null clears the override
    private Long providerId;

    private boolean permanent;
}
