package com.hausbesuch.planner.dto;

import lombok.Data;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Options for a single planning run. Nothing here is persisted.
 */
@Data
public class PlanningOptionsRequest {
    // defaults to the server's current date
    private LocalDate date;

    // provider id -> "car" | "bike" | "walk"
    private Map<Long, String> transportModes = new HashMap<>();

    // provider id -> minutes available today
    private Map<Long, Integer> budgetOverrides = new HashMap<>();
}
