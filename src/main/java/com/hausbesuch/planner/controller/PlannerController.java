package com.hausbesuch.planner.controller;

import com.hausbesuch.planner.dto.PlanningOptionsRequest;
import com.hausbesuch.planner.service.PlannerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Map;

@RestController
@RequestMapping("/api/planner")
public class PlannerController {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlannerController.class);

    private final PlannerService plannerService;

    public PlannerController(PlannerService plannerService) {
        this.plannerService = plannerService;
    }

    @GetMapping("/today")
    public ResponseEntity<?> getTodaysPlan(@RequestParam(name = "date", required = false)
                                           @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        PlanningOptionsRequest options = new PlanningOptionsRequest();
        options.setDate(date);
        return plan(options);
    }

    @PostMapping("/today")
    public ResponseEntity<?> planToday(@RequestBody(required = false) PlanningOptionsRequest options) {
        return plan(options);
    }

    private ResponseEntity<?> plan(PlanningOptionsRequest options) {
        try {
            return ResponseEntity.ok(plannerService.planFor(options));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            LOGGER.error("Planning failed", e);
            return ResponseEntity.status(500).body(Map.of("error", "Planning failed: " + e.getMessage()));
        }
    }
}
