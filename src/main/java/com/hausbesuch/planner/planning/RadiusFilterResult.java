package com.hausbesuch.planner.planning;

import com.hausbesuch.planner.model.Patient;

import java.util.List;

public record RadiusFilterResult(List<Patient> kept, List<Patient> relocated) {
}
