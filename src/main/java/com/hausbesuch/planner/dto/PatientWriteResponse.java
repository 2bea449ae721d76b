package com.hausbesuch.planner.dto;

import com.hausbesuch.planner.model.Patient;

import java.util.List;

public record PatientWriteResponse(Patient patient, List<String> warnings) {
}
