package com.hausbesuch.planner.dto;

import com.hausbesuch.planner.model.Patient;

/**
 * Outcome of recording a visit. {@code patient} is {@code null} when the record was deleted.
 */
public record VisitCompletionResponse(Long patientId, boolean deleted, Patient patient) {
}
