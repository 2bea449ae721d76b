package com.hausbesuch.planner.exception;

public class PatientNotFoundException extends RuntimeException {
    public PatientNotFoundException(Long patientId) {
        super("Patient not found: " + patientId);
    }
}
