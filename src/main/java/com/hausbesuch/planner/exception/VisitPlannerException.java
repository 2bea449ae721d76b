package com.hausbesuch.planner.exception;

public class VisitPlannerException extends RuntimeException {
    public VisitPlannerException(String message) {
        super(message);
    }

    public VisitPlannerException(String message, Throwable cause) {
        super(message, cause);
    }
}
