package com.hausbesuch.planner.planning;

public enum DueStatus {
    DUE,
    NOT_DUE,
    SNOOZED,
    INVALID_DATES
}
