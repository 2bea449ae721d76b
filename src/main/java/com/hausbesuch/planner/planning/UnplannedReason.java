package com.hausbesuch.planner.planning;

public enum UnplannedReason {
    /** No provider id on the patient resolves to an existing provider. */
    UNASSIGNED,
    /** Beyond the radius of the assigned provider's transport mode. */
    OUT_OF_RADIUS
}
