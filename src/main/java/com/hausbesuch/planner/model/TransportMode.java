package com.hausbesuch.planner.model;

import java.util.Locale;

public enum TransportMode {
    CAR,
    BIKE,
    WALK;

    /**
     * Lenient parse used for per-run options; anything unknown falls back to {@link #CAR}.
     */
    public static TransportMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return CAR;
        }
        try {
            return TransportMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CAR;
        }
    }
}
