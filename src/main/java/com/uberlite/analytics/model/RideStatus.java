package com.uberlite.analytics.model;

import java.util.Locale;
import java.util.Optional;

/** Lifecycle state of a ride as reported by the producer. */
public enum RideStatus {
    REQUESTED,
    ACCEPTED,
    STARTED,
    COMPLETED,
    CANCELLED;

    /**
     * Case-insensitive lookup. The producer emits upper-case symbols,
     * other collaborators use lower case.
     */
    public static Optional<RideStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static boolean isCompleted(String raw) {
        return parse(raw).filter(s -> s == COMPLETED).isPresent();
    }
}
