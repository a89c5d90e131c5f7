package com.uberlite.analytics.model;

import java.util.Objects;

/**
 * Outcome of normalizing one raw event: exactly one of {@code event} and
 * {@code reason} is non-null.
 */
public record NormalizationResult(NormalizedEvent event, RejectionReason reason) {

    public NormalizationResult {
        if ((event == null) == (reason == null)) {
            throw new IllegalArgumentException("exactly one of event and reason must be set");
        }
    }

    public static NormalizationResult accepted(NormalizedEvent event) {
        return new NormalizationResult(Objects.requireNonNull(event), null);
    }

    public static NormalizationResult rejected(RejectionReason reason) {
        return new NormalizationResult(null, Objects.requireNonNull(reason));
    }

    public boolean isAccepted() {
        return event != null;
    }
}
