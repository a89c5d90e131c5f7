package com.uberlite.analytics.model;

/**
 * Why a raw event was turned away by the normalizer.
 * Declaration order is the order in which the checks run.
 */
public enum RejectionReason {
    INVALID_TIMESTAMP,
    INVALID_LOCATION,
    INVALID_FARE,
    INVALID_STATUS,
    MISSING_IDENTIFIER
}
