package com.uberlite.analytics.config;

/**
 * UPDATE emits a provisional snapshot whenever a window changes plus a final row;
 * APPEND emits the final row only.
 */
public enum EmissionMode {
    UPDATE,
    APPEND
}
