package com.uberlite.analytics.config;

import com.uberlite.analytics.pipeline.ConfigException;

/**
 * @param budget maximum attempts per operation, including the first one
 */
public record RetrySettings(int budget, long initialBackoffMs, long maxBackoffMs) {

    public RetrySettings {
        if (budget < 1) {
            throw new ConfigException("analytics.retry.budget", "must be at least 1, got " + budget);
        }
        if (initialBackoffMs <= 0) {
            throw new ConfigException("analytics.retry.initial-backoff-ms", "must be positive, got " + initialBackoffMs);
        }
        if (maxBackoffMs < initialBackoffMs) {
            throw new ConfigException("analytics.retry.max-backoff-ms", "must be >= initial-backoff-ms, got " + maxBackoffMs);
        }
    }
}
