package com.uberlite.analytics.pipeline;

/**
 * Transport or sink failure worth retrying (broker unreachable, request timeout).
 */
public class TransientIOException extends Exception {

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
