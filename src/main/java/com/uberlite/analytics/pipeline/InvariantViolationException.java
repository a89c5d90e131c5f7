package com.uberlite.analytics.pipeline;

/**
 * An internal invariant no valid input can break, e.g. a watermark moving
 * backwards or a snapshot with more completed rides than events.
 */
public class InvariantViolationException extends FatalPipelineException {

    public InvariantViolationException(String message) {
        super("Internal invariant violated: " + message);
    }
}
