package com.uberlite.analytics.pipeline;

/**
 * Base for errors that stop the pipeline. The message is the halt reason
 * surfaced on {@code /health} and in the logs.
 */
public class FatalPipelineException extends RuntimeException {

    public FatalPipelineException(String message) {
        super(message);
    }

    public FatalPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
