package com.uberlite.analytics.pipeline;

public class RetryBudgetExhaustedException extends FatalPipelineException {

    private final String operation;
    private final int attempts;

    public RetryBudgetExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super("Retry budget exhausted for '" + operation + "' after " + attempts + " attempts: "
              + lastFailure.getMessage(), lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
