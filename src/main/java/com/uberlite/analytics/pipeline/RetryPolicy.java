package com.uberlite.analytics.pipeline;

import com.uberlite.analytics.config.RetrySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Bounded exponential backoff for transport and sink calls.
 *
 * Backoff starts at {@code initialBackoffMs}, doubles per failed attempt and is
 * capped at {@code maxBackoffMs}; the actual sleep is jittered into
 * [backoff/2, backoff]. After {@code budget} failed attempts the last failure is
 * rethrown as {@link RetryBudgetExhaustedException}.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Operation<T> {
        T call() throws TransientIOException;
    }

    @FunctionalInterface
    public interface VoidOperation {
        void run() throws TransientIOException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    /** Uniform in [backoff/2, backoff]. */
    static final LongUnaryOperator HALF_JITTER =
        b -> b <= 1 ? b : ThreadLocalRandom.current().nextLong(b / 2, b + 1);

    private final RetrySettings     settings;
    private final Sleeper           sleeper;
    private final LongUnaryOperator jitter;

    public RetryPolicy(RetrySettings settings) {
        this(settings, Thread::sleep, HALF_JITTER);
    }

    public RetryPolicy(RetrySettings settings, Sleeper sleeper, LongUnaryOperator jitter) {
        this.settings = settings;
        this.sleeper  = sleeper;
        this.jitter   = jitter;
    }

    public <T> T execute(String operation, Operation<T> op, Runnable onRetry) {
        long backoff = settings.initialBackoffMs();
        for (int attempt = 1; ; attempt++) {
            try {
                return op.call();
            } catch (TransientIOException e) {
                if (attempt >= settings.budget()) {
                    log.error("{} failed after {} attempts, giving up", operation, attempt, e);
                    throw new RetryBudgetExhaustedException(operation, attempt, e);
                }
                long sleepMs = jitter.applyAsLong(backoff);
                log.warn("{} failed (attempt {}/{}): {}; retrying in {}ms",
                         operation, attempt, settings.budget(), e.getMessage(), sleepMs);
                onRetry.run();
                pause(operation, sleepMs);
                backoff = Math.min(backoff * 2, settings.maxBackoffMs());
            }
        }
    }

    public void run(String operation, VoidOperation op, Runnable onRetry) {
        execute(operation, () -> {
            op.run();
            return null;
        }, onRetry);
    }

    private void pause(String operation, long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalPipelineException("Interrupted while retrying " + operation, e);
        }
    }
}
