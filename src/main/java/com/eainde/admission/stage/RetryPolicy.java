package com.eainde.admission.stage;

import com.eainde.admission.config.AdmissionProperties;
import com.eainde.admission.exception.StageExecutionException;
import com.eainde.admission.model.ApplicationStage;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff around idempotent backing calls.
 *
 * <p>A {@link StageExecutionException} thrown by the call is a final verdict and is not
 * retried. Any other runtime failure is retried until {@code maxAttempts} is reached and
 * then reported as a {@link StageExecutionException} for the given stage.</p>
 */
@Log4j2
public class RetryPolicy {

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        this(maxAttempts, initialBackoff, multiplier, maxBackoff, d -> Thread.sleep(d.toMillis()));
    }

    RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
        this.sleeper = sleeper;
    }

    public static RetryPolicy from(AdmissionProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(),
                retry.getMultiplier(), retry.getMaxBackoff());
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    public <T> T execute(ApplicationStage stage, String operation, Supplier<T> call) {
        Duration backoff = initialBackoff;
        RuntimeException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (StageExecutionException e) {
                throw e;
            } catch (RuntimeException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, backoff.toMillis(), e.getMessage());
                pause(stage, operation, backoff);
                backoff = next(backoff);
            }
        }
        throw new StageExecutionException(stage,
                operation + " failed after " + maxAttempts + " attempts: " + last.getMessage(), last);
    }

    private void pause(ApplicationStage stage, String operation, Duration backoff) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageExecutionException(stage, operation + " interrupted while backing off", e);
        }
    }

    private Duration next(Duration current) {
        long millis = (long) (current.toMillis() * multiplier);
        Duration grown = Duration.ofMillis(millis);
        return grown.compareTo(maxBackoff) > 0 ? maxBackoff : grown;
    }
}
