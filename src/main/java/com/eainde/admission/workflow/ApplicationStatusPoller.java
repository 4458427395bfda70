package com.eainde.admission.workflow;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * Client-side polling until an application reaches a terminal stage. The interval
 * starts at {@code initialInterval} and doubles up to {@code maxInterval}.
 */
public class ApplicationStatusPoller {

    private final WorkflowOrchestrator orchestrator;
    private final Duration initialInterval;
    private final Duration maxInterval;
    private final Clock clock;

    public ApplicationStatusPoller(WorkflowOrchestrator orchestrator) {
        this(orchestrator, Duration.ofSeconds(2), Duration.ofSeconds(30), Clock.systemUTC());
    }

    public ApplicationStatusPoller(WorkflowOrchestrator orchestrator, Duration initialInterval,
                                   Duration maxInterval, Clock clock) {
        this.orchestrator = orchestrator;
        this.initialInterval = initialInterval;
        this.maxInterval = maxInterval;
        this.clock = clock;
    }

    /**
     * @throws TimeoutException if the application is not terminal within {@code timeout}
     */
    public ApplicationStatus awaitTerminal(String applicationId, Duration timeout)
            throws InterruptedException, TimeoutException {
        Instant deadline = clock.instant().plus(timeout);
        Duration interval = initialInterval;
        while (true) {
            ApplicationStatus status = orchestrator.getStatus(applicationId);
            if (status.isTerminal()) {
                return status;
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new TimeoutException("Application " + applicationId + " still in " + status.stage()
                        + " after " + timeout);
            }
            Thread.sleep(Math.max(1L, Math.min(interval.toMillis(), remaining.toMillis())));
            Duration doubled = interval.multipliedBy(2);
            interval = doubled.compareTo(maxInterval) > 0 ? maxInterval : doubled;
        }
    }
}
