package peopleops.compensation.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import peopleops.compensation.config.JobQueueConfig;

/**
 * Failure accounting for scheduled jobs.
 *
 * <p>
 * A failed job is retried on the next trigger with no backoff. Once the incremented failure count reaches the threshold
 * (5 by default) the job is dead-lettered. Failure counts only ever grow; success leaves them unchanged.
 */
@ApplicationScoped
public class RetryPolicy {

    private final int failureThreshold;

    @Inject
    public RetryPolicy(JobQueueConfig config) {
        this(config.failureThreshold());
    }

    public RetryPolicy(int failureThreshold) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
    }

    /**
     * Returns the failure count to persist after one more failure.
     */
    public int nextFailureCount(int currentFailureCount) {
        return currentFailureCount + 1;
    }

    /**
     * Whether a job with the given (already incremented) failure count must be dead-lettered.
     */
    public boolean isExhausted(int failureCount) {
        return failureCount >= failureThreshold;
    }

    public int failureThreshold() {
        return failureThreshold;
    }
}
