package peopleops.compensation.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import peopleops.compensation.data.models.ScheduledJob;
import peopleops.compensation.jobs.ClaimedJob;
import peopleops.compensation.jobs.JobUpdate;
import peopleops.compensation.jobs.RetryPolicy;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the outcome of one job back to the store.
 *
 * <p>
 * Every write runs in its own {@code REQUIRES_NEW} transaction and only touches the row if it is still RUNNING under
 * the claim's {@code lock_id}. A row that was reclaimed or already committed is left alone and reported as not
 * committed, which makes repeated commits for the same claim harmless.
 */
@ApplicationScoped
public class JobOutcomeCommitter {

    private static final Logger LOG = Logger.getLogger(JobOutcomeCommitter.class);

    @Inject
    RetryPolicy retryPolicy;

    /**
     * Result of a guarded commit.
     *
     * @param committed
     *            false if the guard matched no row
     * @param deadLettered
     *            true if this failure moved the job to the dead-letter queue
     * @param failureCount
     *            failure count after the commit
     */
    public record CommitResult(boolean committed, boolean deadLettered, int failureCount) {

        static CommitResult stale(int failureCount) {
            return new CommitResult(false, false, failureCount);
        }
    }

    /**
     * Applies a handler's partial update and releases the job.
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public CommitResult commitSuccess(ClaimedJob job, JobUpdate update) {
        ScheduledJob row = ScheduledJob.findLockedForCommit(job.id(), job.lockId());
        if (row == null) {
            LOG.debugf("Job %s no longer held by lock %s, success not committed", job.id(), job.lockId());
            return CommitResult.stale(job.failureCount());
        }

        if (update.queueName() != null) {
            row.queueName = update.queueName();
        }
        if (update.scheduled() != null) {
            row.scheduled = update.scheduled();
        }
        if (update.data() != null) {
            row.data = new LinkedHashMap<>(update.data());
        }
        row.release(Instant.now());

        LOG.debugf("Committed success for job %s (queue: %s, scheduled: %s)", row.id, row.queueName, row.scheduled);
        return new CommitResult(true, false, row.failureCount);
    }

    /**
     * Records one handler failure, dead-lettering the job once the threshold is reached.
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public CommitResult commitFailure(ClaimedJob job, Exception error) {
        ScheduledJob row = ScheduledJob.findLockedForCommit(job.id(), job.lockId());
        if (row == null) {
            LOG.debugf("Job %s no longer held by lock %s, failure not committed", job.id(), job.lockId());
            return CommitResult.stale(job.failureCount());
        }

        int next = retryPolicy.nextFailureCount(row.failureCount);
        boolean deadLetter = retryPolicy.isExhausted(next);
        row.recordFailure(next, deadLetter, Instant.now());

        LOG.debugf("Committed failure %d/%d for job %s: %s", next, retryPolicy.failureThreshold(), row.id,
                error != null ? error.getMessage() : "unknown");
        return new CommitResult(true, deadLetter, next);
    }

    /**
     * Result data reported to the trigger caller for a failed job.
     */
    public static Map<String, Object> failureData(CommitResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("failure_count", result.failureCount());
        if (result.deadLettered()) {
            data.put("dead_lettered", true);
        }
        if (!result.committed()) {
            data.put("committed", false);
        }
        return data;
    }
}
