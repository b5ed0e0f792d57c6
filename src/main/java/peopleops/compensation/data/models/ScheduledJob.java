package peopleops.compensation.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.LockModeType;
import jakarta.persistence.Table;
import org.hibernate.LockOptions;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jboss.logging.Logger;
import peopleops.compensation.jobs.ClaimedJob;
import peopleops.compensation.jobs.JobQueueName;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Panache entity for the database-backed background job queue.
 *
 * <p>
 * Every background task (keeper test send, keeper test reminder) is one row in {@code scheduled_jobs}. Pollers claim
 * due rows atomically, handlers execute them outside the claim transaction, and the outcome is written back under a
 * {@code lock_id} guard so a late commit can never overwrite a row that has since been reclaimed.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier, assigned at creation</li>
 * <li>{@code created} (TIMESTAMPTZ) - Creation timestamp, immutable</li>
 * <li>{@code scheduled} (TIMESTAMPTZ) - Earliest time the job may be claimed</li>
 * <li>{@code queue_name} (TEXT) - Handler tag ({@link JobQueueName#tag()}); kept as text so unknown tags still
 * load</li>
 * <li>{@code state} (TEXT) - AVAILABLE, RUNNING, COMPLETED, DEAD_LETTERED</li>
 * <li>{@code lock_id} (UUID) - Claiming invocation token, non-null only while RUNNING</li>
 * <li>{@code last_heartbeat} (TIMESTAMPTZ) - Touched on every state change, read by the reclaim sweep</li>
 * <li>{@code data} (JSON) - Payload, shape defined by the queue name</li>
 * <li>{@code failure_count} (INT) - Handler failures so far</li>
 * </ul>
 *
 * @see JobQueueName for queue tags and their payload types
 * @see peopleops.compensation.services.JobClaimService for the claim and reclaim operations
 * @see peopleops.compensation.services.JobOutcomeCommitter for guarded outcome writes
 */
@Entity
@Table(
        name = "scheduled_jobs",
        indexes = {@Index(
                name = "idx_scheduled_jobs_state_scheduled",
                columnList = "state, scheduled")})
public class ScheduledJob extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(ScheduledJob.class);

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "created",
            nullable = false,
            updatable = false)
    public Instant created;

    @Column(
            name = "scheduled",
            nullable = false)
    public Instant scheduled;

    @Column(
            name = "queue_name",
            nullable = false)
    public String queueName;

    @Column(
            name = "state",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobState state;

    @Column(
            name = "lock_id")
    public UUID lockId;

    @Column(
            name = "last_heartbeat")
    public Instant lastHeartbeat;

    @Column(
            name = "data",
            nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> data;

    @Column(
            name = "failure_count",
            nullable = false)
    public int failureCount;

    /**
     * Job lifecycle states.
     */
    public enum JobState {
        /**
         * Waiting for its scheduled time, claimable once due.
         */
        AVAILABLE,

        /**
         * Claimed by a poll invocation and being executed.
         */
        RUNNING,

        /**
         * Retired by its owner (keeper test submitted). Terminal.
         */
        COMPLETED,

        /**
         * Failure threshold reached. Terminal, kept for audit only.
         */
        DEAD_LETTERED
    }

    /**
     * Creates and persists a new job.
     *
     * @param queue
     *            the handler tag
     * @param data
     *            payload (serialized as JSON)
     * @param scheduled
     *            earliest execution time
     * @return persisted ScheduledJob entity
     */
    public static ScheduledJob create(JobQueueName queue, Map<String, Object> data, Instant scheduled) {
        return create(queue.tag(), data, scheduled);
    }

    /**
     * Creates and persists a new job for a raw queue tag.
     *
     * <p>
     * Used by tests and data repair scripts to insert rows whose tag has no handler.
     */
    public static ScheduledJob create(String queueName, Map<String, Object> data, Instant scheduled) {
        Instant now = Instant.now();

        ScheduledJob job = new ScheduledJob();
        job.id = UUID.randomUUID();
        job.created = now;
        job.scheduled = scheduled;
        job.queueName = queueName;
        job.state = JobState.AVAILABLE;
        job.lockId = null;
        job.lastHeartbeat = now;
        job.data = data;
        job.failureCount = 0;

        job.persist();
        LOG.infof("Created job %s (queue: %s, scheduled: %s)", job.id, queueName, scheduled);
        return job;
    }

    /**
     * Selects and row-locks up to {@code limit} due jobs, oldest {@code scheduled} first.
     *
     * <p>
     * Rows already locked by another transaction are skipped rather than waited on. Must be called inside a
     * transaction; the locks are held until it ends.
     *
     * @param now
     *            the due-time cut-off
     * @param limit
     *            max rows to lock
     * @return locked rows in ascending {@code scheduled} order
     */
    public static List<ScheduledJob> lockDueJobs(Instant now, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return find("state = ?1 and scheduled <= ?2", Sort.ascending("scheduled"), JobState.AVAILABLE, now)
                .withLock(LockModeType.PESSIMISTIC_WRITE)
                .withHint("jakarta.persistence.lock.timeout", LockOptions.SKIP_LOCKED).page(0, limit).list();
    }

    /**
     * Marks the given rows RUNNING under {@code lockId}, but only those still AVAILABLE.
     *
     * @return number of rows claimed
     */
    public static int markRunning(List<UUID> ids, UUID lockId, Instant now) {
        if (ids.isEmpty()) {
            return 0;
        }
        return update("state = ?1, lockId = ?2, lastHeartbeat = ?3 where id in ?4 and state = ?5", JobState.RUNNING,
                lockId, now, ids, JobState.AVAILABLE);
    }

    /**
     * Finds all jobs currently held by a claim token, ordered by scheduled time.
     */
    public static List<ScheduledJob> findByLockId(UUID lockId) {
        if (lockId == null) {
            return List.of();
        }
        return list("lockId = ?1 and state = ?2", Sort.ascending("scheduled"), lockId, JobState.RUNNING);
    }

    /**
     * Loads and row-locks a job only if it is still RUNNING under the given claim token.
     *
     * @return the locked job, or null if it was released or reclaimed since the claim
     */
    public static ScheduledJob findLockedForCommit(UUID id, UUID lockId) {
        return find("id = ?1 and lockId = ?2 and state = ?3", id, lockId, JobState.RUNNING)
                .withLock(LockModeType.PESSIMISTIC_WRITE).firstResult();
    }

    /**
     * Loads and row-locks a job regardless of its state or claim, for retirement.
     *
     * @return the locked job, or null if no such id exists
     */
    public static ScheduledJob findForRetire(UUID id) {
        return findById(id, LockModeType.PESSIMISTIC_WRITE);
    }

    /**
     * Returns RUNNING jobs whose heartbeat is older than {@code cutoff} to AVAILABLE.
     *
     * @return number of rows released
     */
    public static int releaseStale(Instant cutoff, Instant now) {
        return update("state = ?1, lockId = null, lastHeartbeat = ?2 where state = ?3 and lastHeartbeat < ?4",
                JobState.AVAILABLE, now, JobState.RUNNING, cutoff);
    }

    /**
     * Finds dead-lettered jobs, most recently touched first.
     */
    public static List<ScheduledJob> findDeadLettered() {
        return list("state", Sort.descending("lastHeartbeat"), JobState.DEAD_LETTERED);
    }

    /**
     * Counts jobs in a given state.
     */
    public static long countByState(JobState state) {
        if (state == null) {
            return 0L;
        }
        return count("state", state);
    }

    /**
     * Releases this job back to AVAILABLE after a successful run.
     */
    public void release(Instant now) {
        this.state = JobState.AVAILABLE;
        this.lockId = null;
        this.lastHeartbeat = now;
    }

    /**
     * Records a failed run. The job stays claimable until the threshold moves it to the dead-letter queue.
     *
     * @param nextFailureCount
     *            the incremented failure count
     * @param deadLetter
     *            whether the failure threshold has been reached
     */
    public void recordFailure(int nextFailureCount, boolean deadLetter, Instant now) {
        this.failureCount = nextFailureCount;
        this.lockId = null;
        this.lastHeartbeat = now;
        if (deadLetter) {
            this.state = JobState.DEAD_LETTERED;
            this.queueName = JobQueueName.DEAD_LETTER.tag();
            LOG.warnf("Job %s dead-lettered after %d failures", this.id, nextFailureCount);
        } else {
            this.state = JobState.AVAILABLE;
        }
    }

    /**
     * Retires this job. Clearing the lock makes any in-flight outcome commit for it a no-op.
     *
     * @return false if the job was already terminal and nothing changed
     */
    public boolean complete(Instant now) {
        if (state == JobState.COMPLETED || state == JobState.DEAD_LETTERED) {
            return false;
        }
        this.state = JobState.COMPLETED;
        this.lockId = null;
        this.lastHeartbeat = now;
        LOG.infof("Job %s (queue: %s) completed", this.id, this.queueName);
        return true;
    }

    /**
     * Immutable snapshot handed to handlers once the claim transaction has committed.
     */
    public ClaimedJob toClaimedJob() {
        return new ClaimedJob(id, queueName, scheduled, created, lockId,
                data != null ? new LinkedHashMap<>(data) : Map.of(), failureCount);
    }
}
