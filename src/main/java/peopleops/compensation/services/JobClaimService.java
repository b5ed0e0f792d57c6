package peopleops.compensation.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import peopleops.compensation.data.models.ScheduledJob;
import peopleops.compensation.jobs.ClaimedJob;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Atomically claims due jobs for one trigger invocation and reclaims jobs whose claimant went away.
 *
 * <p>
 * <b>Claim protocol:</b> inside a single transaction, up to {@code limit} due AVAILABLE rows are selected oldest first
 * with {@code FOR UPDATE SKIP LOCKED}, then flipped to RUNNING under a fresh {@code lock_id} by an update that
 * re-checks {@code state = AVAILABLE}. Concurrent invocations therefore never receive the same row, and rows locked by
 * another claimant are skipped instead of waited on.
 *
 * <p>
 * Store failures propagate as {@link jakarta.persistence.PersistenceException} and abort the whole cycle.
 */
@ApplicationScoped
public class JobClaimService {

    private static final Logger LOG = Logger.getLogger(JobClaimService.class);

    /**
     * Claims up to {@code limit} due jobs under {@code lockId}.
     *
     * @param lockId
     *            claim token for this invocation
     * @param limit
     *            batch size
     * @return snapshots of the claimed rows ordered by scheduled time, empty when nothing is due
     */
    @Transactional
    public List<ClaimedJob> claimDueJobs(UUID lockId, int limit) {
        Instant now = Instant.now();
        List<UUID> ids = ScheduledJob.lockDueJobs(now, limit).stream().map(job -> job.id).toList();
        if (ids.isEmpty()) {
            LOG.debugf("No due jobs to claim (lock: %s)", lockId);
            return List.of();
        }

        int claimed = ScheduledJob.markRunning(ids, lockId, now);
        // Bulk update bypasses the persistence context; drop the stale AVAILABLE copies before reloading.
        ScheduledJob.getEntityManager().clear();

        List<ClaimedJob> jobs = ScheduledJob.findByLockId(lockId).stream().map(ScheduledJob::toClaimedJob).toList();
        LOG.infof("Claimed %d of %d due jobs (lock: %s)", claimed, ids.size(), lockId);
        return jobs;
    }

    /**
     * Returns RUNNING jobs whose heartbeat is older than {@code livenessWindow} to AVAILABLE.
     *
     * <p>
     * The failure count is left unchanged: a crashed claimant is not a handler failure.
     *
     * @return number of jobs released
     */
    @Transactional
    public int reclaimStaleJobs(Duration livenessWindow) {
        Instant now = Instant.now();
        Instant cutoff = now.minus(livenessWindow);
        int released = ScheduledJob.releaseStale(cutoff, now);
        if (released > 0) {
            LOG.warnf("Reclaimed %d RUNNING jobs with heartbeat older than %s", released, cutoff);
        } else {
            LOG.debugf("No stale RUNNING jobs older than %s", cutoff);
        }
        return released;
    }
}
