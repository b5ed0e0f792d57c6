package peopleops.compensation.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import peopleops.compensation.config.JobQueueConfig;
import peopleops.compensation.observability.JobQueueMetrics;
import peopleops.compensation.services.JobClaimService;

/**
 * Periodically returns RUNNING jobs whose claimant stopped heartbeating to AVAILABLE.
 *
 * <p>
 * Covers trigger invocations that crashed or timed out between claim and commit, and claimed jobs skipped for lack of
 * a handler. Interval: {@code compensation.jobs.reclaim-interval} (5m by default). Disable with
 * {@code compensation.jobs.reclaim-enabled=false}.
 */
@ApplicationScoped
public class StaleJobReclaimScheduler {

    private static final Logger LOG = Logger.getLogger(StaleJobReclaimScheduler.class);

    @Inject
    JobClaimService claimService;

    @Inject
    JobQueueConfig config;

    @Inject
    JobQueueMetrics metrics;

    @Scheduled(
            every = "${compensation.jobs.reclaim-interval:5m}",
            identity = "stale-job-reclaim",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleReclaim() {
        reclaim();
    }

    /**
     * Runs one reclaim sweep.
     *
     * @return number of jobs released, 0 when disabled
     */
    public int reclaim() {
        if (!config.reclaimEnabled()) {
            LOG.debug("Stale job reclaim disabled");
            return 0;
        }
        int released = claimService.reclaimStaleJobs(config.livenessWindow());
        metrics.recordReclaimed(released);
        return released;
    }
}
