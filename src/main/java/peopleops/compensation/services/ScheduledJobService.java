package peopleops.compensation.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import peopleops.compensation.api.types.JobResultType;
import peopleops.compensation.api.types.KeeperTestPayloadType;
import peopleops.compensation.config.JobQueueConfig;
import peopleops.compensation.data.models.ScheduledJob;
import peopleops.compensation.jobs.ClaimedJob;
import peopleops.compensation.jobs.JobHandler;
import peopleops.compensation.jobs.JobQueueName;
import peopleops.compensation.jobs.JobUpdate;
import peopleops.compensation.observability.JobQueueMetrics;
import peopleops.compensation.observability.LoggingConfig;
import peopleops.compensation.services.JobOutcomeCommitter.CommitResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central orchestrator for the scheduled job queue.
 *
 * <p>
 * One call to {@link #runCycle()} is one trigger invocation:
 * <ol>
 * <li>Generate a fresh {@code lock_id} and claim up to {@code compensation.jobs.batch-size} due jobs</li>
 * <li>Dispatch each claimed job to the handler registered for its queue name, concurrently on a bounded pool</li>
 * <li>Commit each outcome independently under the {@code lock_id} guard</li>
 * <li>Collect one {@link JobResultType} per dispatched job</li>
 * </ol>
 *
 * <p>
 * <b>Failure isolation:</b> a handler exception only affects its own job; it is logged, counted and committed as a
 * failure. A failing commit is logged and surfaces as a result with {@code commit_error}. Only a failing claim aborts
 * the cycle.
 *
 * <p>
 * <b>Unrecognized queue names:</b> jobs whose tag has no registered handler (including {@code dead_letter}) are
 * skipped without an outcome or a result entry. They stay RUNNING until the reclaim sweep returns them. Every skip is
 * logged at WARN and counted in {@code compensation_jobs_unrecognized_total}.
 *
 * @see JobHandler for the handler contract
 * @see JobClaimService for the claim protocol
 * @see JobOutcomeCommitter for guarded outcome writes
 */
@ApplicationScoped
public class ScheduledJobService {

    private static final Logger LOG = Logger.getLogger(ScheduledJobService.class);

    /**
     * Registry mapping queue name to handler. Populated once at startup.
     */
    private final Map<JobQueueName, JobHandler> handlerRegistry;

    @Inject
    JobClaimService claimService;

    @Inject
    JobOutcomeCommitter committer;

    @Inject
    JobQueueConfig config;

    @Inject
    JobQueueMetrics metrics;

    @Inject
    JobPayloadCodec payloadCodec;

    @Inject
    Tracer tracer;

    private ExecutorService workers;

    @Inject
    public ScheduledJobService(Instance<JobHandler> handlers) {
        this(handlers.stream().toList());
    }

    ScheduledJobService(List<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        LOG.infof("Initialized ScheduledJobService with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Builds a queue name to handler map.
     *
     * @throws IllegalStateException
     *             if two handlers register for the same queue name or a handler claims the dead-letter queue
     */
    private static Map<JobQueueName, JobHandler> buildHandlerRegistry(Iterable<JobHandler> handlers) {
        Map<JobQueueName, JobHandler> registry = new EnumMap<>(JobQueueName.class);
        for (JobHandler handler : handlers) {
            JobQueueName queue = handler.handlesQueue();
            if (queue == JobQueueName.DEAD_LETTER) {
                throw new IllegalStateException(
                        handler.getClass().getName() + " cannot handle the terminal dead_letter queue");
            }
            if (registry.containsKey(queue)) {
                throw new IllegalStateException("Duplicate handlers registered for queue " + queue.tag() + ": "
                        + registry.get(queue).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(queue, handler);
            LOG.debugf("Registered handler %s for queue %s", handler.getClass().getSimpleName(), queue.tag());
        }
        return registry;
    }

    @PostConstruct
    void startWorkers() {
        AtomicInteger threadCounter = new AtomicInteger();
        workers = Executors.newFixedThreadPool(config.handlerConcurrency(), runnable -> {
            Thread thread = new Thread(runnable, "job-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void stopWorkers() {
        if (workers == null) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Job workers did not finish within 30s, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    /**
     * Runs one claim-dispatch-commit cycle.
     *
     * @return one result per dispatched job, in claim order
     * @throws jakarta.persistence.PersistenceException
     *             if the claim could not run
     */
    public List<JobResultType> runCycle() {
        UUID lockId = UUID.randomUUID();
        Span span = tracer.spanBuilder("jobs.cycle").setAttribute("job.lock_id", lockId.toString()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setLockId(lockId);

            List<ClaimedJob> claimed = claimService.claimDueJobs(lockId, config.batchSize());
            metrics.recordClaimed(claimed.size());
            span.setAttribute("jobs.claimed", claimed.size());
            if (claimed.isEmpty()) {
                return List.of();
            }

            Context parent = Context.current();
            List<CompletableFuture<Optional<JobResultType>>> futures = new ArrayList<>(claimed.size());
            for (ClaimedJob job : claimed) {
                futures.add(CompletableFuture.supplyAsync(parent.wrapSupplier(() -> dispatch(job)), workers));
            }

            List<JobResultType> results = new ArrayList<>(claimed.size());
            for (CompletableFuture<Optional<JobResultType>> future : futures) {
                future.join().ifPresent(results::add);
            }

            long succeeded = results.stream().filter(JobResultType::success).count();
            LOG.infof("Job cycle finished: %d claimed, %d dispatched, %d succeeded", claimed.size(), results.size(),
                    succeeded);
            return results;

        } catch (RuntimeException e) {
            span.recordException(e);
            LOG.errorf(e, "Job cycle failed (lock: %s)", lockId);
            throw e;
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Executes one claimed job and commits its outcome. Never throws.
     *
     * @return empty if the job's queue name has no handler
     */
    Optional<JobResultType> dispatch(ClaimedJob job) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setJob(job.id(), job.lockId(), job.queueName());
        try {
            Optional<JobHandler> handler = JobQueueName.fromTag(job.queueName()).map(handlerRegistry::get);
            if (handler.isEmpty()) {
                LOG.warnf("Skipping job %s: no handler for queue name '%s'", job.id(), job.queueName());
                metrics.recordUnrecognized(job.queueName());
                return Optional.empty();
            }

            JobUpdate update;
            try {
                update = handler.get().execute(job);
            } catch (Exception e) {
                return Optional.of(commitFailure(job, e));
            }
            return Optional.of(commitSuccess(job, update));
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private JobResultType commitSuccess(ClaimedJob job, JobUpdate update) {
        try {
            CommitResult result = committer.commitSuccess(job, update);
            metrics.recordOutcome(job.queueName(),
                    result.committed() ? JobQueueMetrics.OUTCOME_SUCCESS : JobQueueMetrics.OUTCOME_STALE);
            Map<String, Object> data = update.toResultData();
            if (!result.committed()) {
                // The lock was lost, so the update above was never written.
                data.put("committed", false);
            }
            return new JobResultType(job.id(), true, data);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to commit success for job %s", job.id());
            return new JobResultType(job.id(), false, Map.of("commit_error", String.valueOf(e.getMessage())));
        }
    }

    private JobResultType commitFailure(ClaimedJob job, Exception error) {
        LOG.errorf(error, "Job %s (queue: %s) failed on attempt %d", job.id(), job.queueName(), job.failureCount() + 1);
        try {
            CommitResult result = committer.commitFailure(job, error);
            String outcome;
            if (!result.committed()) {
                outcome = JobQueueMetrics.OUTCOME_STALE;
            } else if (result.deadLettered()) {
                outcome = JobQueueMetrics.OUTCOME_DEAD_LETTERED;
            } else {
                outcome = JobQueueMetrics.OUTCOME_FAILURE;
            }
            metrics.recordOutcome(job.queueName(), outcome);
            return new JobResultType(job.id(), false, JobOutcomeCommitter.failureData(result));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to commit failure for job %s", job.id());
            return new JobResultType(job.id(), false, Map.of("commit_error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Enqueues a keeper test send job.
     *
     * @param payload
     *            keeper test payload, {@code threadId} is ignored
     * @param scheduled
     *            earliest send time, null for now
     * @return the persisted job
     */
    @Transactional
    public ScheduledJob enqueueKeeperTest(KeeperTestPayloadType payload, Instant scheduled) {
        Map<String, Object> data = payloadCodec.encode(payload.withThreadId(null));
        return ScheduledJob.create(JobQueueName.SEND_KEEPER_TEST, data, scheduled != null ? scheduled : Instant.now());
    }

    /**
     * Lists dead-lettered jobs for audit.
     */
    @Transactional
    public List<ScheduledJob> listDeadLetters() {
        return ScheduledJob.findDeadLettered();
    }

    /**
     * Returns true if a handler is registered for the queue name.
     */
    public boolean hasHandler(JobQueueName queue) {
        return handlerRegistry.containsKey(queue);
    }
}
