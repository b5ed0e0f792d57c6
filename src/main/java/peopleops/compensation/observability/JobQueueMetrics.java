package peopleops.compensation.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import peopleops.compensation.data.models.ScheduledJob;
import peopleops.compensation.data.models.ScheduledJob.JobState;

import java.util.List;

/**
 * Micrometer meters for the scheduled job queue, exported at {@code /q/metrics}.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauge:</b> {@code compensation_jobs_depth{state}} - rows per job state</li>
 * <li><b>Counter:</b> {@code compensation_jobs_claimed_total} - jobs claimed by trigger invocations</li>
 * <li><b>Counter:</b> {@code compensation_jobs_outcomes_total{queue_name,outcome}} - committed outcomes
 * (success, failure, dead_lettered, stale)</li>
 * <li><b>Counter:</b> {@code compensation_jobs_unrecognized_total{queue_name}} - claimed jobs skipped for lack of a
 * handler</li>
 * <li><b>Counter:</b> {@code compensation_jobs_reclaimed_total} - stale RUNNING jobs returned by the reclaim sweep</li>
 * <li><b>Counter:</b> {@code compensation_keeper_test_submissions_total{outcome}} - keeper test form submissions
 * (accepted, incomplete, duplicate)</li>
 * <li><b>Timer:</b> {@code compensation.jobs.handler.duration{queue_name}} - handler execution time</li>
 * </ul>
 */
@ApplicationScoped
public class JobQueueMetrics {

    private static final Logger LOG = Logger.getLogger(JobQueueMetrics.class);

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    public static final String OUTCOME_DEAD_LETTERED = "dead_lettered";
    public static final String OUTCOME_STALE = "stale";

    public static final String SUBMISSION_ACCEPTED = "accepted";
    public static final String SUBMISSION_INCOMPLETE = "incomplete";
    public static final String SUBMISSION_DUPLICATE = "duplicate";

    private final MeterRegistry registry;

    @Inject
    public JobQueueMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers the depth gauges once the application scope is up.
     */
    void registerGauges(@Observes @Initialized(ApplicationScoped.class) Object init) {
        for (JobState state : JobState.values()) {
            Gauge.builder("compensation_jobs_depth", this, m -> m.depth(state))
                    .description("Number of scheduled jobs in state " + state.name())
                    .tags(List.of(Tag.of("state", state.name()))).register(registry);
            LOG.debugf("Registered gauge: compensation_jobs_depth{state=%s}", state.name());
        }
    }

    public void recordClaimed(int count) {
        if (count > 0) {
            Counter.builder("compensation_jobs_claimed_total").description("Jobs claimed by trigger invocations")
                    .register(registry).increment(count);
        }
    }

    public void recordOutcome(String queueName, String outcome) {
        Counter.builder("compensation_jobs_outcomes_total").description("Committed job outcomes")
                .tag("queue_name", String.valueOf(queueName)).tag("outcome", outcome).register(registry).increment();
    }

    public void recordUnrecognized(String queueName) {
        Counter.builder("compensation_jobs_unrecognized_total")
                .description("Claimed jobs skipped because no handler is registered for their queue name")
                .tag("queue_name", String.valueOf(queueName)).register(registry).increment();
    }

    public void recordReclaimed(int count) {
        Counter counter = Counter.builder("compensation_jobs_reclaimed_total")
                .description("Stale RUNNING jobs returned to AVAILABLE").register(registry);
        if (count > 0) {
            counter.increment(count);
        }
    }

    public void recordSubmission(String outcome) {
        Counter.builder("compensation_keeper_test_submissions_total").description("Keeper test form submissions")
                .tag("outcome", outcome).register(registry).increment();
    }

    public Timer.Sample startHandlerTimer() {
        return Timer.start(registry);
    }

    public void stopHandlerTimer(Timer.Sample sample, String queueName) {
        sample.stop(Timer.builder("compensation.jobs.handler.duration").description("Job handler execution time")
                .tag("queue_name", String.valueOf(queueName)).register(registry));
    }

    /**
     * Current number of jobs in a state. Returns NaN when the database cannot be queried so the scrape still succeeds.
     */
    double depth(JobState state) {
        try {
            return QuarkusTransaction.requiringNew().call(() -> (double) ScheduledJob.countByState(state));
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to read job depth for state %s", state);
            return Double.NaN;
        }
    }
}
