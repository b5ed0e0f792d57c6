package peopleops.compensation.jobs;

import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import peopleops.compensation.api.types.KeeperTestPayloadType;
import peopleops.compensation.config.JobQueueConfig;
import peopleops.compensation.exceptions.MalformedJobPayloadException;
import peopleops.compensation.integration.messaging.MessagingClient;
import peopleops.compensation.observability.JobQueueMetrics;
import peopleops.compensation.observability.LoggingConfig;
import peopleops.compensation.services.JobPayloadCodec;
import peopleops.compensation.services.KeeperTestMessageBuilder;

import java.time.Instant;

/**
 * Job handler that reminds a manager, in the form's thread, to submit a pending keeper test.
 *
 * <p>
 * A payload without {@code threadId} fails before any network call. On success the same job is rescheduled after the
 * reminder interval (72h by default) with its failure count unchanged. Reminders stop when the manager submits the form:
 * {@link peopleops.compensation.services.KeeperTestResultService} then moves the job to COMPLETED, which is never
 * claimed again.
 */
@ApplicationScoped
public class KeeperTestReminderJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(KeeperTestReminderJobHandler.class);

    @Inject
    MessagingClient messagingClient;

    @Inject
    KeeperTestMessageBuilder messageBuilder;

    @Inject
    JobPayloadCodec payloadCodec;

    @Inject
    JobQueueConfig config;

    @Inject
    JobQueueMetrics metrics;

    @Inject
    Tracer tracer;

    @Override
    public JobQueueName handlesQueue() {
        return JobQueueName.RECEIVE_KEEPER_TEST_RESULTS;
    }

    @Override
    public JobUpdate execute(ClaimedJob job) throws Exception {
        Span span = tracer.spanBuilder("job.keeper_test_reminder").setAttribute("job.id", job.id().toString())
                .setAttribute("job.queue_name", job.queueName()).setAttribute("job.failure_count", job.failureCount())
                .startSpan();

        Timer.Sample timerSample = metrics.startHandlerTimer();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("KeeperTestReminderJobHandler");

            KeeperTestPayloadType payload = payloadCodec.decode(job, JobQueueName.RECEIVE_KEEPER_TEST_RESULTS,
                    KeeperTestPayloadType.class);
            if (payload.threadId() == null || payload.threadId().isBlank()) {
                throw new MalformedJobPayloadException("Reminder job " + job.id() + " has no threadId");
            }

            String userId = messagingClient.lookupUserByEmail(payload.manager().email());
            messagingClient.postMessage(userId, messageBuilder.buildReminder(payload), payload.threadId());

            Instant next = Instant.now().plus(config.reminderInterval());
            LOG.infof("Reminded manager %s about keeper test for %s (thread: %s), next reminder at %s",
                    payload.manager().id(), payload.employee().id(), payload.threadId(), next);
            span.addEvent("job.completed");
            return JobUpdate.rescheduleAt(next);

        } catch (Exception e) {
            span.recordException(e);
            span.addEvent("job.failed");
            throw e;
        } finally {
            metrics.stopHandlerTimer(timerSample, job.queueName());
            span.end();
        }
    }
}
