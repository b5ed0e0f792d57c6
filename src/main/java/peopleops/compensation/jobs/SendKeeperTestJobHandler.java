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
import peopleops.compensation.integration.messaging.MessageContent;
import peopleops.compensation.integration.messaging.MessagingClient;
import peopleops.compensation.observability.JobQueueMetrics;
import peopleops.compensation.observability.LoggingConfig;
import peopleops.compensation.services.JobPayloadCodec;
import peopleops.compensation.services.KeeperTestMessageBuilder;

import java.time.Instant;

/**
 * Job handler that sends the keeper test form to a manager.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Decode the {@link KeeperTestPayloadType} payload</li>
 * <li>Resolve the manager's messaging user from {@code manager.email}</li>
 * <li>Post the keeper test form as a direct message</li>
 * <li>Hand the job over to {@code receive_keeper_test_results} with the posted message id as {@code threadId},
 * scheduled after the first reminder delay (24h by default)</li>
 * </ol>
 *
 * <p>
 * <b>Error Handling:</b> any failure (lookup, post, malformed payload) propagates and is counted as a job failure by
 * {@link peopleops.compensation.services.ScheduledJobService}.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "title": "30 Day check-in",
 *   "employee": { "id": "emp_1", "email": "jane@example.com", "name": "Jane" },
 *   "manager": { "id": "emp_2", "email": "max@example.com", "name": "Max" }
 * }
 * </pre>
 */
@ApplicationScoped
public class SendKeeperTestJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(SendKeeperTestJobHandler.class);

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
        return JobQueueName.SEND_KEEPER_TEST;
    }

    @Override
    public JobUpdate execute(ClaimedJob job) throws Exception {
        Span span = tracer.spanBuilder("job.send_keeper_test").setAttribute("job.id", job.id().toString())
                .setAttribute("job.queue_name", job.queueName()).setAttribute("job.failure_count", job.failureCount())
                .startSpan();

        Timer.Sample timerSample = metrics.startHandlerTimer();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("SendKeeperTestJobHandler");

            KeeperTestPayloadType payload = payloadCodec.decode(job, JobQueueName.SEND_KEEPER_TEST,
                    KeeperTestPayloadType.class);
            LOG.infof("Sending keeper test '%s' for employee %s to manager %s", payload.title(),
                    payload.employee().id(), payload.manager().id());

            String userId = messagingClient.lookupUserByEmail(payload.manager().email());
            MessageContent form = messageBuilder.buildKeeperTestForm(payload, job.id());
            String messageId = messagingClient.postMessage(userId, form, null);
            span.setAttribute("message_id", messageId);

            Instant firstReminder = Instant.now().plus(config.firstReminderDelay());
            KeeperTestPayloadType followUp = payload.withThreadId(messageId);

            LOG.infof("Keeper test form posted (thread: %s), first reminder at %s", messageId, firstReminder);
            span.addEvent("job.completed");
            return JobUpdate.moveTo(JobQueueName.RECEIVE_KEEPER_TEST_RESULTS, payloadCodec.encode(followUp),
                    firstReminder);

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
