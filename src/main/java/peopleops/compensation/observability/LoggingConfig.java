package peopleops.compensation.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

import java.util.UUID;

/**
 * Standard MDC field names and helpers for structured job logging.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code job_id} - Scheduled job primary key (job execution only)</li>
 * <li>{@code lock_id} - Claim token of the poll invocation that owns the job</li>
 * <li>{@code queue_name} - Queue tag of the job being executed</li>
 * <li>{@code request_origin} - HTTP request path or handler name</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Job Handlers:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJob(job.id(), job.lockId(), job.queueName());
 * LoggingConfig.setRequestOrigin("SendKeeperTestJobHandler");
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> {@link MDC} is thread-local. Handlers run on pooled worker threads, so every execution must
 * end with {@link #clearMDC()}.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_LOCK_ID = "lock_id";

    public static final String MDC_QUEUE_NAME = "queue_name";

    /**
     * HTTP request path (e.g., "/api/jobs/run") or handler name.
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span into MDC. Empty strings when no span is active.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets job_id, lock_id and queue_name for the job executing on this thread.
     */
    public static void setJob(UUID jobId, UUID lockId, String queueName) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
        if (lockId != null) {
            MDC.put(MDC_LOCK_ID, lockId.toString());
        }
        if (queueName != null) {
            MDC.put(MDC_QUEUE_NAME, queueName);
        }
    }

    /**
     * Sets the claim token alone, for cycle-level logs before any job is dispatched.
     */
    public static void setLockId(UUID lockId) {
        if (lockId != null) {
            MDC.put(MDC_LOCK_ID, lockId.toString());
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears every field set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_LOCK_ID);
        MDC.remove(MDC_QUEUE_NAME);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
