package peopleops.compensation.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import peopleops.compensation.data.models.ScheduledJob;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * API view of a {@code scheduled_jobs} row.
 */
public record ScheduledJobType(@JsonProperty("id") UUID id, @JsonProperty("queue_name") String queueName,
        @JsonProperty("state") String state, @JsonProperty("scheduled") Instant scheduled,
        @JsonProperty("created") Instant created, @JsonProperty("last_heartbeat") Instant lastHeartbeat,
        @JsonProperty("failure_count") int failureCount, @JsonProperty("data") Map<String, Object> data) {

    public static ScheduledJobType fromEntity(ScheduledJob job) {
        return new ScheduledJobType(job.id, job.queueName, job.state.name(), job.scheduled, job.created,
                job.lastHeartbeat, job.failureCount, job.data);
    }
}
