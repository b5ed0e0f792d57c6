package peopleops.compensation.services;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import peopleops.compensation.exceptions.MalformedJobPayloadException;
import peopleops.compensation.jobs.ClaimedJob;
import peopleops.compensation.jobs.JobQueueName;

import java.util.Map;

/**
 * Converts job payload maps to and from the typed records named by {@link JobQueueName#payloadType()}.
 */
@ApplicationScoped
public class JobPayloadCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Inject
    public JobPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decodes the payload of a claimed job into the record its queue expects.
     *
     * @throws MalformedJobPayloadException
     *             if the queue has no payload type or the data does not fit it
     */
    public <T> T decode(ClaimedJob job, JobQueueName queue, Class<T> type) {
        if (queue.payloadType() == null || !queue.payloadType().equals(type)) {
            throw new MalformedJobPayloadException(
                    "Queue " + queue.tag() + " does not carry payloads of type " + type.getSimpleName());
        }
        try {
            T payload = objectMapper.convertValue(job.data(), type);
            if (payload == null) {
                throw new MalformedJobPayloadException("Job " + job.id() + " has an empty payload");
            }
            return payload;
        } catch (IllegalArgumentException e) {
            throw new MalformedJobPayloadException("Job " + job.id() + " payload does not match " + type.getSimpleName(),
                    e);
        }
    }

    /**
     * Encodes a payload record into the map stored in the {@code data} column.
     */
    public Map<String, Object> encode(Object payload) {
        return objectMapper.convertValue(payload, MAP_TYPE);
    }
}
