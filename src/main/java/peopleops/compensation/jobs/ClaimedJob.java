package peopleops.compensation.jobs;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of a job row taken right after the claim transaction committed.
 *
 * @param id
 *            job primary key
 * @param queueName
 *            raw persisted tag, possibly unknown
 * @param scheduled
 *            scheduled time at claim
 * @param created
 *            creation time
 * @param lockId
 *            claim token; every outcome write is guarded by it
 * @param data
 *            payload copy
 * @param failureCount
 *            failures recorded before this run
 */
public record ClaimedJob(UUID id, String queueName, Instant scheduled, Instant created, UUID lockId,
        Map<String, Object> data, int failureCount) {

    public ClaimedJob {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
