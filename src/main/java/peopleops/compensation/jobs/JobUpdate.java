package peopleops.compensation.jobs;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update returned by a successful handler. Null components leave the stored value unchanged.
 *
 * @param queueName
 *            new queue tag, or null
 * @param scheduled
 *            new scheduled time, or null
 * @param data
 *            replacement payload, or null
 */
public record JobUpdate(String queueName, Instant scheduled, Map<String, Object> data) {

    /**
     * Keeps the queue and payload, moves the next run to {@code scheduled}.
     */
    public static JobUpdate rescheduleAt(Instant scheduled) {
        return new JobUpdate(null, scheduled, null);
    }

    /**
     * Hands the job over to another queue with a new payload.
     */
    public static JobUpdate moveTo(JobQueueName queue, Map<String, Object> data, Instant scheduled) {
        return new JobUpdate(queue.tag(), scheduled, data);
    }

    /**
     * Result data reported to the trigger caller: the applied queue name and scheduled time.
     */
    public Map<String, Object> toResultData() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (queueName != null) {
            result.put("queue_name", queueName);
        }
        if (scheduled != null) {
            result.put("scheduled", scheduled.toString());
        }
        return result;
    }
}
