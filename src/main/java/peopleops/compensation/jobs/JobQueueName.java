package peopleops.compensation.jobs;

import peopleops.compensation.api.types.KeeperTestPayloadType;

import java.util.Optional;

/**
 * Queue tags stored in {@code scheduled_jobs.queue_name}.
 *
 * <p>
 * The tag selects both the handler and the payload shape. {@link #DEAD_LETTER} is terminal and has no handler or
 * payload type.
 */
public enum JobQueueName {

    /**
     * Send the keeper test form to the manager. Moves to {@link #RECEIVE_KEEPER_TEST_RESULTS} on success.
     */
    SEND_KEEPER_TEST("send_keeper_test", KeeperTestPayloadType.class),

    /**
     * Remind the manager in the original thread until the form is submitted.
     */
    RECEIVE_KEEPER_TEST_RESULTS("receive_keeper_test_results", KeeperTestPayloadType.class),

    DEAD_LETTER("dead_letter", null);

    private final String tag;
    private final Class<?> payloadType;

    JobQueueName(String tag, Class<?> payloadType) {
        this.tag = tag;
        this.payloadType = payloadType;
    }

    /**
     * Wire value persisted in the {@code queue_name} column.
     */
    public String tag() {
        return tag;
    }

    /**
     * Record type the job payload deserializes to, or null for terminal queues.
     */
    public Class<?> payloadType() {
        return payloadType;
    }

    /**
     * Resolves a persisted tag. Unknown or null tags resolve to empty.
     */
    public static Optional<JobQueueName> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        for (JobQueueName name : values()) {
            if (name.tag.equals(tag)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
