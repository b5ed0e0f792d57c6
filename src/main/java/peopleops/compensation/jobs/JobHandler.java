package peopleops.compensation.jobs;

/**
 * Contract for scheduled job handlers.
 *
 * <p>
 * Implementations are discovered through CDI and registered by {@link #handlesQueue()} in
 * {@link peopleops.compensation.services.ScheduledJobService}. At most one handler may claim a queue name; a duplicate
 * fails application startup.
 *
 * <p>
 * <b>Execution contract:</b>
 * <ul>
 * <li>Handlers run outside any database transaction and must not touch the {@code scheduled_jobs} row directly</li>
 * <li>The returned {@link JobUpdate} is applied by the outcome committer under the claim's {@code lock_id} guard</li>
 * <li>Throwing any exception counts as one failure for the job</li>
 * </ul>
 *
 * <p>
 * Example:
 *
 * <pre>
 * &#64;ApplicationScoped
 * public class ExampleJobHandler implements JobHandler {
 *
 *     &#64;Override
 *     public JobQueueName handlesQueue() {
 *         return JobQueueName.SEND_KEEPER_TEST;
 *     }
 *
 *     &#64;Override
 *     public JobUpdate execute(ClaimedJob job) throws Exception {
 *         // call collaborators
 *         return JobUpdate.rescheduleAt(Instant.now().plus(Duration.ofHours(1)));
 *     }
 * }
 * </pre>
 */
public interface JobHandler {

    /**
     * Returns the queue this handler executes.
     *
     * @return queue name, never {@link JobQueueName#DEAD_LETTER}
     */
    JobQueueName handlesQueue();

    /**
     * Executes one claimed job.
     *
     * @param job
     *            immutable snapshot of the claimed row
     * @return the partial update to apply on success
     * @throws Exception
     *             any failure; the job's failure count is incremented
     */
    JobUpdate execute(ClaimedJob job) throws Exception;
}
