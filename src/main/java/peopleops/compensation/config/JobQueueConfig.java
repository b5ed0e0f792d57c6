package peopleops.compensation.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

/**
 * Tunables for the scheduled job queue.
 *
 * <p>
 * All values come from {@code application.properties} under {@code compensation.jobs.*}.
 */
@ApplicationScoped
public class JobQueueConfig {

    @ConfigProperty(
            name = "compensation.jobs.batch-size",
            defaultValue = "100")
    int batchSize;

    @ConfigProperty(
            name = "compensation.jobs.failure-threshold",
            defaultValue = "5")
    int failureThreshold;

    @ConfigProperty(
            name = "compensation.jobs.handler-concurrency",
            defaultValue = "10")
    int handlerConcurrency;

    @ConfigProperty(
            name = "compensation.jobs.liveness-window",
            defaultValue = "15M")
    Duration livenessWindow;

    @ConfigProperty(
            name = "compensation.jobs.reclaim-enabled",
            defaultValue = "true")
    boolean reclaimEnabled;

    @ConfigProperty(
            name = "compensation.jobs.keeper-test.first-reminder-delay",
            defaultValue = "24H")
    Duration firstReminderDelay;

    @ConfigProperty(
            name = "compensation.jobs.keeper-test.reminder-interval",
            defaultValue = "72H")
    Duration reminderInterval;

    /**
     * Max jobs claimed per trigger invocation.
     */
    public int batchSize() {
        return batchSize;
    }

    /**
     * Failure count at which a job is dead-lettered.
     */
    public int failureThreshold() {
        return failureThreshold;
    }

    /**
     * Worker threads executing handlers within one batch.
     */
    public int handlerConcurrency() {
        return handlerConcurrency;
    }

    /**
     * RUNNING jobs whose heartbeat is older than this are returned to AVAILABLE by the reclaim sweep.
     */
    public Duration livenessWindow() {
        return livenessWindow;
    }

    public boolean reclaimEnabled() {
        return reclaimEnabled;
    }

    /**
     * Delay between sending the keeper test form and the first reminder.
     */
    public Duration firstReminderDelay() {
        return firstReminderDelay;
    }

    /**
     * Delay between subsequent reminders.
     */
    public Duration reminderInterval() {
        return reminderInterval;
    }
}
