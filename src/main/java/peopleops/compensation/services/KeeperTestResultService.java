package peopleops.compensation.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import peopleops.compensation.api.types.SlackInteractionType;
import peopleops.compensation.api.types.SlackInteractionType.ActionType;
import peopleops.compensation.api.types.SlackInteractionType.FieldValueType;
import peopleops.compensation.data.models.KeeperTestFeedback;
import peopleops.compensation.data.models.KeeperTestFeedback.DriverOrPassenger;
import peopleops.compensation.data.models.KeeperTestFeedback.Recommendation;
import peopleops.compensation.data.models.ScheduledJob;
import peopleops.compensation.exceptions.MessagingException;
import peopleops.compensation.integration.messaging.MessageContent;
import peopleops.compensation.integration.messaging.MessagingClient;
import peopleops.compensation.observability.JobQueueMetrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Receives keeper test form submissions and retires the job that keeps reminding the manager.
 *
 * <p>
 * <b>Submission flow:</b>
 * <ol>
 * <li>Ignore any interaction other than the form's submit button</li>
 * <li>Decode the submit value into a {@link KeeperTestSubmission}</li>
 * <li>If a required radio question is unanswered, reply in the form's thread listing the missing questions and stop;
 * the job keeps reminding</li>
 * <li>In one transaction, store the answers as {@link KeeperTestFeedback} and move the job to COMPLETED</li>
 * <li>Reply with a summary of the answers</li>
 * </ol>
 *
 * <p>
 * A second submission of the same form stores nothing. A dead-lettered job stays dead-lettered, the answers are still
 * stored.
 */
@ApplicationScoped
public class KeeperTestResultService {

    private static final Logger LOG = Logger.getLogger(KeeperTestResultService.class);

    @Inject
    MessagingClient messagingClient;

    @Inject
    KeeperTestMessageBuilder messageBuilder;

    @Inject
    JobQueueMetrics metrics;

    /**
     * Outcome of one interaction.
     *
     * @param invalidFields
     *            unanswered required questions, empty when the submission was accepted or ignored
     */
    public record SubmissionResult(List<String> invalidFields) {

        static SubmissionResult accepted() {
            return new SubmissionResult(List.of());
        }

        public boolean isComplete() {
            return invalidFields.isEmpty();
        }
    }

    /**
     * Handles one interaction from the keeper test form.
     *
     * @throws peopleops.compensation.exceptions.InvalidInteractionException
     *             if the submit value cannot be decoded
     */
    public SubmissionResult handleInteraction(SlackInteractionType interaction) {
        ActionType action = interaction.firstAction();
        if (action == null || !KeeperTestMessageBuilder.SUBMIT_ACTION_ID.equals(action.actionId())) {
            LOG.debugf("Ignoring interaction %s", action != null ? action.actionId() : "without actions");
            return SubmissionResult.accepted();
        }

        KeeperTestSubmission submission = KeeperTestSubmission.parse(action.value());
        Map<String, FieldValueType> fields = interaction.fieldsByActionId();

        List<String> invalidFields = new ArrayList<>();
        Map<String, String> answers = new LinkedHashMap<>();
        fields.forEach((actionId, field) -> {
            if (field == null || field.isUnansweredRadio()) {
                invalidFields.add(actionId);
            } else {
                answers.put(actionId, field.answer());
            }
        });

        if (!invalidFields.isEmpty()) {
            LOG.infof("Keeper test submission for job %s is missing %s", submission.jobId(), invalidFields);
            metrics.recordSubmission(JobQueueMetrics.SUBMISSION_INCOMPLETE);
            reply(interaction.responseUrl(), messageBuilder.buildIncompleteReply(invalidFields),
                    interaction.messageTs());
            return new SubmissionResult(List.copyOf(invalidFields));
        }

        boolean stored = QuarkusTransaction.requiringNew().call(() -> recordSubmission(submission, answers));
        if (!stored) {
            metrics.recordSubmission(JobQueueMetrics.SUBMISSION_DUPLICATE);
            return SubmissionResult.accepted();
        }

        metrics.recordSubmission(JobQueueMetrics.SUBMISSION_ACCEPTED);
        reply(interaction.responseUrl(), messageBuilder.buildSubmissionSummary(submission, answers), null);
        return SubmissionResult.accepted();
    }

    /**
     * Stores the answers and retires the job. Must run inside a transaction.
     *
     * @return false if feedback for this job was already stored
     */
    boolean recordSubmission(KeeperTestSubmission submission, Map<String, String> answers) {
        if (KeeperTestFeedback.findByJobId(submission.jobId()) != null) {
            LOG.infof("Keeper test for job %s was already submitted, ignoring repeat", submission.jobId());
            return false;
        }

        KeeperTestFeedback feedback = KeeperTestFeedback.forJob(submission.jobId(), submission.employeeId(),
                submission.managerId(), submission.title());
        feedback.wouldYouTryToKeepThem = answers.get(KeeperTestMessageBuilder.QUESTION_KEEP);
        feedback.whatMakesThemValuable = answers.get(KeeperTestMessageBuilder.QUESTION_VALUABLE);
        feedback.driverOrPassenger = "driver".equalsIgnoreCase(answers.get(KeeperTestMessageBuilder.QUESTION_DRIVER))
                ? DriverOrPassenger.DRIVER
                : DriverOrPassenger.PASSENGER;
        feedback.proactiveToday = isYes(answers.get(KeeperTestMessageBuilder.QUESTION_PROACTIVE));
        feedback.optimisticByDefault = isYes(answers.get(KeeperTestMessageBuilder.QUESTION_OPTIMISTIC));
        feedback.areasToWatch = answers.get(KeeperTestMessageBuilder.QUESTION_AREAS_TO_WATCH);
        feedback.recommendation = toRecommendation(answers.get(KeeperTestMessageBuilder.QUESTION_RECOMMENDATION));
        feedback.sharedWithTeamMember = isYes(answers.get(KeeperTestMessageBuilder.QUESTION_SHARED));
        feedback.persist();
        LOG.infof("Stored %s feedback for employee %s from manager %s", submission.title(), submission.employeeId(),
                submission.managerId());

        ScheduledJob job = ScheduledJob.findForRetire(submission.jobId());
        if (job == null) {
            LOG.warnf("Keeper test job %s no longer exists, feedback stored without retiring a job",
                    submission.jobId());
        } else if (!job.complete(Instant.now())) {
            LOG.infof("Keeper test job %s already %s, left unchanged", job.id, job.state);
        }
        return true;
    }

    /**
     * Posts an interaction reply. The submission outcome is already decided, so a failed reply is logged only.
     */
    private void reply(String responseUrl, MessageContent content, String threadId) {
        try {
            messagingClient.respond(responseUrl, content, threadId);
        } catch (MessagingException e) {
            LOG.warnf(e, "Failed to reply to keeper test interaction: %s", e.getMessage());
        }
    }

    private static boolean isYes(String answer) {
        return "yes".equalsIgnoreCase(answer);
    }

    static Recommendation toRecommendation(String answer) {
        if (answer == null) {
            return null;
        }
        if (KeeperTestMessageBuilder.RECOMMENDATION_STRONG.equals(answer)) {
            return Recommendation.STRONG_HIRE_ON_TRACK_TO_PASS_PROBATION;
        }
        if (KeeperTestMessageBuilder.RECOMMENDATION_AVERAGE.equals(answer)) {
            return Recommendation.AVERAGE_HIRE_NEED_TO_SEE_IMPROVEMENTS;
        }
        return Recommendation.NOT_A_FIT_NEEDS_ESCALATING;
    }
}
