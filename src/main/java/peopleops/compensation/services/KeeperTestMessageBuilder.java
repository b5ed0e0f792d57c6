package peopleops.compensation.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import peopleops.compensation.api.types.KeeperTestPayloadType;
import peopleops.compensation.integration.messaging.MessageContent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the Slack Block Kit messages sent by keeper test jobs.
 *
 * <p>
 * The form's submit button carries {@code employeeEmail|employeeId|managerName|managerId|jobId|title} as its value;
 * {@link KeeperTestSubmission#parse} splits it back when the manager presses submit.
 */
@ApplicationScoped
public class KeeperTestMessageBuilder {

    public static final String SUBMIT_ACTION_ID = "submit_keeper_test";
    public static final String SUBMIT_BLOCK_ID = "submit_block";

    public static final String QUESTION_KEEP = "keeper-test-question-1";
    public static final String QUESTION_VALUABLE = "keeper-test-question-1-text";
    public static final String QUESTION_DRIVER = "keeper-test-question-2";
    public static final String QUESTION_PROACTIVE = "keeper-test-question-3";
    public static final String QUESTION_OPTIMISTIC = "keeper-test-question-4";
    public static final String QUESTION_AREAS_TO_WATCH = "keeper-test-question-4-text";
    public static final String QUESTION_RECOMMENDATION = "keeper-test-question-5";
    public static final String QUESTION_SHARED = "keeper-test-question-6";

    static final String RECOMMENDATION_STRONG = "Strong Hire, on track to pass probation";
    static final String RECOMMENDATION_AVERAGE = "Average Hire, need to see improvements";
    static final String RECOMMENDATION_NOT_A_FIT = "Not a fit, needs escalating";

    @ConfigProperty(
            name = "compensation.handbook-url",
            defaultValue = "https://posthog.com/handbook/company/management#the-keeper-test")
    String handbookUrl;

    public KeeperTestMessageBuilder() {
    }

    KeeperTestMessageBuilder(String handbookUrl) {
        this.handbookUrl = handbookUrl;
    }

    /**
     * Builds the keeper test form for a manager.
     *
     * @param payload
     *            keeper test payload
     * @param jobId
     *            id of the sending job, echoed back on submission
     */
    public MessageContent buildKeeperTestForm(KeeperTestPayloadType payload, UUID jobId) {
        String employeeEmail = payload.employee().email();
        List<Map<String, Object>> blocks = new ArrayList<>();

        blocks.add(section("Hey! It's Keeper Test Time! Please submit feedback for " + employeeEmail
                + ". If you get stuck or aren't familiar, check out <" + handbookUrl
                + "|this> section of the Handbook."));
        blocks.add(radioQuestion(QUESTION_KEEP,
                "If this team member was leaving for a similar role at another company, would you try to keep them?",
                option("Yes", "yes"), option("No", "no")));
        blocks.add(textInput(QUESTION_VALUABLE,
                "If yes, what is it specifically that makes them so valuable to your team and PostHog?"));
        blocks.add(radioQuestion(QUESTION_DRIVER, "Are they a driver or a passenger?",
                option("Driver", "driver"), option("Passenger", "passenger")));
        blocks.add(radioQuestion(QUESTION_PROACTIVE, "Do they get things done proactively, today?",
                option("Yes", "yes"), option("No", "no")));
        blocks.add(radioQuestion(QUESTION_OPTIMISTIC, "Are they optimistic by default?", option("Yes", "yes"),
                option("No", "no")));
        blocks.add(textInput(QUESTION_AREAS_TO_WATCH, "Areas to watch"));
        if (payload.isProbationCheckIn()) {
            blocks.add(radioQuestion(QUESTION_RECOMMENDATION, "What is your recommendation?",
                    option(RECOMMENDATION_STRONG, RECOMMENDATION_STRONG),
                    option(RECOMMENDATION_AVERAGE, RECOMMENDATION_AVERAGE),
                    option(RECOMMENDATION_NOT_A_FIT, RECOMMENDATION_NOT_A_FIT)));
        }
        blocks.add(radioQuestion(QUESTION_SHARED, "Have you shared this feedback with your team member?",
                option("Yes", "yes"), option("No, but I will do right now!", "no")));
        blocks.add(submitActions(submitValue(payload, jobId)));

        String text = payload.title() + ": keeper test for " + displayName(payload);
        return new MessageContent(text, blocks);
    }

    /**
     * Builds the reminder posted in the form's thread until it is submitted.
     */
    public MessageContent buildReminder(KeeperTestPayloadType payload) {
        return MessageContent.text("Friendly reminder: the " + payload.title() + " keeper test for "
                + displayName(payload) + " is still waiting for your feedback. You can fill it out in the message above.");
    }

    /**
     * Reply asking the manager to answer the required questions they skipped.
     */
    public MessageContent buildIncompleteReply(List<String> invalidFields) {
        return MessageContent.text("Please complete all required fields: " + String.join(", ", invalidFields));
    }

    /**
     * Confirmation posted after a submission, summarising the answers.
     *
     * @param answers
     *            answer per question action id
     */
    public MessageContent buildSubmissionSummary(KeeperTestSubmission submission, Map<String, String> answers) {
        StringBuilder summary = new StringBuilder();
        summary.append("Successfully submitted keeper test feedback for ").append(submission.employeeEmail())
                .append("\n\nSummary:\n\n");
        summary.append("### ").append(submission.title()).append(" feedback from ").append(submission.managerName())
                .append(":\n");
        summaryLine(summary,
                "If this team member was leaving for a similar role at another company, would you try to keep them?",
                answers.get(QUESTION_KEEP));
        summaryLine(summary, "If yes, what is it specifically that makes them so valuable to your team and PostHog?",
                answers.get(QUESTION_VALUABLE));
        summaryLine(summary, "Are they a driver or a passenger?", answers.get(QUESTION_DRIVER));
        summaryLine(summary, "Do they get things done proactively, today?", answers.get(QUESTION_PROACTIVE));
        summaryLine(summary, "Are they optimistic by default?", answers.get(QUESTION_OPTIMISTIC));
        summaryLine(summary, "Areas to watch:", answers.get(QUESTION_AREAS_TO_WATCH));
        if (KeeperTestPayloadType.isProbationCheckIn(submission.title())) {
            summaryLine(summary, "Recommendation:", answers.get(QUESTION_RECOMMENDATION));
        }
        summary.append("- **Have you shared this feedback with your team member?** ")
                .append(nullToEmpty(answers.get(QUESTION_SHARED)));
        return MessageContent.text(summary.toString());
    }

    private static void summaryLine(StringBuilder summary, String question, String answer) {
        summary.append("- **").append(question).append("** ").append(nullToEmpty(answer)).append("\n");
    }

    static String submitValue(KeeperTestPayloadType payload, UUID jobId) {
        return String.join("|", payload.employee().email(), payload.employee().id(), nullToEmpty(payload.manager().name()),
                payload.manager().id(), jobId.toString(), payload.title());
    }

    private static String displayName(KeeperTestPayloadType payload) {
        String name = payload.employee().name();
        return name == null || name.isBlank() ? payload.employee().email() : name;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static Map<String, Object> section(String markdown) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "section");
        block.put("text", Map.of("type", "mrkdwn", "text", markdown));
        return block;
    }

    @SafeVarargs
    private static Map<String, Object> radioQuestion(String actionId, String question, Map<String, Object>... options) {
        Map<String, Object> accessory = new LinkedHashMap<>();
        accessory.put("type", "radio_buttons");
        accessory.put("options", List.of(options));
        accessory.put("action_id", actionId);

        Map<String, Object> block = section(question);
        block.put("accessory", accessory);
        return block;
    }

    private static Map<String, Object> textInput(String actionId, String label) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "input");
        block.put("element", Map.of("type", "plain_text_input", "action_id", actionId));
        block.put("label", plainText(label));
        return block;
    }

    private static Map<String, Object> option(String label, String value) {
        return Map.of("text", plainText(label), "value", value);
    }

    private static Map<String, Object> plainText(String text) {
        return Map.of("type", "plain_text", "text", text, "emoji", true);
    }

    private static Map<String, Object> submitActions(String value) {
        Map<String, Object> button = new LinkedHashMap<>();
        button.put("type", "button");
        button.put("text", plainText("Submit"));
        button.put("action_id", SUBMIT_ACTION_ID);
        button.put("value", value);

        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "actions");
        block.put("block_id", SUBMIT_BLOCK_ID);
        block.put("elements", List.of(button));
        return block;
    }
}
