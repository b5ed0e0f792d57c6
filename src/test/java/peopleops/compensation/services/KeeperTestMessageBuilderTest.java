package peopleops.compensation.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import peopleops.compensation.TestConstants;
import peopleops.compensation.api.types.JobPersonType;
import peopleops.compensation.api.types.KeeperTestPayloadType;
import peopleops.compensation.integration.messaging.MessageContent;

/**
 * Unit tests for {@link KeeperTestMessageBuilder}.
 */
class KeeperTestMessageBuilderTest {

    private static final String HANDBOOK = "https://handbook.example.com/keeper-test";

    private final KeeperTestMessageBuilder builder = new KeeperTestMessageBuilder(HANDBOOK);

    private static KeeperTestPayloadType payload(String title) {
        return new KeeperTestPayloadType(title,
                new JobPersonType(TestConstants.EMPLOYEE_ID, TestConstants.EMPLOYEE_EMAIL, TestConstants.EMPLOYEE_NAME),
                new JobPersonType(TestConstants.MANAGER_ID, TestConstants.MANAGER_EMAIL, TestConstants.MANAGER_NAME),
                null);
    }

    @SuppressWarnings("unchecked")
    private static List<String> actionIds(MessageContent content) {
        return content.blocks().stream().map(block -> {
            Object accessory = block.get("accessory");
            if (accessory instanceof Map) {
                return (String) ((Map<String, Object>) accessory).get("action_id");
            }
            Object element = block.get("element");
            if (element instanceof Map) {
                return (String) ((Map<String, Object>) element).get("action_id");
            }
            return null;
        }).filter(id -> id != null).collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> submitButton(MessageContent content) {
        Map<String, Object> actions = content.blocks().get(content.blocks().size() - 1);
        assertEquals("actions", actions.get("type"));
        assertEquals(KeeperTestMessageBuilder.SUBMIT_BLOCK_ID, actions.get("block_id"));
        return ((List<Map<String, Object>>) actions.get("elements")).get(0);
    }

    @Test
    void testForm_introMentionsEmployeeAndHandbook() {
        MessageContent form = builder.buildKeeperTestForm(payload(TestConstants.KEEPER_TEST_TITLE), TestConstants.JOB_ID);

        @SuppressWarnings("unchecked")
        Map<String, Object> intro = (Map<String, Object>) form.blocks().get(0).get("text");
        String text = (String) intro.get("text");
        assertTrue(text.contains(TestConstants.EMPLOYEE_EMAIL));
        assertTrue(text.contains("<" + HANDBOOK + "|this>"));
        assertFalse(form.text().isBlank());
    }

    @Test
    void testForm_regularKeeperTestHasNoRecommendation() {
        MessageContent form = builder.buildKeeperTestForm(payload(TestConstants.KEEPER_TEST_TITLE), TestConstants.JOB_ID);

        assertEquals(List.of("keeper-test-question-1", "keeper-test-question-1-text", "keeper-test-question-2",
                "keeper-test-question-3", "keeper-test-question-4", "keeper-test-question-4-text",
                "keeper-test-question-6"), actionIds(form));
    }

    @Test
    void testForm_probationCheckInAsksForRecommendation() {
        MessageContent form = builder.buildKeeperTestForm(payload(TestConstants.CHECK_IN_TITLE), TestConstants.JOB_ID);

        assertTrue(actionIds(form).contains("keeper-test-question-5"));
    }

    @Test
    void testForm_submitButtonCarriesSixPipeSeparatedFields() {
        MessageContent form = builder.buildKeeperTestForm(payload(TestConstants.CHECK_IN_TITLE), TestConstants.JOB_ID);

        Map<String, Object> button = submitButton(form);
        assertEquals(KeeperTestMessageBuilder.SUBMIT_ACTION_ID, button.get("action_id"));
        String[] parts = ((String) button.get("value")).split("\\|");
        assertEquals(6, parts.length);
        assertEquals(TestConstants.EMPLOYEE_EMAIL, parts[0]);
        assertEquals(TestConstants.EMPLOYEE_ID, parts[1]);
        assertEquals(TestConstants.MANAGER_NAME, parts[2]);
        assertEquals(TestConstants.MANAGER_ID, parts[3]);
        assertEquals(TestConstants.JOB_ID.toString(), parts[4]);
        assertEquals(TestConstants.CHECK_IN_TITLE, parts[5]);
    }

    @Test
    void testReminder_isPlainTextNamingEmployee() {
        MessageContent reminder = builder.buildReminder(payload(TestConstants.KEEPER_TEST_TITLE));

        assertTrue(reminder.blocks().isEmpty());
        assertTrue(reminder.text().contains(TestConstants.EMPLOYEE_NAME));
        assertTrue(reminder.text().contains(TestConstants.KEEPER_TEST_TITLE));
    }

    private static KeeperTestSubmission submission(String title) {
        return new KeeperTestSubmission(TestConstants.EMPLOYEE_EMAIL, TestConstants.EMPLOYEE_ID,
                TestConstants.MANAGER_NAME, TestConstants.MANAGER_ID, TestConstants.JOB_ID, title);
    }

    @Test
    void testSubmissionSummary_listsAnswersWithRecommendationForCheckIns() {
        Map<String, String> answers = Map.of(KeeperTestMessageBuilder.QUESTION_KEEP, "yes",
                KeeperTestMessageBuilder.QUESTION_VALUABLE, "Owns the billing pipeline",
                KeeperTestMessageBuilder.QUESTION_DRIVER, "driver", KeeperTestMessageBuilder.QUESTION_RECOMMENDATION,
                KeeperTestMessageBuilder.RECOMMENDATION_STRONG, KeeperTestMessageBuilder.QUESTION_SHARED, "no");

        String text = builder.buildSubmissionSummary(submission(TestConstants.CHECK_IN_TITLE), answers).text();

        assertTrue(text.startsWith("Successfully submitted keeper test feedback for " + TestConstants.EMPLOYEE_EMAIL));
        assertTrue(text.contains("### " + TestConstants.CHECK_IN_TITLE + " feedback from " + TestConstants.MANAGER_NAME));
        assertTrue(text.contains("Owns the billing pipeline"));
        assertTrue(text.contains("**Recommendation:** " + KeeperTestMessageBuilder.RECOMMENDATION_STRONG));
        assertTrue(text.endsWith("**Have you shared this feedback with your team member?** no"));
    }

    @Test
    void testSubmissionSummary_omitsRecommendationOutsideCheckIns() {
        String text = builder.buildSubmissionSummary(submission(TestConstants.KEEPER_TEST_TITLE), Map.of()).text();

        assertFalse(text.contains("Recommendation"));
    }

    @Test
    void testIncompleteReply_namesMissingQuestions() {
        MessageContent reply = builder.buildIncompleteReply(
                List.of(KeeperTestMessageBuilder.QUESTION_DRIVER, KeeperTestMessageBuilder.QUESTION_SHARED));

        assertEquals("Please complete all required fields: keeper-test-question-2, keeper-test-question-6",
                reply.text());
    }
}
