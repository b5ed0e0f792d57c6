package peopleops.compensation.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import peopleops.compensation.TestConstants;
import peopleops.compensation.api.types.KeeperTestPayloadType;
import peopleops.compensation.config.JobQueueConfig;
import peopleops.compensation.exceptions.MalformedJobPayloadException;
import peopleops.compensation.exceptions.MessagingException;
import peopleops.compensation.integration.messaging.MessageContent;
import peopleops.compensation.integration.messaging.MessagingClient;
import peopleops.compensation.observability.JobQueueMetrics;
import peopleops.compensation.services.JobPayloadCodec;
import peopleops.compensation.services.KeeperTestMessageBuilder;

/**
 * Unit tests for {@link KeeperTestReminderJobHandler}.
 */
class KeeperTestReminderJobHandlerTest {

    @Mock
    MessagingClient messagingClient;

    @Mock
    KeeperTestMessageBuilder messageBuilder;

    @Mock
    JobQueueConfig config;

    @Mock
    Tracer tracer;

    @InjectMocks
    KeeperTestReminderJobHandler handler;

    private final MessageContent reminder = MessageContent.text("reminder");

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        handler.payloadCodec = new JobPayloadCodec(new ObjectMapper());
        handler.metrics = new JobQueueMetrics(new SimpleMeterRegistry());

        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));
        when(config.reminderInterval()).thenReturn(Duration.ofHours(72));
        when(messageBuilder.buildReminder(any(KeeperTestPayloadType.class))).thenReturn(reminder);
    }

    private ClaimedJob job(Map<String, Object> data) {
        return new ClaimedJob(TestConstants.JOB_ID, JobQueueName.RECEIVE_KEEPER_TEST_RESULTS.tag(), Instant.now(),
                Instant.now(), TestConstants.LOCK_ID, data, 2);
    }

    @Test
    void testHandlesQueue() {
        assertEquals(JobQueueName.RECEIVE_KEEPER_TEST_RESULTS, handler.handlesQueue());
    }

    @Test
    void testExecute_postsReminderInThreadAndReschedules() throws Exception {
        when(messagingClient.lookupUserByEmail(TestConstants.MANAGER_EMAIL)).thenReturn(TestConstants.SLACK_USER_ID);
        when(messagingClient.postMessage(TestConstants.SLACK_USER_ID, reminder, TestConstants.SLACK_MESSAGE_TS))
                .thenReturn("1700000001.000200");

        Instant before = Instant.now();
        JobUpdate update = handler.execute(job(TestConstants.reminderData(TestConstants.SLACK_MESSAGE_TS)));

        assertNull(update.queueName());
        assertNull(update.data());
        assertTrue(!update.scheduled().isBefore(before.plus(Duration.ofHours(72))));
        verify(messagingClient).postMessage(TestConstants.SLACK_USER_ID, reminder, TestConstants.SLACK_MESSAGE_TS);
    }

    @Test
    void testExecute_missingThreadId_failsBeforeNetwork() {
        assertThrows(MalformedJobPayloadException.class,
                () -> handler.execute(job(TestConstants.keeperTestData(TestConstants.KEEPER_TEST_TITLE))));
        verifyNoInteractions(messagingClient);
    }

    @Test
    void testExecute_blankThreadId_failsBeforeNetwork() {
        Map<String, Object> data = new HashMap<>(TestConstants.reminderData(" "));

        assertThrows(MalformedJobPayloadException.class, () -> handler.execute(job(data)));
        verifyNoInteractions(messagingClient);
    }

    @Test
    void testExecute_postFails_propagates() {
        when(messagingClient.lookupUserByEmail(anyString())).thenReturn(TestConstants.SLACK_USER_ID);
        when(messagingClient.postMessage(anyString(), any(), anyString()))
                .thenThrow(new MessagingException("Slack chat.postMessage returned status 500"));

        assertThrows(MessagingException.class,
                () -> handler.execute(job(TestConstants.reminderData(TestConstants.SLACK_MESSAGE_TS))));
    }
}
