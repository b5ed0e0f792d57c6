package peopleops.compensation.integration.slack;

import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import peopleops.compensation.TestConstants;
import peopleops.compensation.WireMockTestBase;
import peopleops.compensation.exceptions.MessagingException;
import peopleops.compensation.integration.messaging.MessageContent;

/**
 * Tests for {@link SlackClient} against a stubbed Slack Web API.
 */
class SlackClientTest extends WireMockTestBase {

    private SlackClient client;

    @BeforeEach
    void createClient() {
        client = new SlackClient(new ObjectMapper(), slackBaseUrl(), TestConstants.SLACK_TOKEN, "http://localhost");
    }

    @Test
    void testLookupUserByEmail_returnsUserIdAndSendsBearerToken() {
        stubSlackLookup(TestConstants.MANAGER_EMAIL, TestConstants.SLACK_USER_ID);

        assertEquals(TestConstants.SLACK_USER_ID, client.lookupUserByEmail(TestConstants.MANAGER_EMAIL));

        wireMockServer.verify(getRequestedFor(urlPathEqualTo("/api/users.lookupByEmail"))
                .withQueryParam("email", equalTo(TestConstants.MANAGER_EMAIL))
                .withHeader("Authorization", equalTo("Bearer " + TestConstants.SLACK_TOKEN)));
    }

    @Test
    void testLookupUserByEmail_okFalseThrows() {
        stubSlackError("users.lookupByEmail", "users_not_found");

        MessagingException e = assertThrows(MessagingException.class,
                () -> client.lookupUserByEmail(TestConstants.MANAGER_EMAIL));
        assertTrue(e.getMessage().contains("users_not_found"));
    }

    @Test
    void testLookupUserByEmail_httpErrorThrows() {
        stubSlackStatus("users.lookupByEmail", 503);

        assertThrows(MessagingException.class, () -> client.lookupUserByEmail(TestConstants.MANAGER_EMAIL));
    }

    @Test
    void testPostMessage_newMessageReturnsTs() {
        stubSlackPostMessage(TestConstants.SLACK_MESSAGE_TS);
        MessageContent content = new MessageContent("fallback",
                List.of(Map.of("type", "section", "text", Map.of("type", "mrkdwn", "text", "hello"))));

        String ts = client.postMessage(TestConstants.SLACK_USER_ID, content, null);

        assertEquals(TestConstants.SLACK_MESSAGE_TS, ts);
        wireMockServer.verify(postRequestedFor(urlPathEqualTo("/api/chat.postMessage"))
                .withHeader("Authorization", equalTo("Bearer " + TestConstants.SLACK_TOKEN))
                .withRequestBody(matchingJsonPath("$.channel", equalTo(TestConstants.SLACK_USER_ID)))
                .withRequestBody(matchingJsonPath("$.blocks[0].type", equalTo("section"))));
        String body = wireMockServer.getAllServeEvents().get(0).getRequest().getBodyAsString();
        assertFalse(body.contains("thread_ts"));
    }

    @Test
    void testPostMessage_threadReplySendsThreadTs() {
        stubSlackPostMessage("1700000002.000300");

        client.postMessage(TestConstants.SLACK_USER_ID, MessageContent.text("reminder"), TestConstants.SLACK_MESSAGE_TS);

        wireMockServer.verify(postRequestedFor(urlPathEqualTo("/api/chat.postMessage")).withRequestBody(equalToJson(
                "{\"channel\":\"" + TestConstants.SLACK_USER_ID + "\",\"text\":\"reminder\",\"thread_ts\":\""
                        + TestConstants.SLACK_MESSAGE_TS + "\"}")));
    }

    @Test
    void testPostMessage_okFalseThrows() {
        stubSlackError("chat.postMessage", "channel_not_found");

        assertThrows(MessagingException.class,
                () -> client.postMessage(TestConstants.SLACK_USER_ID, MessageContent.text("x"), null));
    }

    @Test
    void testPostMessage_serverErrorThrows() {
        stubSlackStatus("chat.postMessage", 500);

        assertThrows(MessagingException.class,
                () -> client.postMessage(TestConstants.SLACK_USER_ID, MessageContent.text("x"), null));
    }

    @Test
    void testRespond_postsThreadedReplyToResponseUrlWithoutToken() {
        wireMockServer.stubFor(post(urlPathEqualTo(TestConstants.RESPONSE_URL_PATH))
                .willReturn(aResponse().withStatus(200).withBody("ok")));

        client.respond(responseUrl(), MessageContent.text("Please complete all required fields: q6"),
                TestConstants.SLACK_MESSAGE_TS);

        wireMockServer.verify(postRequestedFor(urlPathEqualTo(TestConstants.RESPONSE_URL_PATH))
                .withRequestBody(equalToJson("{\"text\":\"Please complete all required fields: q6\",\"thread_ts\":\""
                        + TestConstants.SLACK_MESSAGE_TS + "\",\"response_type\":\"in_channel\",\"replace_original\":false}")));
        assertFalse(wireMockServer.getAllServeEvents().get(0).getRequest().containsHeader("Authorization"));
    }

    @Test
    void testRespond_rejectsUrlOutsideConfiguredPrefix() {
        assertThrows(MessagingException.class,
                () -> client.respond("https://attacker.example.com/hook", MessageContent.text("x"), null));
        assertThrows(MessagingException.class, () -> client.respond(null, MessageContent.text("x"), null));
        assertTrue(wireMockServer.getAllServeEvents().isEmpty());
    }

    @Test
    void testRespond_httpErrorThrows() {
        wireMockServer.stubFor(post(urlPathEqualTo(TestConstants.RESPONSE_URL_PATH))
                .willReturn(aResponse().withStatus(404).withBody("expired_url")));

        assertThrows(MessagingException.class, () -> client.respond(responseUrl(), MessageContent.text("x"), null));
    }

    private String responseUrl() {
        return "http://localhost:" + wireMockServer.port() + TestConstants.RESPONSE_URL_PATH;
    }
}
