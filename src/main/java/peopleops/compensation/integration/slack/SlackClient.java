package peopleops.compensation.integration.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import peopleops.compensation.exceptions.MessagingException;
import peopleops.compensation.integration.messaging.MessageContent;
import peopleops.compensation.integration.messaging.MessagingClient;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the Slack Web API.
 *
 * <h2>API Details</h2>
 * <ul>
 * <li>Base URL: https://slack.com/api (configurable via {@code slack.api.base-url})</li>
 * <li>Authentication: bot token as {@code Authorization: Bearer} ({@code slack.token})</li>
 * <li>{@code GET users.lookupByEmail?email=...} returns {@code user.id}</li>
 * <li>{@code POST chat.postMessage} with JSON {@code channel, text, blocks, thread_ts} returns {@code ts}</li>
 * <li>Interaction replies are POSTed to the payload's {@code response_url}, which must start with
 * {@code slack.response-url-prefix}</li>
 * </ul>
 *
 * <p>
 * Slack answers most errors with HTTP 200 and {@code "ok": false}; both that and any non-2xx status raise
 * {@link MessagingException}.
 *
 * @see <a href="https://api.slack.com/methods">Slack Web API methods</a>
 */
@ApplicationScoped
public class SlackClient implements MessagingClient {

    private static final Logger LOG = Logger.getLogger(SlackClient.class);

    private static final int TIMEOUT_SECONDS = 10;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String token;
    private final String responseUrlPrefix;

    @Inject
    public SlackClient(ObjectMapper objectMapper, @ConfigProperty(
            name = "slack.api.base-url",
            defaultValue = "https://slack.com/api") String baseUrl,
            @ConfigProperty(
                    name = "slack.token",
                    defaultValue = "") String token,
            @ConfigProperty(
                    name = "slack.response-url-prefix",
                    defaultValue = "https://hooks.slack.com/") String responseUrlPrefix) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.responseUrlPrefix = responseUrlPrefix;
        this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(5)).build();
    }

    @Override
    public String lookupUserByEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new MessagingException("Cannot look up Slack user without an email");
        }
        String url = baseUrl + "/users.lookupByEmail?email=" + URLEncoder.encode(email, StandardCharsets.UTF_8);
        HttpRequest request = authorized(HttpRequest.newBuilder().uri(URI.create(url))).GET().build();

        JsonNode body = send("users.lookupByEmail", request);
        String userId = body.path("user").path("id").asText(null);
        if (userId == null || userId.isBlank()) {
            throw new MessagingException("users.lookupByEmail returned no user id");
        }
        LOG.debugf("Resolved Slack user %s", userId);
        return userId;
    }

    @Override
    public String postMessage(String userId, MessageContent content, String threadId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", userId);
        payload.put("text", content.text());
        if (!content.blocks().isEmpty()) {
            payload.put("blocks", content.blocks());
        }
        if (threadId != null && !threadId.isBlank()) {
            payload.put("thread_ts", threadId);
        }

        String json = toJson("chat.postMessage", payload);

        HttpRequest request = authorized(HttpRequest.newBuilder().uri(URI.create(baseUrl + "/chat.postMessage")))
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8)).build();

        JsonNode body = send("chat.postMessage", request);
        String ts = body.path("ts").asText(null);
        if (ts == null || ts.isBlank()) {
            throw new MessagingException("chat.postMessage returned no message ts");
        }
        LOG.debugf("Posted Slack message %s to %s (thread: %s)", ts, userId, threadId);
        return ts;
    }

    @Override
    public void respond(String responseUrl, MessageContent content, String threadId) {
        if (responseUrl == null || !responseUrl.startsWith(responseUrlPrefix)) {
            throw new MessagingException("Refusing to reply to response_url outside " + responseUrlPrefix);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", content.text());
        if (!content.blocks().isEmpty()) {
            payload.put("blocks", content.blocks());
        }
        if (threadId != null && !threadId.isBlank()) {
            payload.put("thread_ts", threadId);
        }
        payload.put("response_type", "in_channel");
        payload.put("replace_original", false);

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(responseUrl))
                .timeout(Duration.ofSeconds(TIMEOUT_SECONDS)).header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(toJson("response_url", payload), StandardCharsets.UTF_8))
                .build();

        // response_url answers a bare "ok" rather than the Web API envelope, so only the status is checked.
        HttpResponse<String> response = execute("response_url", request);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            LOG.errorf("Slack response_url returned status %d: %s", response.statusCode(), response.body());
            throw new MessagingException("Slack response_url returned status " + response.statusCode());
        }
        LOG.debugf("Replied to interaction (thread: %s)", threadId);
    }

    private String toJson(String method, Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new MessagingException("Failed to serialize " + method + " payload", e);
        }
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        return builder.timeout(Duration.ofSeconds(TIMEOUT_SECONDS)).header("Authorization", "Bearer " + token);
    }

    private HttpResponse<String> execute(String method, HttpRequest request) {
        HttpResponse<String> response;
        try {
            long startTime = System.currentTimeMillis();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            LOG.debugf("Slack %s returned %d (latency: %dms)", method, response.statusCode(),
                    System.currentTimeMillis() - startTime);
        } catch (IOException e) {
            throw new MessagingException("Slack " + method + " request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingException("Slack " + method + " request interrupted", e);
        }
        return response;
    }

    private JsonNode send(String method, HttpRequest request) {
        HttpResponse<String> response = execute(method, request);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            LOG.errorf("Slack %s returned status %d: %s", method, response.statusCode(), response.body());
            throw new MessagingException("Slack " + method + " returned status " + response.statusCode());
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new MessagingException("Slack " + method + " returned an unparseable body", e);
        }
        if (body == null || !body.path("ok").asBoolean(false)) {
            String error = body == null ? "empty_body" : body.path("error").asText("unknown_error");
            LOG.warnf("Slack %s failed: %s", method, error);
            throw new MessagingException("Slack " + method + " failed: " + error);
        }
        return body;
    }
}
