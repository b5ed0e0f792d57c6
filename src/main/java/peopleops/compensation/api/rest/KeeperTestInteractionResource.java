package peopleops.compensation.api.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import peopleops.compensation.api.filters.SyncEndpointAuthenticator;
import peopleops.compensation.api.types.KeeperTestSubmissionResponseType;
import peopleops.compensation.api.types.SlackInteractionType;
import peopleops.compensation.exceptions.InvalidInteractionException;
import peopleops.compensation.observability.LoggingConfig;
import peopleops.compensation.services.KeeperTestResultService;
import peopleops.compensation.services.KeeperTestResultService.SubmissionResult;

/**
 * Slack interactivity endpoint for the keeper test form.
 *
 * <p>
 * Slack posts {@code application/x-www-form-urlencoded} with the interaction JSON in the {@code payload} field. It
 * cannot send an {@code Authorization} header, so the Request URL configured in the Slack app carries the sync key as
 * {@code ?token=}.
 *
 * <p>
 * <b>Example Request URL:</b>
 *
 * <pre>
 * https://compensation.example.com/api/slack/interactions?token=SYNC_ENDPOINT_KEY
 * </pre>
 *
 * @see KeeperTestResultService for the submission flow
 */
@Path("/api/slack/interactions")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Slack",
        description = "Slack interactivity callbacks")
public class KeeperTestInteractionResource {

    private static final Logger LOG = Logger.getLogger(KeeperTestInteractionResource.class);

    @Inject
    SyncEndpointAuthenticator authenticator;

    @Inject
    KeeperTestResultService resultService;

    @Inject
    ObjectMapper objectMapper;

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(
            summary = "Receive a keeper test submission",
            description = "Stores the manager's answers and stops the reminders for that keeper test")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Submission stored, or interaction ignored"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Required answers missing or payload malformed"),
                    @APIResponse(
                            responseCode = "401",
                            description = "Missing or invalid token")})
    public Response receive(@QueryParam("token") String token, @FormParam("payload") String payload) {
        if (!authenticator.isValidToken(token)) {
            LOG.warn("Unauthorized Slack interaction callback");
            return Response.status(Response.Status.UNAUTHORIZED)
                    .entity(KeeperTestSubmissionResponseType.error("Unauthorized")).build();
        }

        LoggingConfig.setRequestOrigin("/api/slack/interactions");
        try {
            SlackInteractionType interaction = parse(payload);
            SubmissionResult result = resultService.handleInteraction(interaction);
            if (!result.isComplete()) {
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(KeeperTestSubmissionResponseType.incomplete(result.invalidFields())).build();
            }
            return Response.ok(KeeperTestSubmissionResponseType.accepted()).build();

        } catch (InvalidInteractionException e) {
            LOG.warnf("Rejected Slack interaction: %s", e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(KeeperTestSubmissionResponseType.error(e.getMessage())).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private SlackInteractionType parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new InvalidInteractionException("Missing payload");
        }
        try {
            return objectMapper.readValue(payload, SlackInteractionType.class);
        } catch (JsonProcessingException e) {
            throw new InvalidInteractionException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }
}
