package peopleops.compensation.api.rest;

import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import peopleops.compensation.api.filters.SyncEndpointSecured;
import peopleops.compensation.api.types.JobResultType;
import peopleops.compensation.api.types.JobRunResponseType;
import peopleops.compensation.api.types.KeeperTestPayloadType;
import peopleops.compensation.api.types.ScheduledJobType;
import peopleops.compensation.data.models.ScheduledJob;
import peopleops.compensation.observability.LoggingConfig;
import peopleops.compensation.services.ScheduledJobService;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Trigger and administration endpoints for the scheduled job queue.
 *
 * <p>
 * All endpoints require {@code Authorization: Bearer <compensation.sync-endpoint-key>}. An external cron calls
 * {@code POST /api/jobs/run} periodically; overlapping calls are safe.
 */
@Path("/api/jobs")
@SyncEndpointSecured
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Jobs",
        description = "Scheduled background job operations")
public class ScheduledJobResource {

    private static final Logger LOG = Logger.getLogger(ScheduledJobResource.class);

    @Inject
    ScheduledJobService scheduledJobService;

    @POST
    @Path("/run")
    @Operation(
            summary = "Run one job cycle",
            description = "Claims due jobs, executes them and commits each outcome")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Cycle ran, per-job results included",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = JobRunResponseType.class))),
                    @APIResponse(
                            responseCode = "401",
                            description = "Missing or invalid bearer token"),
                    @APIResponse(
                            responseCode = "500",
                            description = "Jobs could not be claimed")})
    public Response run() {
        LoggingConfig.setRequestOrigin("/api/jobs/run");
        try {
            List<JobResultType> results = scheduledJobService.runCycle();
            return Response.ok(JobRunResponseType.completed(results)).build();
        } catch (PersistenceException e) {
            LOG.errorf(e, "Job cycle aborted: %s", e.getMessage());
            return Response.serverError().entity(JobRunResponseType.failed("Failed to claim jobs: " + e.getMessage()))
                    .build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @POST
    @Path("/keeper-tests")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Enqueue a keeper test",
            description = "Schedules a send_keeper_test job for the given employee and manager")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Job created",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ScheduledJobType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid payload or scheduled time"),
                    @APIResponse(
                            responseCode = "401",
                            description = "Missing or invalid bearer token")})
    public Response enqueueKeeperTest(@Valid @NotNull KeeperTestPayloadType payload,
            @QueryParam("scheduled") String scheduled) {
        Instant scheduledAt = parseScheduled(scheduled);
        ScheduledJob job = scheduledJobService.enqueueKeeperTest(payload, scheduledAt);
        return Response.status(Response.Status.CREATED).entity(ScheduledJobType.fromEntity(job)).build();
    }

    @GET
    @Path("/dead-letters")
    @Operation(
            summary = "List dead-lettered jobs",
            description = "Jobs that reached the failure threshold, most recent first")
    public List<ScheduledJobType> deadLetters() {
        return scheduledJobService.listDeadLetters().stream().map(ScheduledJobType::fromEntity).toList();
    }

    private static Instant parseScheduled(String scheduled) {
        if (scheduled == null || scheduled.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(scheduled);
        } catch (DateTimeParseException e) {
            throw new BadRequestException("scheduled must be an ISO-8601 instant, got: " + scheduled);
        }
    }
}
