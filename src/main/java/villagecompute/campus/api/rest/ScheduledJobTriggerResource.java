package villagecompute.campus.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.campus.api.types.DispatchSummaryType;
import villagecompute.campus.observability.LoggingConfig;
import villagecompute.campus.services.ScheduledJobDispatcher;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Entry point for the external cron: runs every scheduled job that is due now.
 *
 * <p>
 * When {@code villagecompute.scheduler.trigger-token} is set, callers must send it in {@code X-Scheduler-Token}. Per-job
 * failures are reported in the body with status 200; only an unexpected dispatcher failure produces a 500.
 */
@Path("/api/scheduled-jobs")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Scheduler",
        description = "Dispatch of due scheduled jobs")
public class ScheduledJobTriggerResource {

    private static final Logger LOG = Logger.getLogger(ScheduledJobTriggerResource.class);

    static final String TOKEN_HEADER = "X-Scheduler-Token";

    @Inject
    ScheduledJobDispatcher dispatcher;

    @ConfigProperty(
            name = "villagecompute.scheduler.trigger-token")
    Optional<String> triggerToken;

    @POST
    @Path("/execute")
    @Operation(
            summary = "Run due jobs",
            description = "Executes every enabled scheduled job whose next run is due")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Dispatch finished",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = DispatchSummaryType.class))),
                    @APIResponse(
                            responseCode = "401",
                            description = "Missing or wrong scheduler token")})
    public Response execute(@HeaderParam(TOKEN_HEADER) String token) {
        if (!authorized(token)) {
            LOG.warn("Rejected scheduler trigger with missing or invalid token");
            return Response.status(Response.Status.UNAUTHORIZED).entity(new ErrorResponse("Invalid scheduler token"))
                    .build();
        }

        try {
            LoggingConfig.setRequestOrigin("/api/scheduled-jobs/execute");
            DispatchSummaryType summary = dispatcher.runDueJobs();
            return Response.ok(summary).build();
        } catch (Exception e) {
            LOG.errorf(e, "Scheduler dispatch failed");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Scheduler dispatch failed: " + e.getMessage())).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private boolean authorized(String token) {
        if (triggerToken.isEmpty() || triggerToken.get().isBlank()) {
            return true;
        }
        if (token == null) {
            return false;
        }
        return MessageDigest.isEqual(triggerToken.get().getBytes(StandardCharsets.UTF_8),
                token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
