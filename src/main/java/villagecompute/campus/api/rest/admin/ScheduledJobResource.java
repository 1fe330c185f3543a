package villagecompute.campus.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.campus.api.types.JobLogPageType;
import villagecompute.campus.api.types.ScheduledJobRequestType;
import villagecompute.campus.api.types.ScheduledJobType;
import villagecompute.campus.data.models.JobLog;
import villagecompute.campus.data.models.ScheduledJob;
import villagecompute.campus.exceptions.ResourceConflictException;
import villagecompute.campus.exceptions.ResourceNotFoundException;
import villagecompute.campus.exceptions.ValidationException;
import villagecompute.campus.services.ScheduleCalculator;
import villagecompute.campus.services.ScheduledJobService;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Admin REST endpoints for the scheduled job registry.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /admin/api/scheduled-jobs} – list jobs</li>
 * <li>{@code POST /admin/api/scheduled-jobs} – create a job</li>
 * <li>{@code GET /admin/api/scheduled-jobs/{id}} – get one job</li>
 * <li>{@code PUT /admin/api/scheduled-jobs/{id}} – update a job (null fields keep their value)</li>
 * <li>{@code DELETE /admin/api/scheduled-jobs/{id}} – delete a job without run history</li>
 * <li>{@code GET /admin/api/scheduled-jobs/{id}/logs} – paginated run history</li>
 * <li>{@code DELETE /admin/api/scheduled-jobs/{id}/logs} – clear run history</li>
 * </ul>
 *
 * <p>
 * <b>Security:</b> assumes deployment behind an authenticated admin gateway.
 *
 * <p>
 * Log filters {@code date_from} and {@code date_to} are calendar dates ({@code yyyy-MM-dd}) in the scheduler zone, both
 * inclusive.
 */
@Path("/admin/api/scheduled-jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Admin - Scheduled Jobs",
        description = "Scheduled job registry and run history")
public class ScheduledJobResource {

    private static final Logger LOG = Logger.getLogger(ScheduledJobResource.class);

    @Inject
    ScheduledJobService scheduledJobService;

    @Inject
    ScheduleCalculator scheduleCalculator;

    @GET
    @Operation(
            summary = "List scheduled jobs")
    public Response listJobs() {
        List<ScheduledJobType> response = scheduledJobService.listJobs().stream().map(ScheduledJobType::from)
                .toList();
        return Response.ok(response).build();
    }

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Get a scheduled job")
    public Response getJob(@PathParam("id") Long id) {
        try {
            return Response.ok(ScheduledJobType.from(scheduledJobService.getJob(id))).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @POST
    @Operation(
            summary = "Create a scheduled job",
            description = "Validates the schedule and computes the first run")
    public Response createJob(@Valid ScheduledJobRequestType request) {
        try {
            ScheduledJob job = scheduledJobService.createJob(request);
            return Response.status(Response.Status.CREATED).entity(ScheduledJobType.from(job)).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to create scheduled job");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to create scheduled job")).build();
        }
    }

    @PUT
    @Path("/{id}")
    @Operation(
            summary = "Update a scheduled job",
            description = "Recomputes the next run when schedule_type or schedule_config changes")
    public Response updateJob(@PathParam("id") Long id, @Valid ScheduledJobRequestType request) {
        try {
            ScheduledJob job = scheduledJobService.updateJob(id, request);
            return Response.ok(ScheduledJobType.from(job)).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to update scheduled job %d", id);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to update scheduled job")).build();
        }
    }

    @DELETE
    @Path("/{id}")
    @Operation(
            summary = "Delete a scheduled job",
            description = "Refused with 409 while run history exists")
    public Response deleteJob(@PathParam("id") Long id) {
        try {
            scheduledJobService.deleteJob(id);
            return Response.noContent().build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ResourceConflictException e) {
            return Response.status(Response.Status.CONFLICT).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @GET
    @Path("/{id}/logs")
    @Operation(
            summary = "List run history",
            description = "Newest first, filtered by date range and status")
    public Response listLogs(@PathParam("id") Long id, @QueryParam("date_from") String dateFrom,
            @QueryParam("date_to") String dateTo, @QueryParam("status") String status,
            @QueryParam("page") @DefaultValue("1") int page,
            @QueryParam("per_page") @DefaultValue("20") int perPage) {
        try {
            Instant from = dateFrom == null || dateFrom.isBlank() ? null : startOfDay(parseDate("date_from", dateFrom));
            Instant to = dateTo == null || dateTo.isBlank() ? null
                    : startOfDay(parseDate("date_to", dateTo).plusDays(1));
            JobLog.LogStatus logStatus = parseStatus(status);

            JobLogPageType response = scheduledJobService.findLogs(id, from, to, logStatus, page, perPage);
            return Response.ok(response).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @DELETE
    @Path("/{id}/logs")
    @Operation(
            summary = "Clear run history")
    public Response clearLogs(@PathParam("id") Long id) {
        try {
            long deleted = scheduledJobService.clearLogs(id);
            return Response.ok(Map.of("deleted", deleted)).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    private Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(scheduleCalculator.zone()).toInstant();
    }

    private static LocalDate parseDate(String name, String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException(name + " must be a yyyy-MM-dd date: " + value, e);
        }
    }

    private static JobLog.LogStatus parseStatus(String status) {
        if (status == null || status.isBlank() || "all".equalsIgnoreCase(status)) {
            return null;
        }
        try {
            return JobLog.LogStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown status: " + status, e);
        }
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
