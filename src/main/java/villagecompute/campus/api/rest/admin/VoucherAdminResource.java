package villagecompute.campus.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.campus.api.types.JobRunReportType;
import villagecompute.campus.jobs.JobClass;
import villagecompute.campus.jobs.JobRunContext;
import villagecompute.campus.observability.LoggingConfig;
import villagecompute.campus.services.ScheduledJobDispatcher;

/**
 * Admin endpoint that runs voucher generation immediately.
 *
 * <p>
 * Uses the same handler as the scheduled job, so vouchers that already exist for the month are skipped. The run is not
 * recorded in the job's history and does not move its schedule.
 */
@Path("/admin/api/vouchers")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Admin - Vouchers",
        description = "On-demand voucher generation")
public class VoucherAdminResource {

    private static final Logger LOG = Logger.getLogger(VoucherAdminResource.class);

    @Inject
    ScheduledJobDispatcher dispatcher;

    @POST
    @Path("/generate")
    @Operation(
            summary = "Generate vouchers now")
    public Response generateVouchers() {
        try {
            LoggingConfig.setRequestOrigin("/admin/api/vouchers/generate");
            JobRunContext context = dispatcher.runNow(JobClass.VOUCHER_GENERATION);
            return Response.ok(new JobRunReportType(context.message(), context.results())).build();
        } catch (Exception e) {
            LOG.errorf(e, "On-demand voucher generation failed");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Voucher generation failed: " + e.getMessage())).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
