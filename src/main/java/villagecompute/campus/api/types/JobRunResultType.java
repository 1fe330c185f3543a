package villagecompute.campus.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Outcome of one job in a dispatch.
 *
 * @param id
 *            scheduled job id
 * @param name
 *            scheduled job name
 * @param status
 *            {@code success} or {@code skipped}
 */
@Schema(
        description = "Job executed or skipped by a dispatch")
public record JobRunResultType(@Schema(
        description = "Scheduled job id",
        example = "1") Long id,

        @Schema(
                description = "Scheduled job name",
                example = "Task Reminder (24h)") String name,

        @Schema(
                description = "Run status",
                example = "success") String status) {
}
