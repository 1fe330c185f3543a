package villagecompute.campus.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Result of one "run due jobs now" trigger.
 *
 * @param executed
 *            jobs that completed successfully
 * @param errors
 *            jobs whose run failed
 * @param skipped
 *            due jobs another dispatcher claimed first
 * @param total
 *            number of successful runs
 * @param timestamp
 *            dispatch instant
 */
@Schema(
        description = "Summary of a scheduler dispatch")
public record DispatchSummaryType(@Schema(
        description = "Jobs that completed successfully") List<JobRunResultType> executed,

        @Schema(
                description = "Jobs whose run failed") List<JobRunErrorType> errors,

        @Schema(
                description = "Due jobs claimed by a concurrent dispatch") List<JobRunResultType> skipped,

        @Schema(
                description = "Number of successful runs",
                example = "3") int total,

        @Schema(
                description = "Dispatch instant",
                example = "2025-01-07T04:00:00Z") Instant timestamp) {
}
