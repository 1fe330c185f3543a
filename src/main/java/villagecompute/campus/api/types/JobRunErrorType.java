package villagecompute.campus.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * A job whose run failed during a dispatch.
 *
 * @param id
 *            scheduled job id
 * @param name
 *            scheduled job name
 * @param error
 *            exception message
 */
@Schema(
        description = "Job that failed during a dispatch")
public record JobRunErrorType(@Schema(
        description = "Scheduled job id",
        example = "2") Long id,

        @Schema(
                description = "Scheduled job name",
                example = "Voucher Generation") String name,

        @Schema(
                description = "Failure message",
                example = "Unknown job class: LegacyJob") String error) {
}
