package villagecompute.campus.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * Result of an on-demand handler run.
 *
 * @param message
 *            summary written by the handler
 * @param results
 *            handler counters
 */
@Schema(
        description = "Result of an on-demand handler run")
public record JobRunReportType(@Schema(
        example = "Generated 3 voucher(s), skipped 1 existing voucher(s)") String message,

        @Schema(
                description = "Handler counters") Map<String, Object> results) {
}
