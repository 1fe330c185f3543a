package villagecompute.campus.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * One page of job run records, newest first.
 *
 * @param logs
 *            records on this page
 * @param page
 *            1-based page number
 * @param perPage
 *            page size
 * @param total
 *            number of matching records
 * @param totalPages
 *            number of pages
 */
@Schema(
        description = "Paginated job run records")
public record JobLogPageType(List<JobLogType> logs,

        @Schema(
                example = "1") int page,

        @Schema(
                example = "20") @JsonProperty("per_page") int perPage,

        @Schema(
                example = "42") long total,

        @Schema(
                example = "3") @JsonProperty("total_pages") int totalPages) {
}
