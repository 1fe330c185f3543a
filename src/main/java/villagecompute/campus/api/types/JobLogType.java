package villagecompute.campus.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.campus.data.models.JobLog;

import java.time.Instant;
import java.util.Map;

/**
 * API type for one job run record.
 */
@Schema(
        description = "Record of one job run")
public record JobLogType(Long id,

        @JsonProperty("scheduled_job_id") Long scheduledJobId,

        @JsonProperty("job_name") String jobName,

        @JsonProperty("job_class") String jobClass,

        @Schema(
                description = "Run status",
                example = "SUCCESS") String status,

        String message,

        String output,

        @Schema(
                description = "Stack trace of a failed run",
                nullable = true) String error,

        Map<String, Object> metadata,

        @JsonProperty("started_at") Instant startedAt,

        @JsonProperty("completed_at") Instant completedAt,

        @JsonProperty("execution_time_ms") Long executionTimeMs) {

    public static JobLogType from(JobLog log) {
        return new JobLogType(log.id, log.scheduledJobId, log.jobName, log.jobClass, log.status.name(), log.message,
                log.output, log.error, log.metadata, log.startedAt, log.completedAt, log.executionTimeMs);
    }
}
