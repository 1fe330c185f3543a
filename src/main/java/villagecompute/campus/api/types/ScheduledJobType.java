package villagecompute.campus.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.campus.data.models.ScheduledJob;
import villagecompute.campus.jobs.ScheduleType;

import java.time.Instant;
import java.util.Map;

/**
 * API type for a scheduled job definition.
 */
@Schema(
        description = "Scheduled job definition")
public record ScheduledJobType(@Schema(
        description = "Job id",
        example = "1") Long id,

        @Schema(
                description = "Display name") String name,

        @Schema(
                description = "Description",
                nullable = true) String description,

        @Schema(
                description = "Handler name",
                example = "TaskReminderJob") @JsonProperty("job_class") String jobClass,

        @Schema(
                description = "Schedule family",
                example = "hourly") @JsonProperty("schedule_type") ScheduleType scheduleType,

        @Schema(
                description = "Schedule parameters",
                nullable = true) @JsonProperty("schedule_config") Map<String, Object> scheduleConfig,

        @Schema(
                description = "Whether the job is dispatched") boolean enabled,

        @Schema(
                description = "Dispatch instant of the last successful run",
                nullable = true) @JsonProperty("last_run_at") Instant lastRunAt,

        @Schema(
                description = "Earliest instant the job is due again",
                nullable = true) @JsonProperty("next_run_at") Instant nextRunAt,

        @Schema(
                description = "Handler overrides and last_result counters",
                nullable = true) Map<String, Object> metadata,

        @Schema(
                description = "Creation time") @JsonProperty("created_at") Instant createdAt,

        @Schema(
                description = "Last modification time") @JsonProperty("updated_at") Instant updatedAt) {

    public static ScheduledJobType from(ScheduledJob job) {
        return new ScheduledJobType(job.id, job.name, job.description, job.jobClass, job.scheduleType,
                job.scheduleConfig, job.enabled, job.lastRunAt, job.nextRunAt, job.metadata, job.createdAt,
                job.updatedAt);
    }
}
