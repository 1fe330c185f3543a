package villagecompute.campus.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.campus.jobs.ScheduleType;

import java.util.Map;

/**
 * API request type for creating or updating a scheduled job.
 *
 * <p>
 * On create, {@code name}, {@code job_class} and {@code schedule_type} are required. On update every field is optional
 * and null means "no change".
 *
 * @param name
 *            display name
 * @param description
 *            optional description
 * @param jobClass
 *            handler name, e.g. {@code VoucherGenerationJob}
 * @param scheduleType
 *            schedule family
 * @param scheduleConfig
 *            schedule parameters
 * @param enabled
 *            whether the job is dispatched
 * @param metadata
 *            handler overrides such as {@code reminder_hours}
 */
@Schema(
        description = "Request to create or update a scheduled job")
public record ScheduledJobRequestType(@Schema(
        description = "Display name",
        example = "Task Reminder (24h)") @Size(
                max = 255) String name,

        @Schema(
                description = "Optional description",
                nullable = true) String description,

        @Schema(
                description = "Handler name",
                example = "TaskReminderJob") @JsonProperty("job_class") String jobClass,

        @Schema(
                description = "Schedule family",
                example = "hourly") @JsonProperty("schedule_type") ScheduleType scheduleType,

        @Schema(
                description = "Schedule parameters (time, times, day_of_week, day_of_month, interval_minutes, ...)",
                example = "{\"time\": \"09:00\"}",
                nullable = true) @JsonProperty("schedule_config") Map<String, Object> scheduleConfig,

        @Schema(
                description = "Whether the job is dispatched",
                example = "true",
                nullable = true) Boolean enabled,

        @Schema(
                description = "Handler overrides",
                example = "{\"reminder_hours\": 24}",
                nullable = true) Map<String, Object> metadata) {
}
