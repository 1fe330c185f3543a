package villagecompute.campus.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Recurrence families supported by the schedule calculator.
 *
 * <p>
 * Serialized to JSON in lower snake case ({@code twice_daily}) to match the admin API; stored in the database by enum
 * name.
 *
 * @see villagecompute.campus.services.ScheduleCalculator
 */
public enum ScheduleType {

    /** Every hour. */
    HOURLY,

    /** Every day, optionally pinned to a local time of day. */
    DAILY,

    /** Every 12 hours, or at each listed local time. */
    TWICE_DAILY,

    /** Every 7 days, optionally pinned to a weekday and time. */
    WEEKLY,

    /** Every calendar month, optionally pinned to a day of month (clamped to month length). */
    MONTHLY,

    /** Entirely driven by {@code schedule_config}. */
    CUSTOM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScheduleType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(v -> v.name().equals(normalized)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown schedule type: " + value));
    }
}
