package villagecompute.campus.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import villagecompute.campus.exceptions.ValidationException;
import villagecompute.campus.jobs.ScheduleType;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Computes the next run instant of a recurring job.
 *
 * <p>
 * Stateless apart from the scheduler time zone, which is used for every time-of-day, weekday and day-of-month pin.
 * The result is always strictly after {@code now}.
 *
 * <p>
 * <b>Supported {@code schedule_config} keys:</b>
 * <table>
 * <tr>
 * <th>type</th>
 * <th>keys</th>
 * <th>without config</th>
 * </tr>
 * <tr>
 * <td>hourly</td>
 * <td>none</td>
 * <td>now + 1h</td>
 * </tr>
 * <tr>
 * <td>daily</td>
 * <td>{@code time} (HH:mm)</td>
 * <td>now + 1 day</td>
 * </tr>
 * <tr>
 * <td>twice_daily</td>
 * <td>{@code times} (list of HH:mm)</td>
 * <td>now + 12h</td>
 * </tr>
 * <tr>
 * <td>weekly</td>
 * <td>{@code day_of_week} (MONDAY..SUNDAY or 1..7), {@code time}</td>
 * <td>now + 7 days</td>
 * </tr>
 * <tr>
 * <td>monthly</td>
 * <td>{@code day_of_month} (1..31), {@code time}</td>
 * <td>now + 1 month</td>
 * </tr>
 * <tr>
 * <td>custom</td>
 * <td>{@code interval_minutes}; or {@code interval} + {@code unit} (minute, hour, day, week, month); or
 * {@code times}</td>
 * <td>now + 1 day</td>
 * </tr>
 * </table>
 *
 * <p>
 * <b>Month overflow:</b> a day of month that does not exist in the target month is clamped to that month's last day
 * (31 runs on 30 April and on 28 or 29 February). Unpinned monthly schedules follow {@link LocalDate#plusMonths(long)},
 * which applies the same clamp.
 */
@ApplicationScoped
public class ScheduleCalculator {

    private final ZoneId zone;

    @Inject
    public ScheduleCalculator(@ConfigProperty(
            name = "villagecompute.scheduler.time-zone",
            defaultValue = "Asia/Karachi") String timeZone) {
        this(ZoneId.of(timeZone));
    }

    public ScheduleCalculator(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Returns the next instant strictly after {@code now} at which a job with this schedule should run.
     *
     * @param type
     *            schedule family
     * @param config
     *            schedule parameters, may be null or empty
     * @param now
     *            reference instant
     * @return next run instant, always after {@code now}
     * @throws ValidationException
     *             if the type is missing or the config holds invalid values
     */
    public Instant nextRun(ScheduleType type, Map<String, Object> config, Instant now) {
        if (type == null) {
            throw new ValidationException("schedule_type is required");
        }
        Map<String, Object> cfg = config == null ? Map.of() : config;
        ZonedDateTime local = now.atZone(zone);

        Instant next = switch (type) {
            case HOURLY -> now.plus(Duration.ofHours(1));
            case DAILY -> nextDaily(local, cfg);
            case TWICE_DAILY -> nextTwiceDaily(local, cfg);
            case WEEKLY -> nextWeekly(local, cfg);
            case MONTHLY -> nextMonthly(local, cfg);
            case CUSTOM -> nextCustom(local, cfg);
        };

        if (!next.isAfter(now)) {
            // DST gap
            next = now.plus(Duration.ofMinutes(1));
        }
        return next;
    }

    /**
     * Validates a schedule definition by computing its next run from the current instant.
     *
     * @throws ValidationException
     *             if the definition is invalid
     */
    public void validate(ScheduleType type, Map<String, Object> config) {
        nextRun(type, config, Instant.now());
    }

    private Instant nextDaily(ZonedDateTime local, Map<String, Object> cfg) {
        LocalTime time = optionalTime(cfg, "time");
        return time == null ? local.plusDays(1).toInstant() : nextAtAnyOf(local, List.of(time));
    }

    private Instant nextTwiceDaily(ZonedDateTime local, Map<String, Object> cfg) {
        List<LocalTime> times = optionalTimes(cfg, "times");
        return times.isEmpty() ? local.plusHours(12).toInstant() : nextAtAnyOf(local, times);
    }

    private Instant nextWeekly(ZonedDateTime local, Map<String, Object> cfg) {
        DayOfWeek dayOfWeek = optionalDayOfWeek(cfg, "day_of_week");
        LocalTime time = optionalTime(cfg, "time");
        if (dayOfWeek == null && time == null) {
            return local.plusDays(7).toInstant();
        }
        DayOfWeek targetDay = dayOfWeek != null ? dayOfWeek : local.getDayOfWeek();
        LocalTime targetTime = time != null ? time : LocalTime.MIDNIGHT;

        ZonedDateTime candidate = local.with(TemporalAdjusters.nextOrSame(targetDay)).with(targetTime);
        if (!candidate.isAfter(local)) {
            candidate = candidate.plusWeeks(1);
        }
        return candidate.toInstant();
    }

    private Instant nextMonthly(ZonedDateTime local, Map<String, Object> cfg) {
        Integer dayOfMonth = optionalInt(cfg, "day_of_month", 1, 31);
        LocalTime time = optionalTime(cfg, "time");
        if (dayOfMonth == null && time == null) {
            return local.plusMonths(1).toInstant();
        }
        int day = dayOfMonth != null ? dayOfMonth : local.getDayOfMonth();
        LocalTime targetTime = time != null ? time : LocalTime.MIDNIGHT;

        LocalDate thisMonth = clampToMonth(local.toLocalDate(), day);
        ZonedDateTime candidate = thisMonth.atTime(targetTime).atZone(zone);
        if (!candidate.isAfter(local)) {
            LocalDate nextMonth = clampToMonth(local.toLocalDate().withDayOfMonth(1).plusMonths(1), day);
            candidate = nextMonth.atTime(targetTime).atZone(zone);
        }
        return candidate.toInstant();
    }

    private Instant nextCustom(ZonedDateTime local, Map<String, Object> cfg) {
        Integer intervalMinutes = optionalInt(cfg, "interval_minutes", 1, Integer.MAX_VALUE);
        if (intervalMinutes != null) {
            return local.plusMinutes(intervalMinutes).toInstant();
        }
        if (cfg.containsKey("interval") || cfg.containsKey("unit")) {
            Integer interval = optionalInt(cfg, "interval", 1, Integer.MAX_VALUE);
            int amount = interval != null ? interval : 1;
            String unit = cfg.get("unit") == null ? "day" : cfg.get("unit").toString();
            return local.plus(amount, parseUnit(unit)).toInstant();
        }
        List<LocalTime> times = optionalTimes(cfg, "times");
        if (!times.isEmpty()) {
            return nextAtAnyOf(local, times);
        }
        return local.plusDays(1).toInstant();
    }

    /**
     * Returns the earliest of the given local times strictly after {@code local}, today or tomorrow.
     */
    private Instant nextAtAnyOf(ZonedDateTime local, List<LocalTime> times) {
        ZonedDateTime best = null;
        for (LocalTime time : times) {
            ZonedDateTime candidate = local.toLocalDate().atTime(time).atZone(zone);
            if (!candidate.isAfter(local)) {
                candidate = local.toLocalDate().plusDays(1).atTime(time).atZone(zone);
            }
            if (best == null || candidate.isBefore(best)) {
                best = candidate;
            }
        }
        return best.toInstant();
    }

    /**
     * Moves {@code date} to {@code day} within its own month, clamped to the month's last day.
     */
    static LocalDate clampToMonth(LocalDate date, int day) {
        return date.withDayOfMonth(Math.min(day, date.lengthOfMonth()));
    }

    private static ChronoUnit parseUnit(String unit) {
        String normalized = unit.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("s")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return switch (normalized) {
            case "minute" -> ChronoUnit.MINUTES;
            case "hour" -> ChronoUnit.HOURS;
            case "day" -> ChronoUnit.DAYS;
            case "week" -> ChronoUnit.WEEKS;
            case "month" -> ChronoUnit.MONTHS;
            default -> throw new ValidationException("Unsupported schedule unit: " + unit);
        };
    }

    private static LocalTime optionalTime(Map<String, Object> cfg, String key) {
        Object raw = cfg.get(key);
        if (raw == null || raw.toString().isBlank()) {
            return null;
        }
        return parseTime(key, raw.toString());
    }

    private static List<LocalTime> optionalTimes(Map<String, Object> cfg, String key) {
        Object raw = cfg.get(key);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof Collection<?> values)) {
            throw new ValidationException("schedule_config." + key + " must be a list of HH:mm times");
        }
        List<LocalTime> times = new ArrayList<>();
        for (Object value : values) {
            if (value == null) {
                throw new ValidationException("schedule_config." + key + " must not contain null");
            }
            times.add(parseTime(key, value.toString()));
        }
        return times;
    }

    private static LocalTime parseTime(String key, String value) {
        String trimmed = value.trim();
        // Accept 9:00 as well as 09:00
        if (trimmed.indexOf(':') == 1) {
            trimmed = "0" + trimmed;
        }
        try {
            return LocalTime.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new ValidationException("schedule_config." + key + " is not a valid HH:mm time: " + value, e);
        }
    }

    private static DayOfWeek optionalDayOfWeek(Map<String, Object> cfg, String key) {
        Object raw = cfg.get(key);
        if (raw == null || raw.toString().isBlank()) {
            return null;
        }
        try {
            if (raw instanceof Number number) {
                return DayOfWeek.of(number.intValue());
            }
            String value = raw.toString().trim();
            if (value.chars().allMatch(Character::isDigit)) {
                return DayOfWeek.of(Integer.parseInt(value));
            }
            return DayOfWeek.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (DateTimeException | IllegalArgumentException e) {
            throw new ValidationException("schedule_config." + key + " is not a valid day of week: " + raw, e);
        }
    }

    private static Integer optionalInt(Map<String, Object> cfg, String key, int min, int max) {
        Object raw = cfg.get(key);
        if (raw == null || raw.toString().isBlank()) {
            return null;
        }
        long value;
        if (raw instanceof Number number) {
            if (number.doubleValue() != Math.floor(number.doubleValue())) {
                throw new ValidationException("schedule_config." + key + " must be a whole number: " + raw);
            }
            value = number.longValue();
        } else {
            try {
                value = Long.parseLong(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("schedule_config." + key + " must be a whole number: " + raw, e);
            }
        }
        if (value < min || value > max) {
            throw new ValidationException("schedule_config." + key + " must be between " + min + " and " + max);
        }
        return (int) value;
    }
}
