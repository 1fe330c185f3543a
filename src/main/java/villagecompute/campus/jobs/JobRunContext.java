package villagecompute.campus.jobs;

import villagecompute.campus.exceptions.ValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run state shared between the dispatcher and a {@link JobHandler}.
 *
 * <p>
 * The dispatcher creates one context per run. The handler reads the dispatch instant, the scheduler zone and the job's
 * metadata from it, and writes its outcome back: a summary {@link #setMessage(String) message}, free-form
 * {@link #appendOutput(String) output} lines and structured {@link #increment(String) counters}. After the handler
 * returns, the dispatcher copies all three into the run's JobLog and stores the counters under
 * {@code metadata.last_result} of the ScheduledJob.
 *
 * <p>
 * Not thread-safe; a context belongs to exactly one run on one thread.
 */
public final class JobRunContext {

    private final Long jobId;
    private final String jobName;
    private final Instant now;
    private final ZoneId zone;
    private final Map<String, Object> jobMetadata;
    private final Map<String, Object> results = new LinkedHashMap<>();
    private final List<String> output = new ArrayList<>();
    private String message;

    public JobRunContext(Long jobId, String jobName, Instant now, ZoneId zone, Map<String, Object> jobMetadata) {
        this.jobId = jobId;
        this.jobName = jobName;
        this.now = now;
        this.zone = zone;
        this.jobMetadata = jobMetadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(jobMetadata));
    }

    public Long jobId() {
        return jobId;
    }

    public String jobName() {
        return jobName;
    }

    /**
     * Returns the dispatch instant. Handlers must use this instead of the wall clock so that a whole run sees one
     * consistent "now".
     */
    public Instant now() {
        return now;
    }

    public ZoneId zone() {
        return zone;
    }

    public ZonedDateTime zonedNow() {
        return now.atZone(zone);
    }

    public LocalDate today() {
        return zonedNow().toLocalDate();
    }

    /**
     * Returns a read-only view of the ScheduledJob's metadata as it was when the run started.
     */
    public Map<String, Object> jobMetadata() {
        return jobMetadata;
    }

    /**
     * Reads a positive integer override from the job metadata.
     *
     * @param key
     *            metadata key, e.g. {@code reminder_hours}
     * @param defaultValue
     *            value used when the key is absent
     * @return the override or the default
     * @throws ValidationException
     *             if the value is present but not a positive integer
     */
    public int intMetadata(String key, int defaultValue) {
        Object raw = jobMetadata.get(key);
        if (raw == null) {
            return defaultValue;
        }
        int value;
        if (raw instanceof Number number) {
            value = number.intValue();
        } else {
            try {
                value = Integer.parseInt(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Metadata " + key + " must be an integer: " + raw, e);
            }
        }
        if (value <= 0) {
            throw new ValidationException("Metadata " + key + " must be positive: " + raw);
        }
        return value;
    }

    public String message() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public void appendOutput(String line) {
        output.add(line);
    }

    /**
     * Returns the output lines joined by newlines, or null if the handler wrote none.
     */
    public String output() {
        return output.isEmpty() ? null : String.join("\n", output);
    }

    /**
     * Increments a result counter by one, creating it at zero first if needed.
     */
    public void increment(String key) {
        increment(key, 1);
    }

    public void increment(String key, int delta) {
        results.merge(key, delta, (a, b) -> ((Number) a).intValue() + ((Number) b).intValue());
    }

    /**
     * Ensures counters exist (at zero) so that a run with nothing to do still reports them.
     */
    public void initCounters(String... keys) {
        for (String key : keys) {
            results.putIfAbsent(key, 0);
        }
    }

    public void put(String key, Object value) {
        results.put(key, value);
    }

    public int count(String key) {
        Object value = results.get(key);
        return value instanceof Number number ? number.intValue() : 0;
    }

    /**
     * Returns the result metadata written by the handler (insertion ordered, mutable copy).
     */
    public Map<String, Object> results() {
        return new LinkedHashMap<>(results);
    }
}
