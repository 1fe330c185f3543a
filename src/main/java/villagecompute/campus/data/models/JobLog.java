package villagecompute.campus.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Audit record of one execution attempt of a {@link ScheduledJob}.
 *
 * <p>
 * A row is inserted with status {@link LogStatus#RUNNING} the moment a run starts and is moved exactly once to
 * {@link LogStatus#SUCCESS} or {@link LogStatus#FAILED}. Terminal rows are never modified again; {@link #complete} and
 * {@link #fail} refuse to touch them. Job name and class are denormalized so history survives edits to the definition.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK)</li>
 * <li>{@code scheduled_job_id} (BIGINT) - Owning job</li>
 * <li>{@code job_name}, {@code job_class} (TEXT) - Copied from the job at start</li>
 * <li>{@code status} (TEXT) - RUNNING, SUCCESS, FAILED</li>
 * <li>{@code message} (TEXT) - Human readable summary</li>
 * <li>{@code output} (TEXT) - Handler output lines</li>
 * <li>{@code error} (TEXT) - Stack trace for failed runs</li>
 * <li>{@code metadata} (JSON) - Handler counters</li>
 * <li>{@code started_at}, {@code completed_at} (TIMESTAMPTZ)</li>
 * <li>{@code execution_time_ms} (BIGINT)</li>
 * </ul>
 */
@Entity
@Table(
        name = "job_logs",
        indexes = {@Index(
                name = "idx_job_logs_job_started",
                columnList = "scheduled_job_id, started_at")})
public class JobLog extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "scheduled_job_id",
            nullable = false)
    public Long scheduledJobId;

    @Column(
            name = "job_name",
            nullable = false)
    public String jobName;

    @Column(
            name = "job_class",
            nullable = false)
    public String jobClass;

    @Column(
            nullable = false,
            length = 20)
    @Enumerated(EnumType.STRING)
    public LogStatus status;

    @Column(
            columnDefinition = "TEXT")
    public String message;

    @Column(
            columnDefinition = "TEXT")
    public String output;

    @Column(
            columnDefinition = "TEXT")
    public String error;

    @Column(
            name = "metadata")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> metadata;

    @Column(
            name = "started_at",
            nullable = false)
    public Instant startedAt;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            name = "execution_time_ms")
    public Long executionTimeMs;

    /**
     * Run outcome. {@code RUNNING} is the only non-terminal state.
     */
    public enum LogStatus {
        RUNNING, SUCCESS, FAILED;

        public boolean isTerminal() {
            return this != RUNNING;
        }
    }

    /**
     * Creates and persists a {@code RUNNING} log for a job. Must run inside a transaction.
     *
     * @param job
     *            the job about to run
     * @param startedAt
     *            dispatch instant
     * @return the persisted log
     */
    public static JobLog start(ScheduledJob job, Instant startedAt) {
        JobLog log = new JobLog();
        log.scheduledJobId = job.id;
        log.jobName = job.name;
        log.jobClass = job.jobClass;
        log.status = LogStatus.RUNNING;
        log.startedAt = startedAt;
        log.persist();
        return log;
    }

    /**
     * Marks the run successful.
     *
     * @throws IllegalStateException
     *             if the log already reached a terminal status
     */
    public void complete(String message, String output, Map<String, Object> metadata, Instant completedAt) {
        requireRunning();
        this.status = LogStatus.SUCCESS;
        this.message = message;
        this.output = output;
        this.metadata = metadata;
        finish(completedAt);
    }

    /**
     * Marks the run failed.
     *
     * @throws IllegalStateException
     *             if the log already reached a terminal status
     */
    public void fail(String message, String error, String output, Map<String, Object> metadata, Instant completedAt) {
        requireRunning();
        this.status = LogStatus.FAILED;
        this.message = message;
        this.error = error;
        this.output = output;
        this.metadata = metadata;
        finish(completedAt);
    }

    private void requireRunning() {
        if (status != null && status.isTerminal()) {
            throw new IllegalStateException("JobLog " + id + " is already " + status);
        }
    }

    private void finish(Instant completedAt) {
        this.completedAt = completedAt;
        this.executionTimeMs = Math.max(0L, completedAt.toEpochMilli() - startedAt.toEpochMilli());
    }

    /**
     * Builds a filtered, newest-first query over one job's logs.
     *
     * @param jobId
     *            scheduled job id
     * @param from
     *            inclusive lower bound on {@code started_at}, or null
     * @param to
     *            exclusive upper bound on {@code started_at}, or null
     * @param status
     *            status filter, or null for all
     * @return pageable query
     */
    public static PanacheQuery<JobLog> findForJob(Long jobId, Instant from, Instant to, LogStatus status) {
        StringBuilder query = new StringBuilder("scheduledJobId = :jobId");
        Parameters params = Parameters.with("jobId", jobId);
        if (from != null) {
            query.append(" AND startedAt >= :from");
            params.and("from", from);
        }
        if (to != null) {
            query.append(" AND startedAt < :to");
            params.and("to", to);
        }
        if (status != null) {
            query.append(" AND status = :status");
            params.and("status", status);
        }
        return find(query.toString(), Sort.descending("startedAt").and("id", Sort.Direction.Descending), params);
    }

    public static long countForJob(Long jobId) {
        return count("scheduledJobId", jobId);
    }

    /**
     * Deletes every log of a job. Must run inside a transaction.
     *
     * @return number of rows removed
     */
    public static long deleteForJob(Long jobId) {
        return delete("scheduledJobId", jobId);
    }
}
