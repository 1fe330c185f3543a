package villagecompute.campus.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import villagecompute.campus.jobs.JobClass;
import villagecompute.campus.jobs.ScheduleType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Panache entity for a recurring job definition.
 *
 * <p>
 * Rows are created by the startup seeder or the admin API and mutated by the dispatcher on every run. The dispatcher
 * claims a due row by pushing {@code next_run_at} forward with a conditional update ({@link #claim}) before running it,
 * so overlapping triggers cannot execute the same row twice.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK) - Primary identifier</li>
 * <li>{@code name} (TEXT) - Display name, copied into each JobLog</li>
 * <li>{@code description} (TEXT) - Optional admin description</li>
 * <li>{@code job_class} (TEXT) - Handler discriminator, see {@link JobClass#getClassName()}</li>
 * <li>{@code schedule_type} (TEXT) - {@link ScheduleType} name</li>
 * <li>{@code schedule_config} (JSON) - Calculator parameters (time, times, day_of_week, interval_minutes, ...)</li>
 * <li>{@code enabled} (BOOLEAN) - Disabled jobs are never due</li>
 * <li>{@code last_run_at} (TIMESTAMPTZ) - Dispatch instant of the last successful run</li>
 * <li>{@code next_run_at} (TIMESTAMPTZ) - Earliest instant the job is due again (null = due now)</li>
 * <li>{@code metadata} (JSON) - Handler overrides and {@code last_result} counters</li>
 * </ul>
 *
 * <p>
 * {@code job_class} is kept as free text rather than an enum column so a row naming an unknown class fails only its own
 * run instead of the whole dispatch.
 *
 * @see JobLog for per-run history
 * @see villagecompute.campus.services.ScheduledJobDispatcher for the run lifecycle
 */
@Entity
@Table(
        name = "scheduled_jobs")
@NamedQuery(
        name = ScheduledJob.QUERY_FIND_DUE,
        query = "FROM ScheduledJob WHERE enabled = true AND (nextRunAt IS NULL OR nextRunAt <= :now) ORDER BY id")
@NamedQuery(
        name = ScheduledJob.QUERY_FIND_BY_JOB_CLASS,
        query = "FROM ScheduledJob WHERE jobClass = :jobClass ORDER BY id")
@NamedQuery(
        name = ScheduledJob.QUERY_CLAIM,
        query = "UPDATE ScheduledJob SET nextRunAt = :leaseUntil WHERE id = :id AND enabled = true "
                + "AND (nextRunAt IS NULL OR nextRunAt <= :now)")
public class ScheduledJob extends PanacheEntityBase {

    public static final String QUERY_FIND_DUE = "ScheduledJob.findDue";
    public static final String QUERY_FIND_BY_JOB_CLASS = "ScheduledJob.findByJobClass";
    public static final String QUERY_CLAIM = "ScheduledJob.claim";

    /** Metadata key under which the dispatcher stores the counters of the last successful run. */
    public static final String METADATA_LAST_RESULT = "last_result";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            nullable = false)
    public String name;

    @Column(
            columnDefinition = "TEXT")
    public String description;

    @Column(
            name = "job_class",
            nullable = false)
    public String jobClass;

    @Column(
            name = "schedule_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ScheduleType scheduleType;

    @Column(
            name = "schedule_config")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> scheduleConfig;

    @Column(
            nullable = false)
    public boolean enabled = true;

    @Column(
            name = "last_run_at")
    public Instant lastRunAt;

    @Column(
            name = "next_run_at")
    public Instant nextRunAt;

    @Column(
            name = "metadata")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> metadata;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Finds all enabled jobs whose {@code next_run_at} is null or not after {@code now}, oldest first.
     *
     * @param now
     *            dispatch instant
     * @return due jobs (may include jobs another dispatcher is about to claim)
     */
    public static List<ScheduledJob> findDue(Instant now) {
        if (now == null) {
            return List.of();
        }
        return find("#" + QUERY_FIND_DUE, Parameters.with("now", now)).list();
    }

    /**
     * Finds the first job registered for a job class.
     *
     * @param jobClass
     *            the job class
     * @return the job, or empty if none is registered
     */
    public static Optional<ScheduledJob> findByJobClass(JobClass jobClass) {
        if (jobClass == null) {
            return Optional.empty();
        }
        return find("#" + QUERY_FIND_BY_JOB_CLASS, Parameters.with("jobClass", jobClass.getClassName()))
                .firstResultOptional();
    }

    /**
     * Atomically claims a due job by moving its {@code next_run_at} to the end of a lease. Must run inside a
     * transaction.
     *
     * @param id
     *            job primary key
     * @param now
     *            dispatch instant
     * @param leaseUntil
     *            instant the claim expires if the run never reschedules the job
     * @return true if this caller won the claim, false if the job was not due (already claimed, disabled or deleted)
     */
    public static boolean claim(Long id, Instant now, Instant leaseUntil) {
        int updated = getEntityManager().createNamedQuery(QUERY_CLAIM).setParameter("leaseUntil", leaseUntil)
                .setParameter("id", id).setParameter("now", now).executeUpdate();
        return updated == 1;
    }

    /**
     * Returns a mutable copy of the metadata, never null.
     */
    public Map<String, Object> metadataCopy() {
        return metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
    }
}
