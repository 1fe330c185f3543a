package villagecompute.campus.services;

import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.panache.common.Page;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.campus.api.types.JobLogPageType;
import villagecompute.campus.api.types.JobLogType;
import villagecompute.campus.api.types.ScheduledJobRequestType;
import villagecompute.campus.data.models.JobLog;
import villagecompute.campus.data.models.ScheduledJob;
import villagecompute.campus.exceptions.ResourceConflictException;
import villagecompute.campus.exceptions.ResourceNotFoundException;
import villagecompute.campus.exceptions.ValidationException;
import villagecompute.campus.jobs.JobClass;
import villagecompute.campus.jobs.ScheduleType;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Administrative operations on the scheduled job registry and its run history.
 *
 * <p>
 * Every write keeps {@code next_run_at} consistent with the schedule: create computes it, and an update that changes
 * {@code schedule_type} or {@code schedule_config} recomputes it from the current instant. A job with run history
 * cannot be deleted until its logs are cleared.
 */
@ApplicationScoped
public class ScheduledJobService {

    private static final Logger LOG = Logger.getLogger(ScheduledJobService.class);

    static final int DEFAULT_PER_PAGE = 20;
    static final int MAX_PER_PAGE = 100;

    @Inject
    ScheduleCalculator scheduleCalculator;

    @Inject
    Clock clock;

    public List<ScheduledJob> listJobs() {
        return ScheduledJob.listAll(Sort.ascending("id"));
    }

    /**
     * @throws ResourceNotFoundException
     *             if no job has this id
     */
    public ScheduledJob getJob(Long id) {
        ScheduledJob job = ScheduledJob.findById(id);
        if (job == null) {
            throw new ResourceNotFoundException("Scheduled job not found: " + id);
        }
        return job;
    }

    /**
     * Creates a job and computes its first run.
     *
     * @throws ValidationException
     *             if a required field is missing, the job class is unknown or the schedule is invalid
     */
    @Transactional
    public ScheduledJob createJob(ScheduledJobRequestType request) {
        if (request == null) {
            throw new ValidationException("Request body required");
        }
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        requireKnownJobClass(request.jobClass());
        if (request.scheduleType() == null) {
            throw new ValidationException("schedule_type is required");
        }

        Instant now = clock.instant();
        ScheduledJob job = new ScheduledJob();
        job.name = request.name().trim();
        job.description = request.description();
        job.jobClass = request.jobClass();
        job.scheduleType = request.scheduleType();
        job.scheduleConfig = copyOrNull(request.scheduleConfig());
        job.enabled = request.enabled() == null || request.enabled();
        job.metadata = copyOrNull(request.metadata());
        job.nextRunAt = scheduleCalculator.nextRun(job.scheduleType, job.scheduleConfig, now);
        job.createdAt = now;
        job.updatedAt = now;
        job.persist();

        LOG.infof("Created scheduled job %d (%s, %s), next run at %s", job.id, job.name, job.jobClass, job.nextRunAt);
        return job;
    }

    /**
     * Applies the non-null fields of {@code request} to an existing job.
     *
     * @throws ResourceNotFoundException
     *             if no job has this id
     * @throws ValidationException
     *             if the resulting definition is invalid
     */
    @Transactional
    public ScheduledJob updateJob(Long id, ScheduledJobRequestType request) {
        if (request == null) {
            throw new ValidationException("Request body required");
        }
        ScheduledJob job = getJob(id);

        if (request.name() != null) {
            if (request.name().isBlank()) {
                throw new ValidationException("name must not be blank");
            }
            job.name = request.name().trim();
        }
        if (request.description() != null) {
            job.description = request.description();
        }
        if (request.jobClass() != null) {
            requireKnownJobClass(request.jobClass());
            job.jobClass = request.jobClass();
        }
        if (request.enabled() != null) {
            job.enabled = request.enabled();
        }
        if (request.metadata() != null) {
            Object lastResult = job.metadata == null ? null : job.metadata.get(ScheduledJob.METADATA_LAST_RESULT);
            Map<String, Object> metadata = new LinkedHashMap<>(request.metadata());
            if (lastResult != null) {
                metadata.putIfAbsent(ScheduledJob.METADATA_LAST_RESULT, lastResult);
            }
            job.metadata = metadata;
        }

        ScheduleType newType = request.scheduleType() != null ? request.scheduleType() : job.scheduleType;
        Map<String, Object> newConfig = request.scheduleConfig() != null ? copyOrNull(request.scheduleConfig())
                : job.scheduleConfig;
        boolean scheduleChanged = newType != job.scheduleType || !Objects.equals(newConfig, job.scheduleConfig);

        Instant now = clock.instant();
        if (scheduleChanged) {
            job.nextRunAt = scheduleCalculator.nextRun(newType, newConfig, now);
            job.scheduleType = newType;
            job.scheduleConfig = newConfig;
            LOG.infof("Schedule of job %d changed to %s, next run at %s", job.id, newType.wireName(), job.nextRunAt);
        }
        job.updatedAt = now;
        return job;
    }

    /**
     * Deletes a job without run history.
     *
     * @throws ResourceNotFoundException
     *             if no job has this id
     * @throws ResourceConflictException
     *             if JobLog rows still reference the job
     */
    @Transactional
    public void deleteJob(Long id) {
        ScheduledJob job = getJob(id);
        long logs = JobLog.countForJob(id);
        if (logs > 0) {
            throw new ResourceConflictException(
                    "Scheduled job " + id + " has " + logs + " log(s); clear them before deleting the job");
        }
        job.delete();
        LOG.infof("Deleted scheduled job %d (%s)", id, job.name);
    }

    /**
     * Returns one page of a job's run history, newest first.
     *
     * @param id
     *            job id
     * @param from
     *            inclusive lower bound on {@code started_at}, or null
     * @param to
     *            exclusive upper bound on {@code started_at}, or null
     * @param status
     *            status filter, or null
     * @param page
     *            1-based page number
     * @param perPage
     *            page size, capped at {@value #MAX_PER_PAGE}
     * @throws ResourceNotFoundException
     *             if no job has this id
     */
    public JobLogPageType findLogs(Long id, Instant from, Instant to, JobLog.LogStatus status, int page,
            int perPage) {
        getJob(id);
        if (page < 1) {
            throw new ValidationException("page must be at least 1");
        }
        if (perPage < 1 || perPage > MAX_PER_PAGE) {
            throw new ValidationException("per_page must be between 1 and " + MAX_PER_PAGE);
        }

        PanacheQuery<JobLog> query = JobLog.findForJob(id, from, to, status).page(Page.of(page - 1, perPage));
        List<JobLogType> logs = query.list().stream().map(JobLogType::from).toList();
        long total = query.count();
        int totalPages = (int) ((total + perPage - 1) / perPage);
        return new JobLogPageType(logs, page, perPage, total, totalPages);
    }

    /**
     * Deletes all run history of a job.
     *
     * @return number of deleted logs
     * @throws ResourceNotFoundException
     *             if no job has this id
     */
    @Transactional
    public long clearLogs(Long id) {
        getJob(id);
        long deleted = JobLog.deleteForJob(id);
        LOG.infof("Cleared %d log(s) of scheduled job %d", deleted, id);
        return deleted;
    }

    private static void requireKnownJobClass(String jobClass) {
        if (jobClass == null || jobClass.isBlank()) {
            throw new ValidationException("job_class is required");
        }
        if (JobClass.fromClassName(jobClass).isEmpty()) {
            throw new ValidationException("Unknown job_class: " + jobClass);
        }
    }

    private static Map<String, Object> copyOrNull(Map<String, Object> source) {
        return source == null ? null : new LinkedHashMap<>(source);
    }
}
