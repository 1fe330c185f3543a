package villagecompute.campus.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.campus.api.types.DispatchSummaryType;
import villagecompute.campus.api.types.JobRunErrorType;
import villagecompute.campus.api.types.JobRunResultType;
import villagecompute.campus.data.models.JobLog;
import villagecompute.campus.data.models.ScheduledJob;
import villagecompute.campus.exceptions.ValidationException;
import villagecompute.campus.jobs.JobClass;
import villagecompute.campus.jobs.JobHandler;
import villagecompute.campus.jobs.JobRunContext;
import villagecompute.campus.observability.LoggingConfig;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every due {@link ScheduledJob} and records the outcome.
 *
 * <p>
 * A dispatch is one pass over the registry, driven either by {@code POST /api/scheduled-jobs/execute} or by the
 * in-process {@code ScheduledJobTrigger}. Jobs run sequentially in id order; a failing job never stops the pass.
 *
 * <p>
 * <b>Run lifecycle (per due job):</b>
 * <ol>
 * <li>Claim: conditional update pushing {@code next_run_at} to {@code now + claim-lease}. Losing the claim reports the
 * job as skipped</li>
 * <li>Insert a {@code RUNNING} {@link JobLog}</li>
 * <li>Resolve the handler from {@code job_class}; unknown names fail the run with {@link IllegalStateException}</li>
 * <li>Execute the handler with a fresh {@link JobRunContext}</li>
 * <li>Success: log {@code SUCCESS}, set {@code last_run_at = now}, store the counters under
 * {@code metadata.last_result}, compute the next run from the completion time</li>
 * <li>Failure (any {@link Throwable}, {@link Error}s included): log {@code FAILED} with
 * {@code "Job failed: <message>"} and the stack trace, compute the next run from the completion time.
 * {@code last_run_at} is left alone</li>
 * </ol>
 * Each bookkeeping step commits in its own transaction, so a crash mid-run leaves a {@code RUNNING} log and a job that
 * becomes due again when the lease expires.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code scheduler.jobs.runs.total} (Counter) - Tagged by {@code job_class} and {@code status}</li>
 * <li>{@code scheduler.jobs.run.duration} (Timer) - Tagged by {@code job_class}</li>
 * </ul>
 *
 * @see JobHandler for handler contract
 * @see ScheduleCalculator for next-run computation
 */
@ApplicationScoped
public class ScheduledJobDispatcher {

    private static final Logger LOG = Logger.getLogger(ScheduledJobDispatcher.class);

    static final String DEFAULT_SUCCESS_MESSAGE = "Job completed successfully";

    /**
     * Registry mapping JobClass to JobHandler, populated at construction via {@link #buildHandlerRegistry}.
     */
    private final Map<JobClass, JobHandler> handlerRegistry;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    ScheduleCalculator scheduleCalculator;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "villagecompute.scheduler.claim-lease",
            defaultValue = "PT15M")
    Duration claimLease;

    @Inject
    public ScheduledJobDispatcher(Instance<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        LOG.infof("Initialized ScheduledJobDispatcher with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Discovers all CDI-managed {@link JobHandler} beans and builds a class to handler map.
     *
     * @throws IllegalStateException
     *             if two handlers claim the same JobClass or a JobClass has no handler
     */
    private static Map<JobClass, JobHandler> buildHandlerRegistry(Instance<JobHandler> handlers) {
        Map<JobClass, JobHandler> registry = new EnumMap<>(JobClass.class);
        for (JobHandler handler : handlers) {
            JobClass jobClass = handler.handlesClass();
            if (registry.containsKey(jobClass)) {
                throw new IllegalStateException("Duplicate handlers registered for JobClass." + jobClass + ": "
                        + registry.get(jobClass).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(jobClass, handler);
            LOG.debugf("Registered handler %s for JobClass.%s (%s)", handler.getClass().getSimpleName(), jobClass,
                    jobClass.getClassName());
        }
        for (JobClass jobClass : JobClass.values()) {
            if (!registry.containsKey(jobClass)) {
                throw new IllegalStateException("No handler registered for JobClass." + jobClass);
            }
        }
        return registry;
    }

    /**
     * Runs all jobs due at the current clock instant.
     */
    public DispatchSummaryType runDueJobs() {
        return runDueJobs(clock.instant());
    }

    /**
     * Runs all jobs due at {@code now}.
     *
     * @param now
     *            dispatch instant, shared by every job of this pass
     * @return executed, failed and skipped jobs; {@code total} counts the successful runs
     */
    public DispatchSummaryType runDueJobs(Instant now) {
        long passStartNanos = System.nanoTime();
        List<ScheduledJob> due = QuarkusTransaction.requiringNew().call(() -> ScheduledJob.findDue(now));
        LOG.infof("Dispatch at %s: %d due job(s)", now, due.size());

        List<JobRunResultType> executed = new ArrayList<>();
        List<JobRunErrorType> errors = new ArrayList<>();
        List<JobRunResultType> skipped = new ArrayList<>();

        for (ScheduledJob job : due) {
            boolean claimed = QuarkusTransaction.requiringNew()
                    .call(() -> ScheduledJob.claim(job.id, now, now.plus(claimLease)));
            if (!claimed) {
                LOG.infof("Job %d (%s) already claimed by another dispatch, skipping", job.id, job.name);
                skipped.add(new JobRunResultType(job.id, job.name, "skipped"));
                continue;
            }

            try {
                runJob(job, now, passStartNanos);
                executed.add(new JobRunResultType(job.id, job.name, "success"));
            } catch (Throwable e) {
                errors.add(new JobRunErrorType(job.id, job.name, describe(e)));
            }
        }

        LOG.infof("Dispatch at %s finished: executed=%d, errors=%d, skipped=%d", now, executed.size(), errors.size(),
                skipped.size());
        return new DispatchSummaryType(executed, errors, skipped, executed.size(), now);
    }

    /**
     * Runs one handler immediately, outside the registry lifecycle. No JobLog is written and the job's schedule is not
     * touched. The metadata of the registered job for that class, if any, still applies.
     *
     * @param jobClass
     *            handler to run
     * @return the finished run context
     * @throws Exception
     *             whatever the handler throws
     */
    public JobRunContext runNow(JobClass jobClass) throws Exception {
        Instant now = clock.instant();
        ScheduledJob job = QuarkusTransaction.requiringNew().call(() -> ScheduledJob.findByJobClass(jobClass))
                .orElse(null);
        JobRunContext context = job == null
                ? new JobRunContext(null, jobClass.getClassName(), now, scheduleCalculator.zone(), Map.of())
                : new JobRunContext(job.id, job.name, now, scheduleCalculator.zone(), job.metadata);

        LOG.infof("Running %s on demand", jobClass.getClassName());
        handlerRegistry.get(jobClass).execute(context);
        return context;
    }

    /**
     * Executes one claimed job and records the outcome. Rethrows the handler failure, {@link Error}s included, after it
     * has been recorded.
     *
     * <p>
     * Run timestamps are {@code now} plus the time elapsed since the pass started, so a job late in a long pass is
     * rescheduled from when it actually finished.
     */
    private void runJob(ScheduledJob job, Instant now, long passStartNanos) throws Exception {
        Span span = tracer.spanBuilder("scheduler.job.execute").setAttribute("job.id", String.valueOf(job.id))
                .setAttribute("job.class", job.jobClass).setAttribute("job.name", job.name).startSpan();
        Timer.Sample timerSample = Timer.start(meterRegistry);
        JobRunContext context = new JobRunContext(job.id, job.name, now, scheduleCalculator.zone(), job.metadata);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(job.id);
            LoggingConfig.setJobClass(job.jobClass);

            Instant startedAt = elapsedSince(now, passStartNanos);
            Long logId = QuarkusTransaction.requiringNew().call(() -> JobLog.start(job, startedAt).id);

            try {
                JobClass jobClass = JobClass.fromClassName(job.jobClass)
                        .orElseThrow(() -> new IllegalStateException("Unknown job class: " + job.jobClass));
                handlerRegistry.get(jobClass).execute(context);
            } catch (Throwable e) {
                span.recordException(e);
                Instant completedAt = elapsedSince(now, passStartNanos);
                QuarkusTransaction.requiringNew().run(() -> finishFailure(job.id, logId, context, e, completedAt));
                countRun(job.jobClass, "failed");
                LOG.errorf(e, "Job %d (%s) failed", job.id, job.name);
                throw e;
            }

            Instant completedAt = elapsedSince(now, passStartNanos);
            QuarkusTransaction.requiringNew().run(() -> finishSuccess(job.id, logId, context, now, completedAt));
            countRun(job.jobClass, "success");
            span.setAttribute("job.status", "success");
            LOG.infof("Job %d (%s) completed: %s", job.id, job.name, context.message());

        } finally {
            timerSample.stop(Timer.builder("scheduler.jobs.run.duration").tag("job_class", job.jobClass)
                    .register(meterRegistry));
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private void finishSuccess(Long jobId, Long logId, JobRunContext context, Instant now, Instant completedAt) {
        Map<String, Object> results = context.results();
        String message = context.message() != null ? context.message() : DEFAULT_SUCCESS_MESSAGE;

        JobLog log = JobLog.findById(logId);
        log.complete(message, context.output(), results, completedAt);

        ScheduledJob job = ScheduledJob.findById(jobId);
        if (job == null) {
            LOG.warnf("Job %d disappeared during its run, nothing to reschedule", jobId);
            return;
        }
        Map<String, Object> metadata = job.metadataCopy();
        metadata.put(ScheduledJob.METADATA_LAST_RESULT, results);
        job.metadata = metadata;
        job.lastRunAt = now;
        job.nextRunAt = nextRunAfter(job, completedAt);
        job.updatedAt = clock.instant();
    }

    private void finishFailure(Long jobId, Long logId, JobRunContext context, Throwable failure, Instant completedAt) {
        JobLog log = JobLog.findById(logId);
        log.fail("Job failed: " + describe(failure), stackTrace(failure), context.output(), context.results(),
                completedAt);

        ScheduledJob job = ScheduledJob.findById(jobId);
        if (job == null) {
            LOG.warnf("Job %d disappeared during its run, nothing to reschedule", jobId);
            return;
        }
        job.nextRunAt = nextRunAfter(job, completedAt);
        job.updatedAt = clock.instant();
    }

    /**
     * Next run from the job's current schedule, counted from the end of the run. A schedule that no longer validates
     * falls back to one day later so the job cannot become due again immediately.
     */
    private Instant nextRunAfter(ScheduledJob job, Instant completedAt) {
        try {
            return scheduleCalculator.nextRun(job.scheduleType, job.scheduleConfig, completedAt);
        } catch (ValidationException e) {
            LOG.warnf("Job %d has an invalid schedule (%s), retrying in one day", job.id, e.getMessage());
            return completedAt.plus(Duration.ofDays(1));
        }
    }

    private void countRun(String jobClass, String status) {
        Counter.builder("scheduler.jobs.runs.total").tag("job_class", jobClass).tag("status", status)
                .register(meterRegistry).increment();
    }

    private static Instant elapsedSince(Instant now, long passStartNanos) {
        return now.plusMillis(Duration.ofNanos(System.nanoTime() - passStartNanos).toMillis());
    }

    private static String describe(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
    }

    private static String stackTrace(Throwable failure) {
        StringWriter writer = new StringWriter();
        failure.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
