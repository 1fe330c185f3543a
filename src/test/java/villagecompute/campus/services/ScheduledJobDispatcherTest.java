package villagecompute.campus.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.campus.TestFixtures;
import villagecompute.campus.api.types.DispatchSummaryType;
import villagecompute.campus.data.models.JobLog;
import villagecompute.campus.data.models.ScheduledJob;
import villagecompute.campus.jobs.JobClass;
import villagecompute.campus.jobs.JobRunContext;
import villagecompute.campus.jobs.ScheduleType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ScheduledJobDispatcher}.
 */
@QuarkusTest
class ScheduledJobDispatcherTest {

    private static final Instant NOW = TestFixtures.at(2025, 1, 7, 9, 10);

    @Inject
    ScheduledJobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        TestFixtures.clearAll();
    }

    private static List<JobLog> logsOf(Long jobId) {
        return QuarkusTransaction.requiringNew().call(() -> {
            List<JobLog> logs = JobLog.findForJob(jobId, null, null, null).list();
            return logs;
        });
    }

    @Test
    void testSuccessfulRunIsLoggedAndRescheduled() {
        ScheduledJob job = TestFixtures.createJob("Task Reminder (24h)", "TaskReminderJob", ScheduleType.HOURLY, null,
                Map.of("reminder_hours", 24), null, true);

        DispatchSummaryType summary = dispatcher.runDueJobs(NOW);

        assertEquals(1, summary.total());
        assertEquals(1, summary.executed().size());
        assertEquals("success", summary.executed().get(0).status());
        assertTrue(summary.errors().isEmpty());
        assertEquals(NOW, summary.timestamp());

        List<JobLog> logs = logsOf(job.id);
        assertEquals(1, logs.size());
        JobLog log = logs.get(0);
        assertEquals(JobLog.LogStatus.SUCCESS, log.status);
        assertEquals("No tasks found for 24h reminder window", log.message, "Handler message is kept");
        assertFalse(log.startedAt.isBefore(NOW));
        assertNotNull(log.completedAt);
        assertNotNull(log.executionTimeMs);

        ScheduledJob reloaded = TestFixtures.reload(job.id);
        assertEquals(NOW, reloaded.lastRunAt);
        assertEquals(log.completedAt.plus(Duration.ofHours(1)), reloaded.nextRunAt, "Next run counts from completion");
        assertTrue(reloaded.metadata.get(ScheduledJob.METADATA_LAST_RESULT) instanceof Map,
                "Counters are stored under last_result");
        assertEquals(24, ((Number) reloaded.metadata.get("reminder_hours")).intValue(),
                "Existing metadata survives the run");
    }

    @Test
    void testUnknownJobClassFailsOnlyItsOwnRun() {
        ScheduledJob legacy = TestFixtures.createJob("Legacy", "LegacyJob", ScheduleType.DAILY, null, null,
                NOW.minusSeconds(60), true);
        ScheduledJob healthy = TestFixtures.createJob("Overdue", "VoucherOverdueNotificationJob", ScheduleType.DAILY,
                null, null, NOW.minusSeconds(60), true);

        DispatchSummaryType summary = dispatcher.runDueJobs(NOW);

        assertEquals(1, summary.total());
        assertEquals(healthy.id, summary.executed().get(0).id());
        assertEquals(1, summary.errors().size());
        assertEquals(legacy.id, summary.errors().get(0).id());
        assertEquals("Unknown job class: LegacyJob", summary.errors().get(0).error());

        JobLog failed = logsOf(legacy.id).get(0);
        assertEquals(JobLog.LogStatus.FAILED, failed.status);
        assertEquals("Job failed: Unknown job class: LegacyJob", failed.message);
        assertTrue(failed.error.contains("IllegalStateException"), "Stack trace is stored");

        ScheduledJob reloaded = TestFixtures.reload(legacy.id);
        assertNull(reloaded.lastRunAt, "Failed runs do not set last_run_at");
        assertEquals(failed.completedAt.plus(Duration.ofDays(1)), reloaded.nextRunAt, "Failed jobs still move forward");
    }

    @Test
    void testHandlerFailureIsRecorded() {
        ScheduledJob job = TestFixtures.createJob("Broken reminder", "TaskReminderJob", ScheduleType.HOURLY, null,
                Map.of("reminder_hours", "abc"), null, true);

        DispatchSummaryType summary = dispatcher.runDueJobs(NOW);

        assertEquals(0, summary.total());
        assertEquals(1, summary.errors().size());
        JobLog log = logsOf(job.id).get(0);
        assertEquals(JobLog.LogStatus.FAILED, log.status);
        assertTrue(log.message.startsWith("Job failed: "), log.message);
        assertTrue(TestFixtures.reload(job.id).nextRunAt.isAfter(NOW));
    }

    @Test
    void testDisabledAndFutureJobsAreNotRun() {
        ScheduledJob disabled = TestFixtures.createJob("Disabled", "VoucherAutoBlockJob", ScheduleType.DAILY, null,
                null, null, false);
        ScheduledJob future = TestFixtures.createJob("Future", "VoucherAutoBlockJob", ScheduleType.DAILY, null, null,
                NOW.plusSeconds(60), true);

        DispatchSummaryType summary = dispatcher.runDueJobs(NOW);

        assertEquals(0, summary.total());
        assertTrue(summary.errors().isEmpty());
        assertTrue(logsOf(disabled.id).isEmpty());
        assertTrue(logsOf(future.id).isEmpty());
        assertEquals(NOW.plusSeconds(60), TestFixtures.reload(future.id).nextRunAt);
    }

    @Test
    void testJobRunsOncePerDueInstant() {
        ScheduledJob job = TestFixtures.createJob("Auto-block", "VoucherAutoBlockJob", ScheduleType.DAILY, null, null,
                NOW, true);

        dispatcher.runDueJobs(NOW);
        DispatchSummaryType second = dispatcher.runDueJobs(NOW);

        assertEquals(0, second.total(), "The rescheduled job is no longer due");
        assertEquals(1, logsOf(job.id).size());
    }

    @Test
    void testClaimIsExclusive() {
        ScheduledJob job = TestFixtures.createJob("Auto-block", "VoucherAutoBlockJob", ScheduleType.DAILY, null, null,
                null, true);
        Instant lease = NOW.plus(Duration.ofMinutes(15));

        assertTrue(QuarkusTransaction.requiringNew().call(() -> ScheduledJob.claim(job.id, NOW, lease)));
        assertFalse(QuarkusTransaction.requiringNew().call(() -> ScheduledJob.claim(job.id, NOW, lease)),
                "A claimed job is not due for a concurrent dispatcher");
        assertEquals(lease, TestFixtures.reload(job.id).nextRunAt);
    }

    @Test
    void testInvalidScheduleFallsBackToOneDay() {
        ScheduledJob job = TestFixtures.createJob("Bad schedule", "VoucherAutoBlockJob", ScheduleType.DAILY,
                Map.of("time", "25:99"), null, null, true);

        DispatchSummaryType summary = dispatcher.runDueJobs(NOW);

        assertEquals(1, summary.total());
        JobLog log = logsOf(job.id).get(0);
        assertEquals(log.completedAt.plus(Duration.ofDays(1)), TestFixtures.reload(job.id).nextRunAt);
    }

    @Test
    void testRunNowLeavesScheduleAlone() throws Exception {
        ScheduledJob job = TestFixtures.createJob("Voucher Generation", "VoucherGenerationJob", ScheduleType.DAILY,
                null, Map.of("lead_days", 10), NOW.plusSeconds(3600), true);

        JobRunContext context = dispatcher.runNow(JobClass.VOUCHER_GENERATION);

        assertNotNull(context.message());
        assertEquals(0, context.count("vouchers_generated"));
        assertTrue(logsOf(job.id).isEmpty(), "On-demand runs are not logged");
        assertEquals(NOW.plusSeconds(3600), TestFixtures.reload(job.id).nextRunAt);
    }
}
