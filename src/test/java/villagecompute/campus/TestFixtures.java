package villagecompute.campus;

import io.quarkus.narayana.jta.QuarkusTransaction;
import villagecompute.campus.data.models.EmailDeliveryLog;
import villagecompute.campus.data.models.JobLog;
import villagecompute.campus.data.models.ScheduledJob;
import villagecompute.campus.data.models.SubmittedTask;
import villagecompute.campus.data.models.Task;
import villagecompute.campus.data.models.TaskReminderLog;
import villagecompute.campus.data.models.User;
import villagecompute.campus.data.models.UserBatch;
import villagecompute.campus.data.models.UserNotification;
import villagecompute.campus.data.models.Voucher;
import villagecompute.campus.jobs.ScheduleType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;

/**
 * Test fixture factory methods for creating committed test entities.
 *
 * <p>
 * Every factory commits in its own transaction so the code under test, which opens its own transactions, sees the
 * rows. Call {@link #clearAll()} from {@code @BeforeEach}; all test classes share one in-memory database.
 */
public final class TestFixtures {

    /** Scheduler zone configured for tests. */
    public static final ZoneId ZONE = ZoneId.of("Asia/Karachi");

    private TestFixtures() {
    }

    /**
     * Deletes every row written by the scheduler, the handlers and the fixtures.
     */
    public static void clearAll() {
        QuarkusTransaction.requiringNew().run(() -> {
            JobLog.deleteAll();
            ScheduledJob.deleteAll();
            TaskReminderLog.deleteAll();
            SubmittedTask.deleteAll();
            UserBatch.deleteAll();
            Task.deleteAll();
            Voucher.deleteAll();
            UserNotification.deleteAll();
            EmailDeliveryLog.deleteAll();
            User.deleteAll();
        });
    }

    /**
     * Returns the instant of a local date and time in the scheduler zone.
     */
    public static Instant at(int year, int month, int day, int hour, int minute) {
        return LocalDate.of(year, month, day).atTime(hour, minute).atZone(ZONE).toInstant();
    }

    // ========== STUDENT FIXTURES ==========

    public static User createStudent(String name, String fees, Integer promiseDay) {
        return createStudent(name, fees, promiseDay, false);
    }

    public static User createStudent(String name, String fees, Integer promiseDay, boolean blocked) {
        return QuarkusTransaction.requiringNew().call(() -> {
            User user = new User();
            user.name = name;
            user.email = name.toLowerCase().replace(' ', '.') + "@campus.test";
            user.fees = new BigDecimal(fees);
            user.expectedFeePromiseDate = promiseDay;
            user.blocked = blocked;
            if (blocked) {
                user.blockReason = "Blocked by admin";
                user.blockedAt = Instant.parse("2024-12-01T00:00:00Z");
            }
            user.persist();
            return user;
        });
    }

    public static void enroll(Long userId, Long batchId) {
        QuarkusTransaction.requiringNew().run(() -> {
            UserBatch membership = new UserBatch();
            membership.userId = userId;
            membership.batchId = batchId;
            membership.persist();
        });
    }

    // ========== TASK FIXTURES ==========

    public static Task createTask(String title, Long batchId, Instant expiryDate) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Task task = new Task();
            task.title = title;
            task.batchId = batchId;
            task.expiryDate = expiryDate;
            task.persist();
            return task;
        });
    }

    public static void submit(Long taskId, Long studentId) {
        QuarkusTransaction.requiringNew().run(() -> {
            SubmittedTask submission = new SubmittedTask();
            submission.taskId = taskId;
            submission.studentId = studentId;
            submission.submittedAt = Instant.parse("2025-01-06T10:00:00Z");
            submission.persist();
        });
    }

    // ========== VOUCHER FIXTURES ==========

    public static Voucher createVoucher(Long studentId, LocalDate dueDate, Voucher.VoucherStatus status) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Voucher voucher = Voucher.issue(studentId, new BigDecimal("5000.00"), "Fee Voucher", dueDate,
                    dueDate.getDayOfMonth(), Instant.parse("2024-12-20T00:00:00Z"));
            voucher.status = status;
            return voucher;
        });
    }

    // ========== SCHEDULED JOB FIXTURES ==========

    public static ScheduledJob createJob(String name, String jobClass, ScheduleType scheduleType,
            Map<String, Object> scheduleConfig, Map<String, Object> metadata, Instant nextRunAt, boolean enabled) {
        return QuarkusTransaction.requiringNew().call(() -> {
            ScheduledJob job = new ScheduledJob();
            job.name = name;
            job.jobClass = jobClass;
            job.scheduleType = scheduleType;
            job.scheduleConfig = scheduleConfig;
            job.metadata = metadata;
            job.nextRunAt = nextRunAt;
            job.enabled = enabled;
            job.createdAt = Instant.parse("2025-01-01T00:00:00Z");
            job.updatedAt = job.createdAt;
            job.persist();
            return job;
        });
    }

    public static JobLog createLog(ScheduledJob job, Instant startedAt, JobLog.LogStatus status) {
        return QuarkusTransaction.requiringNew().call(() -> {
            JobLog log = JobLog.start(job, startedAt);
            if (status == JobLog.LogStatus.SUCCESS) {
                log.complete("ok", null, Map.of(), startedAt.plusSeconds(1));
            } else if (status == JobLog.LogStatus.FAILED) {
                log.fail("Job failed: boom", "java.lang.RuntimeException: boom", null, Map.of(),
                        startedAt.plusSeconds(1));
            }
            return log;
        });
    }

    public static ScheduledJob reload(Long jobId) {
        return QuarkusTransaction.requiringNew().call(() -> {
            ScheduledJob job = ScheduledJob.findById(jobId);
            return job;
        });
    }
}
