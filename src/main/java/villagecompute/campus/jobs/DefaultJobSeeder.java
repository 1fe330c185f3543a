package villagecompute.campus.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.campus.data.models.ScheduledJob;
import villagecompute.campus.services.ScheduleCalculator;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Creates the default scheduled jobs at startup.
 *
 * <p>
 * One row per {@link JobClass}, keyed by {@code job_class}: an existing row (possibly edited by an admin) is left
 * untouched. Disabled with {@code villagecompute.scheduler.seed-defaults=false}.
 *
 * <table>
 * <tr>
 * <th>job_class</th>
 * <th>schedule</th>
 * <th>metadata</th>
 * </tr>
 * <tr>
 * <td>TaskReminderJob</td>
 * <td>hourly</td>
 * <td>{@code reminder_hours=24}</td>
 * </tr>
 * <tr>
 * <td>VoucherGenerationJob</td>
 * <td>daily</td>
 * <td>none</td>
 * </tr>
 * <tr>
 * <td>VoucherOverdueNotificationJob</td>
 * <td>daily</td>
 * <td>none</td>
 * </tr>
 * <tr>
 * <td>VoucherAutoBlockJob</td>
 * <td>daily</td>
 * <td>none</td>
 * </tr>
 * </table>
 */
@ApplicationScoped
@Startup
public class DefaultJobSeeder {

    private static final Logger LOG = Logger.getLogger(DefaultJobSeeder.class);

    @Inject
    ScheduleCalculator scheduleCalculator;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "villagecompute.scheduler.seed-defaults",
            defaultValue = "true")
    boolean seedDefaults;

    @PostConstruct
    void onStartup() {
        if (!seedDefaults) {
            LOG.debug("Default job seeding disabled");
            return;
        }
        int created = seed();
        LOG.infof("Default job seeding finished: %d job(s) created", created);
    }

    /**
     * Inserts every missing default job.
     *
     * @return number of jobs created
     */
    public int seed() {
        return QuarkusTransaction.requiringNew().call(() -> {
            int created = 0;
            created += seedJob(JobClass.TASK_REMINDER, "Task Reminder (24h)", ScheduleType.HOURLY,
                    Map.of("reminder_hours", 24));
            created += seedJob(JobClass.VOUCHER_GENERATION, "Voucher Generation", ScheduleType.DAILY, null);
            created += seedJob(JobClass.VOUCHER_OVERDUE_NOTIFICATION, "Voucher Overdue Notification",
                    ScheduleType.DAILY, null);
            created += seedJob(JobClass.VOUCHER_AUTO_BLOCK, "Voucher Auto-Block", ScheduleType.DAILY, null);
            return created;
        });
    }

    private int seedJob(JobClass jobClass, String name, ScheduleType scheduleType, Map<String, Object> metadata) {
        if (ScheduledJob.findByJobClass(jobClass).isPresent()) {
            return 0;
        }
        Instant now = clock.instant();
        ScheduledJob job = new ScheduledJob();
        job.name = name;
        job.description = jobClass.getDescription();
        job.jobClass = jobClass.getClassName();
        job.scheduleType = scheduleType;
        job.enabled = true;
        job.metadata = metadata;
        job.nextRunAt = scheduleCalculator.nextRun(scheduleType, null, now);
        job.createdAt = now;
        job.updatedAt = now;
        job.persist();
        LOG.infof("Seeded scheduled job %s (%s), next run at %s", name, jobClass.getClassName(), job.nextRunAt);
        return 1;
    }
}
