package villagecompute.campus.jobs;

import java.util.Arrays;
import java.util.Optional;

/**
 * Enumeration of the recurring job implementations a {@link villagecompute.campus.data.models.ScheduledJob} row can
 * select through its {@code job_class} column.
 *
 * <p>
 * The persisted value is the stable {@link #getClassName() class name} (e.g. {@code TaskReminderJob}), not the enum
 * constant, so rows written by the admin UI keep working when constants are renamed. Each value must be served by
 * exactly one {@link JobHandler}; the dispatcher refuses to start otherwise.
 *
 * @see JobHandler for handler contract
 * @see villagecompute.campus.services.ScheduledJobDispatcher for the registry built from these values
 */
public enum JobClass {

    /**
     * Notifies students whose task deadline falls inside the reminder window and who have not submitted yet.
     * <p>
     * <b>Default cadence:</b> hourly
     * <p>
     * <b>Handler:</b> TaskReminderJobHandler
     */
    TASK_REMINDER("TaskReminderJob", "Task deadline reminders (hourly)"),

    /**
     * Issues one fee voucher per student per month, ahead of the promised payment day.
     * <p>
     * <b>Default cadence:</b> daily
     * <p>
     * <b>Handler:</b> VoucherGenerationJobHandler
     */
    VOUCHER_GENERATION("VoucherGenerationJob", "Fee voucher generation (daily)"),

    /**
     * Re-notifies students about pending vouchers whose due date has passed. Repeats every run until paid or blocked.
     * <p>
     * <b>Default cadence:</b> daily
     * <p>
     * <b>Handler:</b> VoucherOverdueNotificationJobHandler
     */
    VOUCHER_OVERDUE_NOTIFICATION("VoucherOverdueNotificationJob", "Overdue voucher notifications (daily)"),

    /**
     * Blocks students whose pending voucher is overdue beyond the grace period.
     * <p>
     * <b>Default cadence:</b> daily
     * <p>
     * <b>Handler:</b> VoucherAutoBlockJobHandler
     */
    VOUCHER_AUTO_BLOCK("VoucherAutoBlockJob", "Overdue voucher auto-block (daily)");

    private final String className;
    private final String description;

    JobClass(String className, String description) {
        this.className = className;
        this.description = description;
    }

    /**
     * Returns the value stored in {@code scheduled_jobs.job_class}.
     */
    public String getClassName() {
        return className;
    }

    /**
     * Returns a human-readable description including the default cadence.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Resolves a stored {@code job_class} value.
     *
     * @param className
     *            the persisted class name, may be null
     * @return the matching job class, or empty for unknown values
     */
    public static Optional<JobClass> fromClassName(String className) {
        if (className == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(v -> v.className.equals(className)).findFirst();
    }
}
