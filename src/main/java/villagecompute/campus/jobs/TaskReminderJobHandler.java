package villagecompute.campus.jobs;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.campus.data.models.Task;
import villagecompute.campus.data.models.TaskReminderLog;
import villagecompute.campus.data.models.User;
import villagecompute.campus.observability.LoggingConfig;
import villagecompute.campus.services.EmailQueue;
import villagecompute.campus.services.NotificationSink;
import villagecompute.campus.services.StudentStore;
import villagecompute.campus.services.TaskStore;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Job handler for task deadline reminders.
 *
 * <p>
 * Runs hourly. Each run looks one lead period ahead (default 24 hours) and reminds every enrolled student who has not
 * submitted a task whose deadline falls in that hour.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Read {@code reminder_hours} from the job metadata (default {@code villagecompute.jobs.task-reminder.lead-hours})</li>
 * <li>Compute the window {@code [startOfHour(now + h), +1h)} in the scheduler zone</li>
 * <li>For each task expiring in the window, resolve the students of its batch and drop those who already
 * submitted</li>
 * <li>For each remaining student, skip if a {@link TaskReminderLog} exists for {@code (task, student, "<h>h")}</li>
 * <li>Otherwise insert the ledger row, create the {@code task_reminder} notification and queue the email, all within
 * one per-student transaction</li>
 * </ol>
 *
 * <p>
 * <b>Idempotency:</b> the ledger row is flushed before anything is sent. Its unique key turns a concurrent duplicate
 * into a constraint violation that rolls back that student's attempt before any side effect happens. Once the row is
 * flushed it always commits, whatever the channels do.
 *
 * <p>
 * <b>Error Handling:</b> a notification or email that fails or throws is logged and recorded as a {@code false} flag on
 * the ledger row; the reminder counts as sent and is not retried. Other failures for one student are logged, counted
 * under {@code reminders_failed} and do not stop the run.
 *
 * <p>
 * <b>Result metadata:</b> {@code tasks_processed}, {@code notifications_sent}, {@code emails_sent},
 * {@code reminders_skipped}, {@code reminders_failed}, {@code reminder_hours}, {@code window_start},
 * {@code window_end}.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code campus.task_reminders.sent.total} (Counter) - Reminders recorded in the ledger</li>
 * <li>{@code campus.task_reminders.errors.total} (Counter) - Per-student failures</li>
 * <li>{@code campus.task_reminders.duration} (Timer) - Run duration</li>
 * </ul>
 */
@ApplicationScoped
public class TaskReminderJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(TaskReminderJobHandler.class);

    static final String NOTIFICATION_TYPE = "task_reminder";
    static final String EMAIL_TEMPLATE = "task_reminder";
    static final DateTimeFormatter DUE_FORMAT = DateTimeFormatter.ofPattern("MMM dd, yyyy hh:mm a", Locale.ENGLISH);

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    TaskStore taskStore;

    @Inject
    StudentStore studentStore;

    @Inject
    NotificationSink notificationSink;

    @Inject
    EmailQueue emailQueue;

    @ConfigProperty(
            name = "villagecompute.jobs.task-reminder.lead-hours",
            defaultValue = "24")
    int defaultLeadHours;

    @Override
    public JobClass handlesClass() {
        return JobClass.TASK_REMINDER;
    }

    @Override
    public void execute(JobRunContext context) {
        int leadHours = context.intMetadata("reminder_hours", defaultLeadHours);
        String reminderType = leadHours + "h";
        ZonedDateTime windowStart = context.zonedNow().plusHours(leadHours).truncatedTo(ChronoUnit.HOURS);
        ZonedDateTime windowEnd = windowStart.plusHours(1);

        Span span = tracer.spanBuilder("job.task_reminder").setAttribute("job.id", String.valueOf(context.jobId()))
                .setAttribute("reminder_hours", leadHours).startSpan();
        Timer.Sample timerSample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("TaskReminderJobHandler");

            context.initCounters("tasks_processed", "notifications_sent", "emails_sent", "reminders_skipped",
                    "reminders_failed");
            context.put("reminder_hours", leadHours);
            context.put("window_start", windowStart.toOffsetDateTime().toString());
            context.put("window_end", windowEnd.toOffsetDateTime().toString());

            List<Task> tasks = taskStore.findExpiringBetween(windowStart.toInstant(), windowEnd.toInstant());
            if (tasks.isEmpty()) {
                LOG.infof("No tasks due between %s and %s", windowStart, windowEnd);
                span.addEvent("task_reminder.no_tasks");
                context.setMessage("No tasks found for " + reminderType + " reminder window");
                return;
            }

            LOG.infof("Found %d tasks due between %s and %s", tasks.size(), windowStart, windowEnd);
            span.setAttribute("tasks_found", tasks.size());

            for (Task task : tasks) {
                context.increment("tasks_processed");
                remindTask(context, task, leadHours, reminderType, span);
            }

            span.addEvent("task_reminder.completed",
                    Attributes.of(AttributeKey.longKey("notifications_sent"),
                            (long) context.count("notifications_sent"), AttributeKey.longKey("reminders_failed"),
                            (long) context.count("reminders_failed")));

            context.setMessage(String.format("Task reminders processed: %d tasks, %d notifications, %d emails",
                    context.count("tasks_processed"), context.count("notifications_sent"),
                    context.count("emails_sent")));
            LOG.infof("Task reminder job completed: tasks_processed=%d, notifications_sent=%d, emails_sent=%d, "
                    + "skipped=%d, failed=%d", context.count("tasks_processed"), context.count("notifications_sent"),
                    context.count("emails_sent"), context.count("reminders_skipped"),
                    context.count("reminders_failed"));

        } finally {
            timerSample.stop(Timer.builder("campus.task_reminders.duration").register(meterRegistry));
            span.end();
        }
    }

    private void remindTask(JobRunContext context, Task task, int leadHours, String reminderType, Span span) {
        if (task.batchId == null) {
            LOG.warnf("Task %d has no batch, skipping reminders", task.id);
            return;
        }

        Set<Long> submitted = taskStore.findSubmitterIds(task.id);
        List<Long> studentIds = studentStore.findStudentIdsInBatch(task.batchId);

        for (Long studentId : studentIds) {
            if (submitted.contains(studentId)) {
                continue;
            }
            try {
                remindStudent(context, task, studentId, leadHours, reminderType);
            } catch (Exception e) {
                context.increment("reminders_failed");
                span.recordException(e);
                Counter.builder("campus.task_reminders.errors.total").register(meterRegistry).increment();
                LOG.errorf(e, "Failed to send reminder for task %d to student %d", task.id, studentId);
            }
        }
    }

    private void remindStudent(JobRunContext context, Task task, Long studentId, int leadHours,
            String reminderType) {
        boolean alreadySent = QuarkusTransaction.requiringNew()
                .call(() -> TaskReminderLog.wasSent(task.id, studentId, reminderType));
        if (alreadySent) {
            context.increment("reminders_skipped");
            return;
        }

        Optional<User> student = studentStore.findById(studentId);
        if (student.isEmpty()) {
            LOG.warnf("Student %d of batch %d not found, skipping reminder for task %d", studentId, task.batchId,
                    task.id);
            context.increment("reminders_skipped");
            return;
        }

        String taskTitle = task.title == null ? "Task" : task.title;
        String formattedDue = DUE_FORMAT.format(task.expiryDate.atZone(context.zone()));

        TaskReminderLog entry = QuarkusTransaction.requiringNew().call(() -> {
            TaskReminderLog log = TaskReminderLog.record(task.id, studentId, reminderType, context.now());
            log.notificationSent = safely("notification", task, studentId,
                    () -> notifyStudent(task, studentId, taskTitle, leadHours, formattedDue));
            log.emailSent = safely("email", task, studentId,
                    () -> emailStudent(student.get(), task, taskTitle, leadHours, formattedDue));
            return log;
        });

        if (entry.notificationSent) {
            context.increment("notifications_sent");
        }
        if (entry.emailSent) {
            context.increment("emails_sent");
        }
        Counter.builder("campus.task_reminders.sent.total").register(meterRegistry).increment();
        LOG.debugf("Reminder %s for task %d sent to student %d (notification=%s, email=%s)", reminderType, task.id,
                studentId, entry.notificationSent, entry.emailSent);
    }

    /**
     * Runs one delivery channel. A channel that throws counts as not sent, so the ledger row still commits and the
     * reminder is never repeated.
     */
    private boolean safely(String channel, Task task, Long studentId, BooleanSupplier delivery) {
        try {
            return delivery.getAsBoolean();
        } catch (Exception e) {
            LOG.errorf(e, "Reminder %s for task %d could not be delivered to student %d", channel, task.id, studentId);
            return false;
        }
    }

    private boolean notifyStudent(Task task, Long studentId, String taskTitle, int leadHours, String formattedDue) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task_id", task.id);
        data.put("reminder_hours", leadHours);
        data.put("expiry_date", task.expiryDate.toString());

        return notificationSink.createNotification(studentId, NOTIFICATION_TYPE,
                "Task Reminder: " + leadHours + " Hours Remaining",
                String.format("Your task '%s' is due in %d hours (Due: %s). Please submit it before the deadline.",
                        taskTitle, leadHours, formattedDue),
                data);
    }

    private boolean emailStudent(User student, Task task, String taskTitle, int leadHours, String formattedDue) {
        String recipientName = student.name == null || student.name.isBlank() ? student.email : student.name;

        Map<String, Object> templateData = new LinkedHashMap<>();
        templateData.put("taskId", task.id);
        templateData.put("taskTitle", taskTitle);
        templateData.put("hours", leadHours);
        templateData.put("dueDate", formattedDue);

        return emailQueue.queueEmail(student.id, student.email, recipientName, EMAIL_TEMPLATE,
                "Task Reminder: " + leadHours + " Hours Remaining - " + taskTitle, templateData);
    }
}
