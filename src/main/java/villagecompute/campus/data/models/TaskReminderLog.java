package villagecompute.campus.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * Idempotency ledger for task deadline reminders.
 *
 * <p>
 * At most one row exists per {@code (task_id, student_id, reminder_type)}; its presence means the reminder must not be
 * sent again. The unique constraint makes the insert itself the claim: a concurrent run that loses the race fails on
 * flush, before it sends anything. Delivery failures are stored in the flags and never remove the row.
 *
 * <h3>Schema Mapping:</h3>
 * <ul>
 * <li>id (BIGSERIAL, PK)</li>
 * <li>task_id, student_id (BIGINT)</li>
 * <li>reminder_type (TEXT) - Lead time label, e.g. {@code 24h}</li>
 * <li>reminder_sent_at (TIMESTAMPTZ)</li>
 * <li>notification_sent, email_sent (BOOLEAN) - Outcome of each channel</li>
 * </ul>
 */
@Entity
@Table(
        name = "task_reminder_logs",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_task_reminder_logs_key",
                columnNames = {"task_id", "student_id", "reminder_type"}))
@NamedQuery(
        name = TaskReminderLog.QUERY_FIND_BY_KEY,
        query = "FROM TaskReminderLog WHERE taskId = :taskId AND studentId = :studentId AND reminderType = :reminderType")
public class TaskReminderLog extends PanacheEntityBase {

    public static final String QUERY_FIND_BY_KEY = "TaskReminderLog.findByKey";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "task_id",
            nullable = false)
    public Long taskId;

    @Column(
            name = "student_id",
            nullable = false)
    public Long studentId;

    @Column(
            name = "reminder_type",
            nullable = false,
            length = 20)
    public String reminderType;

    @Column(
            name = "reminder_sent_at",
            nullable = false)
    public Instant reminderSentAt;

    @Column(
            name = "notification_sent",
            nullable = false)
    public boolean notificationSent;

    @Column(
            name = "email_sent",
            nullable = false)
    public boolean emailSent;

    /**
     * Returns true if a reminder of this type was already recorded for the task and student.
     */
    public static boolean wasSent(Long taskId, Long studentId, String reminderType) {
        return find("#" + QUERY_FIND_BY_KEY,
                Parameters.with("taskId", taskId).and("studentId", studentId).and("reminderType", reminderType))
                .firstResultOptional().isPresent();
    }

    /**
     * Persists and flushes a ledger row so a duplicate key fails immediately. Must run inside a transaction.
     */
    public static TaskReminderLog record(Long taskId, Long studentId, String reminderType, Instant sentAt) {
        TaskReminderLog log = new TaskReminderLog();
        log.taskId = taskId;
        log.studentId = studentId;
        log.reminderType = reminderType;
        log.reminderSentAt = sentAt;
        log.persistAndFlush();
        return log;
    }
}
