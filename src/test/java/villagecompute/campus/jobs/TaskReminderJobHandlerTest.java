package villagecompute.campus.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.campus.TestFixtures;
import villagecompute.campus.data.models.EmailDeliveryLog;
import villagecompute.campus.data.models.Task;
import villagecompute.campus.data.models.TaskReminderLog;
import villagecompute.campus.data.models.User;
import villagecompute.campus.data.models.UserNotification;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TaskReminderJobHandler}.
 *
 * <p>
 * Runs at 09:10 Karachi time on 2025-01-07, so the 24h window is 2025-01-08 09:00 to 10:00 local.
 */
@QuarkusTest
class TaskReminderJobHandlerTest {

    private static final long BATCH_ID = 7L;
    private static final Instant NOW = TestFixtures.at(2025, 1, 7, 9, 10);

    @Inject
    TaskReminderJobHandler handler;

    private User ayesha;
    private User bilal;
    private User sara;

    @BeforeEach
    void setUp() {
        TestFixtures.clearAll();
        ayesha = TestFixtures.createStudent("Ayesha Khan", "5000.00", 10);
        bilal = TestFixtures.createStudent("Bilal Ahmed", "5000.00", 10);
        sara = TestFixtures.createStudent("Sara Malik", "5000.00", 10);
        TestFixtures.enroll(ayesha.id, BATCH_ID);
        TestFixtures.enroll(bilal.id, BATCH_ID);
        TestFixtures.enroll(sara.id, BATCH_ID);
    }

    private JobRunContext context() {
        return new JobRunContext(1L, "Task Reminder (24h)", NOW, TestFixtures.ZONE, Map.of("reminder_hours", 24));
    }

    @Test
    void testRemindsStudentsWhoHaveNotSubmitted() {
        Task task = TestFixtures.createTask("Essay on Iqbal", BATCH_ID, TestFixtures.at(2025, 1, 8, 9, 30));
        TestFixtures.submit(task.id, sara.id);

        JobRunContext context = context();
        handler.execute(context);

        assertEquals(1, context.count("tasks_processed"));
        assertEquals(2, context.count("notifications_sent"));
        assertEquals(2, context.count("emails_sent"));
        assertEquals(0, context.count("reminders_failed"));
        assertEquals("Task reminders processed: 1 tasks, 2 notifications, 2 emails", context.message());

        QuarkusTransaction.requiringNew().run(() -> {
            List<UserNotification> notifications = UserNotification.findByUserAndType(ayesha.id, "task_reminder");
            assertEquals(1, notifications.size());
            assertEquals("Task Reminder: 24 Hours Remaining", notifications.get(0).title);
            assertEquals("Your task 'Essay on Iqbal' is due in 24 hours (Due: Jan 08, 2025 09:30 AM). "
                    + "Please submit it before the deadline.", notifications.get(0).message);

            List<EmailDeliveryLog> emails = EmailDeliveryLog.findByUserId(bilal.id);
            assertEquals(1, emails.size());
            assertEquals("Task Reminder: 24 Hours Remaining - Essay on Iqbal", emails.get(0).subject);
            assertEquals(EmailDeliveryLog.DeliveryStatus.QUEUED, emails.get(0).status);
            assertNotNull(emails.get(0).textBody, "Plain text template should be rendered");
            assertTrue(emails.get(0).textBody.contains("Essay on Iqbal"));

            assertTrue(UserNotification.findByUserId(sara.id).isEmpty(), "Submitted students are not reminded");
            assertTrue(TaskReminderLog.wasSent(task.id, ayesha.id, "24h"));
            assertFalse(TaskReminderLog.wasSent(task.id, sara.id, "24h"));
        });
    }

    @Test
    void testSecondRunInSameHourSendsNothing() {
        TestFixtures.createTask("Essay on Iqbal", BATCH_ID, TestFixtures.at(2025, 1, 8, 9, 30));

        handler.execute(context());
        JobRunContext second = context();
        handler.execute(second);

        assertEquals(0, second.count("notifications_sent"));
        assertEquals(3, second.count("reminders_skipped"));
        QuarkusTransaction.requiringNew().run(() -> {
            assertEquals(1, UserNotification.findByUserAndType(ayesha.id, "task_reminder").size());
            assertEquals(3L, TaskReminderLog.count());
        });
    }

    @Test
    void testWindowIsHalfOpen() {
        TestFixtures.createTask("Starts window", BATCH_ID, TestFixtures.at(2025, 1, 8, 9, 0));
        TestFixtures.createTask("Next window", BATCH_ID, TestFixtures.at(2025, 1, 8, 10, 0));
        TestFixtures.createTask("Already late", BATCH_ID, TestFixtures.at(2025, 1, 8, 8, 59));

        JobRunContext context = context();
        handler.execute(context);

        assertEquals(1, context.count("tasks_processed"), "Only the task due exactly at the window start qualifies");
        assertEquals(3, context.count("notifications_sent"));
    }

    @Test
    void testNoTasksInWindow() {
        JobRunContext context = context();
        handler.execute(context);

        assertEquals("No tasks found for 24h reminder window", context.message());
        assertEquals(0, context.count("tasks_processed"));
    }

    @Test
    void testReminderHoursFromMetadata() {
        TestFixtures.createTask("Quiz", BATCH_ID, TestFixtures.at(2025, 1, 7, 11, 15));

        JobRunContext context = new JobRunContext(1L, "Task Reminder (2h)", NOW, TestFixtures.ZONE,
                Map.of("reminder_hours", 2));
        handler.execute(context);

        assertEquals(3, context.count("notifications_sent"));
        QuarkusTransaction.requiringNew().run(() -> assertTrue(TaskReminderLog.count("reminderType", "2h") == 3L));
    }
}
