package villagecompute.campus.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.campus.TestFixtures;
import villagecompute.campus.data.models.Task;
import villagecompute.campus.data.models.TaskReminderLog;
import villagecompute.campus.data.models.User;
import villagecompute.campus.data.models.UserNotification;
import villagecompute.campus.services.EmailQueue;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Tests {@link TaskReminderJobHandler} when the email queue rejects messages.
 */
@QuarkusTest
class TaskReminderJobHandlerEmailFailureTest {

    private static final long BATCH_ID = 9L;
    private static final Instant NOW = TestFixtures.at(2025, 1, 7, 9, 10);

    @Inject
    TaskReminderJobHandler handler;

    @InjectMock
    EmailQueue emailQueue;

    @BeforeEach
    void setUp() {
        TestFixtures.clearAll();
    }

    @Test
    void testEmailFailureIsRecordedOnLedger() {
        when(emailQueue.queueEmail(anyLong(), anyString(), anyString(), anyString(), anyString(), anyMap()))
                .thenReturn(false);

        User student = TestFixtures.createStudent("Ayesha Khan", "5000.00", 10);
        TestFixtures.enroll(student.id, BATCH_ID);
        Task task = TestFixtures.createTask("Essay on Iqbal", BATCH_ID, TestFixtures.at(2025, 1, 8, 9, 30));

        JobRunContext context = new JobRunContext(1L, "Task Reminder (24h)", NOW, TestFixtures.ZONE, Map.of());
        handler.execute(context);

        assertEquals(1, context.count("notifications_sent"));
        assertEquals(0, context.count("emails_sent"));

        QuarkusTransaction.requiringNew().run(() -> {
            TaskReminderLog entry = TaskReminderLog.find("taskId = ?1 and studentId = ?2", task.id, student.id)
                    .firstResult();
            assertNotNull(entry, "The reminder is recorded even when the email could not be queued");
            assertTrue(entry.notificationSent);
            assertFalse(entry.emailSent);
        });
    }

    @Test
    void testEmailExceptionKeepsLedgerRowAndIsNotRepeated() {
        when(emailQueue.queueEmail(any(), any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("queue down"));

        User student = TestFixtures.createStudent("Bilal Ahmed", "5000.00", 10);
        TestFixtures.enroll(student.id, BATCH_ID);
        Task task = TestFixtures.createTask("Quiz", BATCH_ID, TestFixtures.at(2025, 1, 8, 9, 45));

        JobRunContext first = new JobRunContext(1L, "Task Reminder (24h)", NOW, TestFixtures.ZONE, Map.of());
        handler.execute(first);

        assertEquals(0, first.count("reminders_failed"));
        assertEquals(1, first.count("notifications_sent"));
        assertEquals(0, first.count("emails_sent"));

        JobRunContext second = new JobRunContext(1L, "Task Reminder (24h)", NOW.plusSeconds(60), TestFixtures.ZONE,
                Map.of());
        handler.execute(second);

        assertEquals(1, second.count("reminders_skipped"));
        assertEquals(0, second.count("notifications_sent"));

        QuarkusTransaction.requiringNew().run(() -> {
            TaskReminderLog entry = TaskReminderLog.find("taskId = ?1 and studentId = ?2", task.id, student.id)
                    .firstResult();
            assertNotNull(entry, "The reminder stays recorded when queueing the email throws");
            assertTrue(entry.notificationSent);
            assertFalse(entry.emailSent);
            assertEquals(1, UserNotification.findByUserAndType(student.id, "task_reminder").size(),
                    "The notification is not sent twice");
        });
    }
}
