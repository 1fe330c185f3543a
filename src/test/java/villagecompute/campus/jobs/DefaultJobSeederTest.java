package villagecompute.campus.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.campus.TestFixtures;
import villagecompute.campus.data.models.ScheduledJob;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultJobSeeder}.
 */
@QuarkusTest
class DefaultJobSeederTest {

    @Inject
    DefaultJobSeeder seeder;

    @BeforeEach
    void setUp() {
        TestFixtures.clearAll();
    }

    @Test
    void testSeedsOneJobPerClass() {
        assertEquals(4, seeder.seed());

        QuarkusTransaction.requiringNew().run(() -> {
            assertEquals(4L, ScheduledJob.count());
            for (JobClass jobClass : JobClass.values()) {
                ScheduledJob job = ScheduledJob.findByJobClass(jobClass).orElseThrow();
                assertTrue(job.enabled);
                assertNotNull(job.nextRunAt, jobClass + " should have a first run");
            }
            ScheduledJob reminder = ScheduledJob.findByJobClass(JobClass.TASK_REMINDER).orElseThrow();
            assertEquals(ScheduleType.HOURLY, reminder.scheduleType);
            assertEquals(24, ((Number) reminder.metadata.get("reminder_hours")).intValue());
        });
    }

    @Test
    void testExistingJobsAreKept() {
        ScheduledJob edited = TestFixtures.createJob("Custom reminder", "TaskReminderJob", ScheduleType.CUSTOM, null,
                null, null, false);

        assertEquals(3, seeder.seed());
        assertEquals(0, seeder.seed());

        ScheduledJob reloaded = TestFixtures.reload(edited.id);
        assertEquals("Custom reminder", reloaded.name);
        assertFalse(reloaded.enabled);
    }
}
