package villagecompute.campus.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.campus.TestFixtures;
import villagecompute.campus.data.models.User;
import villagecompute.campus.data.models.UserNotification;
import villagecompute.campus.data.models.Voucher;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link VoucherOverdueNotificationJobHandler}.
 */
@QuarkusTest
class VoucherOverdueNotificationJobHandlerTest {

    @Inject
    VoucherOverdueNotificationJobHandler handler;

    @BeforeEach
    void setUp() {
        TestFixtures.clearAll();
    }

    private JobRunContext contextOn(LocalDate today) {
        return new JobRunContext(3L, "Voucher Overdue Notification",
                TestFixtures.at(today.getYear(), today.getMonthValue(), today.getDayOfMonth(), 9, 0),
                TestFixtures.ZONE, Map.of());
    }

    @Test
    void testNotifiesPendingVoucherPastDueDate() {
        User overdue = TestFixtures.createStudent("Ayesha Khan", "5000.00", 1);
        User dueToday = TestFixtures.createStudent("Bilal Ahmed", "5000.00", 5);
        User submitted = TestFixtures.createStudent("Sara Malik", "5000.00", 1);
        Voucher voucher = TestFixtures.createVoucher(overdue.id, LocalDate.of(2025, 1, 1),
                Voucher.VoucherStatus.PENDING);
        TestFixtures.createVoucher(dueToday.id, LocalDate.of(2025, 1, 5), Voucher.VoucherStatus.PENDING);
        TestFixtures.createVoucher(submitted.id, LocalDate.of(2025, 1, 1), Voucher.VoucherStatus.SUBMITTED);

        JobRunContext context = contextOn(LocalDate.of(2025, 1, 5));
        handler.execute(context);

        assertEquals(1, context.count("vouchers_found"));
        assertEquals(1, context.count("notifications_sent"));
        assertEquals(0, context.count("notifications_failed"));

        QuarkusTransaction.requiringNew().run(() -> {
            List<UserNotification> notifications = UserNotification.findByUserAndType(overdue.id, "voucher_overdue");
            assertEquals(1, notifications.size());
            UserNotification notification = notifications.get(0);
            assertEquals("Voucher Overdue", notification.title);
            assertEquals(4, ((Number) notification.data.get("days_overdue")).intValue());
            assertEquals(voucher.id.longValue(), ((Number) notification.data.get("voucher_id")).longValue());

            assertTrue(UserNotification.findByUserId(dueToday.id).isEmpty(), "Due today is not overdue yet");
            assertTrue(UserNotification.findByUserId(submitted.id).isEmpty(), "Submitted vouchers are not chased");
        });
    }

    @Test
    void testRepeatsDailyAndSkipsBlockedStudents() {
        User active = TestFixtures.createStudent("Ayesha Khan", "5000.00", 1);
        User blocked = TestFixtures.createStudent("Hamza Raza", "5000.00", 1, true);
        TestFixtures.createVoucher(active.id, LocalDate.of(2025, 1, 1), Voucher.VoucherStatus.PENDING);
        TestFixtures.createVoucher(blocked.id, LocalDate.of(2025, 1, 1), Voucher.VoucherStatus.PENDING);

        handler.execute(contextOn(LocalDate.of(2025, 1, 5)));
        JobRunContext nextDay = contextOn(LocalDate.of(2025, 1, 6));
        handler.execute(nextDay);

        assertEquals(1, nextDay.count("skipped_blocked"));
        QuarkusTransaction.requiringNew().run(() -> {
            assertEquals(2, UserNotification.findByUserAndType(active.id, "voucher_overdue").size());
            assertTrue(UserNotification.findByUserId(blocked.id).isEmpty());
        });
    }

    @Test
    void testNothingOverdue() {
        JobRunContext context = contextOn(LocalDate.of(2025, 1, 5));
        handler.execute(context);

        assertEquals(0, context.count("vouchers_found"));
        assertEquals(0, context.count("notifications_sent"));
        assertNotNull(context.message());
    }
}
