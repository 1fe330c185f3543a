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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link VoucherGenerationJobHandler}.
 */
@QuarkusTest
class VoucherGenerationJobHandlerTest {

    @Inject
    VoucherGenerationJobHandler handler;

    @BeforeEach
    void setUp() {
        TestFixtures.clearAll();
    }

    private JobRunContext contextAt(int year, int month, int day) {
        return new JobRunContext(1L, "Voucher Generation", TestFixtures.at(year, month, day, 9, 0), TestFixtures.ZONE,
                Map.of());
    }

    @Test
    void testGeneratesVoucherTenDaysBeforePromiseDay() {
        User due = TestFixtures.createStudent("Ayesha Khan", "5000.00", 17);
        User otherDay = TestFixtures.createStudent("Bilal Ahmed", "5000.00", 18);
        User blocked = TestFixtures.createStudent("Sara Malik", "5000.00", 17, true);
        User noFees = TestFixtures.createStudent("Usman Ali", "0.00", 17);

        JobRunContext context = contextAt(2025, 1, 7);
        handler.execute(context);

        assertEquals(1, context.count("vouchers_generated"));
        assertEquals(0, context.count("vouchers_skipped"));
        assertEquals(17, context.results().get("target_promise_day"));
        assertEquals("2025-01-17", context.results().get("target_date"));
        assertEquals("Generated 1 voucher(s), skipped 0 existing voucher(s)", context.message());

        QuarkusTransaction.requiringNew().run(() -> {
            List<Voucher> vouchers = Voucher.listAll();
            assertEquals(1, vouchers.size(), "Only the unblocked student with fees and promise day 17 is billed");
            Voucher voucher = vouchers.get(0);
            assertEquals(due.id, voucher.studentId);
            assertEquals(LocalDate.of(2025, 1, 17), voucher.dueDate);
            assertEquals(0, new BigDecimal("5000.00").compareTo(voucher.feeAmount));
            assertEquals(Voucher.VoucherStatus.PENDING, voucher.status);
            assertEquals("Fee Voucher", voucher.description);

            List<UserNotification> notifications = UserNotification.findByUserAndType(due.id, "voucher_generated");
            assertEquals(1, notifications.size());
            assertEquals("New Voucher Generated", notifications.get(0).title);
            assertTrue(notifications.get(0).message.contains("PKR 5,000.00"), notifications.get(0).message);
            assertTrue(notifications.get(0).message.contains("Jan 17, 2025"), notifications.get(0).message);

            assertTrue(UserNotification.findByUserId(otherDay.id).isEmpty());
            assertTrue(UserNotification.findByUserId(blocked.id).isEmpty());
            assertTrue(UserNotification.findByUserId(noFees.id).isEmpty());
        });
    }

    @Test
    void testSecondRunSkipsExistingVoucher() {
        User student = TestFixtures.createStudent("Ayesha Khan", "5000.00", 17);

        handler.execute(contextAt(2025, 1, 7));
        JobRunContext second = contextAt(2025, 1, 7);
        handler.execute(second);

        assertEquals(0, second.count("vouchers_generated"));
        assertEquals(1, second.count("vouchers_skipped"));
        QuarkusTransaction.requiringNew().run(() -> {
            assertEquals(1L, Voucher.count("studentId", student.id), "At most one voucher per student and month");
            assertEquals(1, UserNotification.findByUserAndType(student.id, "voucher_generated").size());
        });
    }

    @Test
    void testMonthEndIncludesMissingPromiseDays() {
        User day31 = TestFixtures.createStudent("Hamza Raza", "3500.00", 31);
        User day30 = TestFixtures.createStudent("Zainab Noor", "3500.00", 30);

        // 2025-04-20 + 10 days = 2025-04-30, the last day of April
        JobRunContext context = contextAt(2025, 4, 20);
        handler.execute(context);

        assertEquals(2, context.count("vouchers_generated"));
        QuarkusTransaction.requiringNew().run(() -> {
            Voucher voucher31 = Voucher.find("studentId", day31.id).firstResult();
            assertNotNull(voucher31, "Promise day 31 must still be billed in April");
            assertEquals(LocalDate.of(2025, 4, 30), voucher31.dueDate);
            assertEquals(31, voucher31.promiseDate);

            Voucher voucher30 = Voucher.find("studentId", day30.id).firstResult();
            assertEquals(LocalDate.of(2025, 4, 30), voucher30.dueDate);
        });
    }

    @Test
    void testLeadDaysOverride() {
        TestFixtures.createStudent("Ayesha Khan", "5000.00", 12);

        JobRunContext context = new JobRunContext(1L, "Voucher Generation", TestFixtures.at(2025, 1, 7, 9, 0),
                TestFixtures.ZONE, Map.of("lead_days", 5));
        handler.execute(context);

        assertEquals("2025-01-12", context.results().get("target_date"));
        assertEquals(1, context.count("vouchers_generated"));
    }

    @Test
    void testPromiseDays() {
        assertEquals(Set.of(17), VoucherGenerationJobHandler.promiseDaysFor(LocalDate.of(2025, 1, 17)));
        assertEquals(Set.of(28, 29, 30, 31), VoucherGenerationJobHandler.promiseDaysFor(LocalDate.of(2025, 2, 28)));
        assertEquals(Set.of(31), VoucherGenerationJobHandler.promiseDaysFor(LocalDate.of(2025, 1, 31)));
        assertEquals(LocalDate.of(2025, 2, 28),
                VoucherGenerationJobHandler.dueDateFor(LocalDate.of(2025, 2, 28), 30));
    }
}
