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
import villagecompute.campus.exceptions.ValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link VoucherAutoBlockJobHandler}.
 */
@QuarkusTest
class VoucherAutoBlockJobHandlerTest {

    @Inject
    VoucherAutoBlockJobHandler handler;

    private static final Instant NOW = TestFixtures.at(2025, 1, 5, 9, 0);

    @BeforeEach
    void setUp() {
        TestFixtures.clearAll();
    }

    private JobRunContext context(Map<String, Object> metadata) {
        return new JobRunContext(4L, "Voucher Auto-Block", NOW, TestFixtures.ZONE, metadata);
    }

    @Test
    void testBlocksStudentsPastGracePeriod() {
        User late = TestFixtures.createStudent("Ayesha Khan", "5000.00", 1);
        User withinGrace = TestFixtures.createStudent("Bilal Ahmed", "5000.00", 3);
        TestFixtures.createVoucher(late.id, LocalDate.of(2025, 1, 1), Voucher.VoucherStatus.PENDING);
        TestFixtures.createVoucher(withinGrace.id, LocalDate.of(2025, 1, 3), Voucher.VoucherStatus.PENDING);

        JobRunContext context = context(Map.of());
        handler.execute(context);

        assertEquals("2025-01-02", context.results().get("cutoff_date"));
        assertEquals(1, context.count("students_blocked"));

        QuarkusTransaction.requiringNew().run(() -> {
            User blocked = User.findById(late.id);
            assertTrue(blocked.blocked);
            assertEquals(VoucherAutoBlockJobHandler.BLOCK_REASON, blocked.blockReason);
            assertEquals(NOW, blocked.blockedAt);
            assertEquals(1, UserNotification.findByUserAndType(late.id, "account_auto_blocked").size());

            User untouched = User.findById(withinGrace.id);
            assertFalse(untouched.blocked, "Voucher due 2025-01-03 is within the grace period");
        });
    }

    @Test
    void testSecondRunDoesNotBlockOrNotifyAgain() {
        User late = TestFixtures.createStudent("Ayesha Khan", "5000.00", 1);
        TestFixtures.createVoucher(late.id, LocalDate.of(2025, 1, 1), Voucher.VoucherStatus.PENDING);

        handler.execute(context(Map.of()));
        JobRunContext second = context(Map.of());
        handler.execute(second);

        assertEquals(0, second.count("students_blocked"));
        assertEquals(1, second.count("already_blocked"));
        QuarkusTransaction.requiringNew().run(() -> assertEquals(1,
                UserNotification.findByUserAndType(late.id, "account_auto_blocked").size()));
    }

    @Test
    void testStudentWithSeveralOverdueVouchersIsEvaluatedOnce() {
        User late = TestFixtures.createStudent("Ayesha Khan", "5000.00", 1);
        TestFixtures.createVoucher(late.id, LocalDate.of(2024, 11, 1), Voucher.VoucherStatus.PENDING);
        TestFixtures.createVoucher(late.id, LocalDate.of(2024, 12, 1), Voucher.VoucherStatus.PENDING);

        JobRunContext context = context(Map.of());
        handler.execute(context);

        assertEquals(2, context.count("vouchers_found"));
        assertEquals(1, context.count("students_blocked"));
        assertEquals(0, context.count("already_blocked"));
    }

    @Test
    void testBlockAfterDaysOverride() {
        User late = TestFixtures.createStudent("Ayesha Khan", "5000.00", 3);
        TestFixtures.createVoucher(late.id, LocalDate.of(2025, 1, 3), Voucher.VoucherStatus.PENDING);

        JobRunContext context = context(Map.of("block_after_days", 1));
        handler.execute(context);

        assertEquals(1, context.count("students_blocked"));
    }

    @Test
    void testInvalidOverrideFailsRun() {
        assertThrows(ValidationException.class, () -> handler.execute(context(Map.of("block_after_days", "soon"))));
    }
}
