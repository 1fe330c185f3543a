package villagecompute.campus.jobs;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.campus.data.models.User;
import villagecompute.campus.data.models.Voucher;
import villagecompute.campus.observability.LoggingConfig;
import villagecompute.campus.services.NotificationSink;
import villagecompute.campus.services.StudentStore;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Job handler for overdue voucher reminders.
 *
 * <p>
 * Runs daily. Every pending voucher whose due date is before today produces one {@code voucher_overdue} notification
 * per run. Nothing is recorded on the voucher, so the reminder repeats every day until the voucher is submitted or the
 * student is blocked; blocked students are skipped because the auto-block notification already told them.
 *
 * <p>
 * <b>Result metadata:</b> {@code vouchers_found}, {@code notifications_sent}, {@code notifications_failed},
 * {@code skipped_blocked}.
 */
@ApplicationScoped
public class VoucherOverdueNotificationJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(VoucherOverdueNotificationJobHandler.class);

    static final String NOTIFICATION_TYPE = "voucher_overdue";

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    StudentStore studentStore;

    @Inject
    NotificationSink notificationSink;

    @ConfigProperty(
            name = "villagecompute.jobs.voucher.currency",
            defaultValue = "PKR")
    String currency;

    @Override
    public JobClass handlesClass() {
        return JobClass.VOUCHER_OVERDUE_NOTIFICATION;
    }

    @Override
    public void execute(JobRunContext context) {
        LocalDate today = context.today();

        Span span = tracer.spanBuilder("job.voucher_overdue_notification")
                .setAttribute("job.id", String.valueOf(context.jobId())).setAttribute("today", today.toString())
                .startSpan();
        Timer.Sample timerSample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("VoucherOverdueNotificationJobHandler");

            context.initCounters("vouchers_found", "notifications_sent", "notifications_failed", "skipped_blocked");

            List<Voucher> overdue = QuarkusTransaction.requiringNew().call(() -> Voucher.findPendingDueBefore(today));
            context.increment("vouchers_found", overdue.size());
            span.setAttribute("vouchers_found", overdue.size());

            for (Voucher voucher : overdue) {
                try {
                    Optional<User> student = studentStore.findById(voucher.studentId);
                    if (student.isPresent() && student.get().blocked) {
                        context.increment("skipped_blocked");
                        continue;
                    }
                    if (notifyStudent(voucher, today)) {
                        context.increment("notifications_sent");
                        Counter.builder("campus.vouchers.overdue_notifications.total").register(meterRegistry)
                                .increment();
                    } else {
                        context.increment("notifications_failed");
                    }
                } catch (Exception e) {
                    context.increment("notifications_failed");
                    span.recordException(e);
                    LOG.errorf(e, "Failed to notify student %d about overdue voucher %d", voucher.studentId,
                            voucher.id);
                }
            }

            context.setMessage(String.format("Overdue notifications: %d sent, %d failed, %d vouchers overdue",
                    context.count("notifications_sent"), context.count("notifications_failed"), overdue.size()));
            LOG.infof("Overdue voucher notification completed: found=%d, sent=%d, failed=%d, skipped_blocked=%d",
                    overdue.size(), context.count("notifications_sent"), context.count("notifications_failed"),
                    context.count("skipped_blocked"));

        } finally {
            timerSample.stop(Timer.builder("campus.vouchers.overdue_notifications.duration").register(meterRegistry));
            span.end();
        }
    }

    private boolean notifyStudent(Voucher voucher, LocalDate today) {
        long daysOverdue = ChronoUnit.DAYS.between(voucher.dueDate, today);
        BigDecimal amount = voucher.feeAmount == null ? BigDecimal.ZERO : voucher.feeAmount;
        String dueDate = VoucherGenerationJobHandler.DUE_FORMAT.format(voucher.dueDate);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("voucher_id", voucher.id);
        data.put("fee_amount", amount);
        data.put("due_date", voucher.dueDate.toString());
        data.put("days_overdue", daysOverdue);

        return notificationSink.createNotification(voucher.studentId, NOTIFICATION_TYPE, "Voucher Overdue",
                String.format(Locale.ENGLISH,
                        "Your %s (%s %,.2f) was due on %s and is %d day(s) overdue. Please deposit it as soon as "
                                + "possible to avoid your account being blocked.",
                        voucher.description, currency, amount, dueDate, daysOverdue),
                data);
    }
}
