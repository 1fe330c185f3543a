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
import villagecompute.campus.data.models.User;
import villagecompute.campus.data.models.Voucher;
import villagecompute.campus.observability.LoggingConfig;
import villagecompute.campus.services.NotificationSink;
import villagecompute.campus.services.StudentStore;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Job handler for monthly fee voucher generation.
 *
 * <p>
 * Runs daily. Issues one pending voucher per eligible student, {@code lead_days} (default 10) ahead of the day of month
 * the student promised to pay.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>{@code targetDate = today + leadDays} in the scheduler zone; {@code targetDay = targetDate.dayOfMonth}</li>
 * <li>Select unblocked students with {@code fees > 0} whose promise day equals {@code targetDay}. When
 * {@code targetDate} is the last day of its month, promise days past the month's end (e.g. 31 in April) are included
 * too, so those students are not skipped for the month</li>
 * <li>{@code dueDate} = the promise day in {@code targetDate}'s month, clamped to the month's last day</li>
 * <li>Skip the student if any voucher is already due in that month</li>
 * <li>Otherwise insert the voucher in its own transaction, then send the {@code voucher_generated} notification once
 * it has committed</li>
 * </ol>
 *
 * <p>
 * <b>Result metadata:</b> {@code target_date}, {@code target_promise_day}, {@code students_processed},
 * {@code vouchers_generated}, {@code vouchers_skipped}, {@code vouchers_failed}.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code campus.vouchers.generated.total} (Counter)</li>
 * <li>{@code campus.vouchers.generation.errors.total} (Counter)</li>
 * <li>{@code campus.vouchers.generation.duration} (Timer)</li>
 * </ul>
 */
@ApplicationScoped
public class VoucherGenerationJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(VoucherGenerationJobHandler.class);

    static final String NOTIFICATION_TYPE = "voucher_generated";
    static final String VOUCHER_DESCRIPTION = "Fee Voucher";
    static final DateTimeFormatter DUE_FORMAT = DateTimeFormatter.ofPattern("MMM dd, yyyy", Locale.ENGLISH);

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    StudentStore studentStore;

    @Inject
    NotificationSink notificationSink;

    @ConfigProperty(
            name = "villagecompute.jobs.voucher.lead-days",
            defaultValue = "10")
    int defaultLeadDays;

    @ConfigProperty(
            name = "villagecompute.jobs.voucher.currency",
            defaultValue = "PKR")
    String currency;

    @Override
    public JobClass handlesClass() {
        return JobClass.VOUCHER_GENERATION;
    }

    @Override
    public void execute(JobRunContext context) {
        int leadDays = context.intMetadata("lead_days", defaultLeadDays);
        LocalDate targetDate = context.today().plusDays(leadDays);
        int targetDay = targetDate.getDayOfMonth();

        Span span = tracer.spanBuilder("job.voucher_generation").setAttribute("job.id", String.valueOf(context.jobId()))
                .setAttribute("target_date", targetDate.toString()).startSpan();
        Timer.Sample timerSample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("VoucherGenerationJobHandler");

            context.put("target_date", targetDate.toString());
            context.put("target_promise_day", targetDay);
            context.initCounters("students_processed", "vouchers_generated", "vouchers_skipped", "vouchers_failed");

            List<User> students = studentStore.findActiveByPromiseDays(promiseDaysFor(targetDate));
            LOG.infof("Voucher generation for %s (promise day %d): %d eligible students", targetDate, targetDay,
                    students.size());
            span.setAttribute("students_found", students.size());

            for (User student : students) {
                context.increment("students_processed");
                try {
                    issueVoucher(context, student, targetDate);
                } catch (Exception e) {
                    context.increment("vouchers_failed");
                    span.recordException(e);
                    Counter.builder("campus.vouchers.generation.errors.total").register(meterRegistry).increment();
                    LOG.errorf(e, "Failed to generate voucher for student %d", student.id);
                }
            }

            int generated = context.count("vouchers_generated");
            int skipped = context.count("vouchers_skipped");
            span.addEvent("voucher_generation.completed", Attributes.of(AttributeKey.longKey("generated"),
                    (long) generated, AttributeKey.longKey("skipped"), (long) skipped));

            context.setMessage(
                    String.format("Generated %d voucher(s), skipped %d existing voucher(s)", generated, skipped));
            LOG.infof("Voucher generation completed: generated=%d, skipped=%d, failed=%d", generated, skipped,
                    context.count("vouchers_failed"));

        } finally {
            timerSample.stop(Timer.builder("campus.vouchers.generation.duration").register(meterRegistry));
            span.end();
        }
    }

    /**
     * Promise days served on {@code targetDate}: its own day, plus every later day that its month lacks when it is the
     * month's last day.
     */
    static Set<Integer> promiseDaysFor(LocalDate targetDate) {
        Set<Integer> days = new LinkedHashSet<>();
        days.add(targetDate.getDayOfMonth());
        if (targetDate.getDayOfMonth() == targetDate.lengthOfMonth()) {
            for (int day = targetDate.getDayOfMonth() + 1; day <= 31; day++) {
                days.add(day);
            }
        }
        return days;
    }

    /**
     * Due date for a promise day in {@code targetDate}'s month, clamped to the month's length.
     */
    static LocalDate dueDateFor(LocalDate targetDate, int promiseDay) {
        return targetDate.withDayOfMonth(Math.min(promiseDay, targetDate.lengthOfMonth()));
    }

    private void issueVoucher(JobRunContext context, User student, LocalDate targetDate) {
        int promiseDay = student.expectedFeePromiseDate;
        LocalDate dueDate = dueDateFor(targetDate, promiseDay);
        YearMonth dueMonth = YearMonth.from(dueDate);

        Voucher voucher = QuarkusTransaction.requiringNew().call(() -> {
            if (Voucher.existsForMonth(student.id, dueMonth)) {
                return null;
            }
            return Voucher.issue(student.id, student.fees, VOUCHER_DESCRIPTION, dueDate, promiseDay, context.now());
        });

        if (voucher == null) {
            context.increment("vouchers_skipped");
            LOG.debugf("Student %d already has a voucher for %s", student.id, dueMonth);
            return;
        }

        // the voucher is committed before the student hears about it
        if (!notifyStudent(voucher)) {
            LOG.warnf("Voucher %d issued but notification failed for student %d", voucher.id, student.id);
        }

        context.increment("vouchers_generated");
        Counter.builder("campus.vouchers.generated.total").register(meterRegistry).increment();
        LOG.infof("Voucher %d generated for student %d (%s) due %s", voucher.id, student.id, student.email, dueDate);
    }

    private boolean notifyStudent(Voucher voucher) {
        BigDecimal amount = voucher.feeAmount == null ? BigDecimal.ZERO : voucher.feeAmount;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("voucher_id", voucher.id);
        data.put("fee_amount", amount);
        data.put("description", voucher.description);
        data.put("due_date", voucher.dueDate.toString());

        return notificationSink.createNotification(voucher.studentId, NOTIFICATION_TYPE, "New Voucher Generated",
                String.format(Locale.ENGLISH,
                        "A new %s (%s %,.2f) has been generated. Due Date: %s. Please go to Account Book and deposit "
                                + "soon to avoid any inconvenience.",
                        voucher.description, currency, amount, DUE_FORMAT.format(voucher.dueDate)),
                data);
    }
}
