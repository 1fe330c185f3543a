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

import java.time.LocalDate;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Job handler that blocks students with long-overdue vouchers.
 *
 * <p>
 * Runs daily. Selects pending vouchers due on or before {@code today - block_after_days} (default 3) and blocks their
 * students. The block is a conditional update ({@code WHERE blocked = false}), so a student is blocked and notified at
 * most once however often the job runs; unblocking is an administrative action outside this job.
 *
 * <p>
 * <b>Per voucher:</b>
 * <ul>
 * <li>Student missing: {@code skipped}</li>
 * <li>Student already blocked (before or during this run): {@code already_blocked}</li>
 * <li>Otherwise block with {@link #BLOCK_REASON}, send {@code account_auto_blocked}: {@code students_blocked}</li>
 * </ul>
 * A student with several overdue vouchers is evaluated once per run.
 *
 * <p>
 * <b>Metrics:</b> {@code campus.students.auto_blocked.total} (Counter),
 * {@code campus.vouchers.auto_block.duration} (Timer).
 */
@ApplicationScoped
public class VoucherAutoBlockJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(VoucherAutoBlockJobHandler.class);

    public static final String BLOCK_REASON = "Automatically blocked: fee voucher overdue. Submit the pending voucher "
            + "payment to restore access.";

    static final String NOTIFICATION_TYPE = "account_auto_blocked";

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    StudentStore studentStore;

    @Inject
    NotificationSink notificationSink;

    @ConfigProperty(
            name = "villagecompute.jobs.voucher.block-after-days",
            defaultValue = "3")
    int defaultBlockAfterDays;

    @Override
    public JobClass handlesClass() {
        return JobClass.VOUCHER_AUTO_BLOCK;
    }

    @Override
    public void execute(JobRunContext context) {
        int blockAfterDays = context.intMetadata("block_after_days", defaultBlockAfterDays);
        LocalDate cutoff = context.today().minusDays(blockAfterDays);

        Span span = tracer.spanBuilder("job.voucher_auto_block").setAttribute("job.id", String.valueOf(context.jobId()))
                .setAttribute("cutoff", cutoff.toString()).startSpan();
        Timer.Sample timerSample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("VoucherAutoBlockJobHandler");

            context.put("cutoff_date", cutoff.toString());
            context.put("block_after_days", blockAfterDays);
            context.initCounters("vouchers_found", "students_blocked", "already_blocked", "skipped", "block_failed");

            List<Voucher> overdue = QuarkusTransaction.requiringNew()
                    .call(() -> Voucher.findPendingDueOnOrBefore(cutoff));
            context.increment("vouchers_found", overdue.size());

            Set<Long> seen = new HashSet<>();
            for (Voucher voucher : overdue) {
                if (!seen.add(voucher.studentId)) {
                    continue;
                }
                try {
                    blockStudent(context, voucher);
                } catch (Exception e) {
                    context.increment("block_failed");
                    span.recordException(e);
                    LOG.errorf(e, "Failed to auto-block student %d for voucher %d", voucher.studentId, voucher.id);
                }
            }

            span.addEvent("auto_block.completed",
                    Attributes.of(AttributeKey.longKey("students_blocked"), (long) context.count("students_blocked"),
                            AttributeKey.longKey("already_blocked"), (long) context.count("already_blocked")));

            context.setMessage(String.format("Auto-block: %d blocked, %d already blocked, %d skipped",
                    context.count("students_blocked"), context.count("already_blocked"), context.count("skipped")));
            LOG.infof("Voucher auto-block completed: cutoff=%s, blocked=%d, already_blocked=%d, skipped=%d", cutoff,
                    context.count("students_blocked"), context.count("already_blocked"), context.count("skipped"));

        } finally {
            timerSample.stop(Timer.builder("campus.vouchers.auto_block.duration").register(meterRegistry));
            span.end();
        }
    }

    private void blockStudent(JobRunContext context, Voucher voucher) {
        Optional<User> student = studentStore.findById(voucher.studentId);
        if (student.isEmpty()) {
            LOG.warnf("Voucher %d references missing student %d", voucher.id, voucher.studentId);
            context.increment("skipped");
            return;
        }
        if (student.get().blocked) {
            context.increment("already_blocked");
            return;
        }

        boolean blocked = QuarkusTransaction.requiringNew().call(() -> {
            if (!studentStore.blockIfActive(voucher.studentId, BLOCK_REASON, context.now())) {
                return false;
            }
            if (!notifyStudent(voucher)) {
                LOG.warnf("Student %d blocked but notification failed", voucher.studentId);
            }
            return true;
        });

        if (blocked) {
            context.increment("students_blocked");
            Counter.builder("campus.students.auto_blocked.total").register(meterRegistry).increment();
            LOG.infof("Blocked student %d for overdue voucher %d (due %s)", voucher.studentId, voucher.id,
                    voucher.dueDate);
        } else {
            // Blocked between the read and the update
            context.increment("already_blocked");
        }
    }

    private boolean notifyStudent(Voucher voucher) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("voucher_id", voucher.id);
        data.put("due_date", voucher.dueDate.toString());
        data.put("reason", BLOCK_REASON);

        return notificationSink.createNotification(voucher.studentId, NOTIFICATION_TYPE, "Account Blocked",
                "Your account has been blocked because your fee voucher due on "
                        + VoucherGenerationJobHandler.DUE_FORMAT.format(voucher.dueDate)
                        + " is still unpaid. Please submit the payment to restore access.",
                data);
    }
}
