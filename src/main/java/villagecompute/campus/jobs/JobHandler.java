package villagecompute.campus.jobs;

/**
 * Contract for recurring job handler implementations.
 *
 * <p>
 * Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped} and implement this interface. The
 * {@link villagecompute.campus.services.ScheduledJobDispatcher} discovers handlers at startup and routes each due
 * {@link villagecompute.campus.data.models.ScheduledJob} to the handler registered for its {@link JobClass}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Handlers run synchronously inside one dispatch, one job after another</li>
 * <li>Handlers may be invoked again for the same business window (overlapping triggers, retries), so every side effect
 * must be guarded by an idempotency ledger or a state check</li>
 * <li>Per-item failures should be caught, logged and counted; only errors that make the whole run meaningless should
 * escape</li>
 * </ul>
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>{@code
 * @ApplicationScoped
 * public class VoucherOverdueNotificationJobHandler implements JobHandler {
 *     @Override
 *     public JobClass handlesClass() {
 *         return JobClass.VOUCHER_OVERDUE_NOTIFICATION;
 *     }
 *
 *     @Override
 *     public void execute(JobRunContext context) {
 *         LocalDate today = context.today();
 *         // notify, then context.increment("notifications_sent")
 *     }
 * }
 * }</pre>
 *
 * @see JobClass for supported job classes
 * @see JobRunContext for the per-run state shared with the dispatcher
 */
public interface JobHandler {

    /**
     * Returns the job class this handler processes.
     *
     * @return the job class enum value
     */
    JobClass handlesClass();

    /**
     * Executes one run of the job.
     *
     * <p>
     * <b>Error Handling:</b> A thrown exception marks the run's JobLog {@code failed}. The job is still rescheduled, so
     * the next trigger retries it.
     *
     * @param context
     *            dispatch instant, job metadata and the mutable result holder for the audit log
     * @throws Exception
     *             any error that aborts the run
     */
    void execute(JobRunContext context) throws Exception;
}
