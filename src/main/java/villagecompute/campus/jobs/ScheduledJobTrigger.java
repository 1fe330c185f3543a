package villagecompute.campus.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.campus.api.types.DispatchSummaryType;
import villagecompute.campus.services.ScheduledJobDispatcher;

/**
 * In-process caller of the dispatcher, for deployments without an external cron hitting
 * {@code POST /api/scheduled-jobs/execute}.
 *
 * <p>
 * Disabled by default ({@code villagecompute.scheduler.internal-trigger.enabled}). Overlap with the HTTP trigger or
 * with other instances is safe because each job is claimed before it runs.
 */
@ApplicationScoped
public class ScheduledJobTrigger {

    private static final Logger LOG = Logger.getLogger(ScheduledJobTrigger.class);

    @Inject
    ScheduledJobDispatcher dispatcher;

    @ConfigProperty(
            name = "villagecompute.scheduler.internal-trigger.enabled",
            defaultValue = "false")
    boolean enabled;

    @Scheduled(
            every = "${villagecompute.scheduler.internal-trigger.every:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void dispatchDueJobs() {
        if (!enabled) {
            return;
        }
        try {
            DispatchSummaryType summary = dispatcher.runDueJobs();
            LOG.infof("Internal trigger: executed=%d, errors=%d, skipped=%d", summary.total(), summary.errors().size(),
                    summary.skipped().size());
        } catch (Exception e) {
            LOG.errorf(e, "Internal trigger dispatch failed");
        }
    }
}
