package villagecompute.campus.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.campus.data.models.SubmittedTask;
import villagecompute.campus.data.models.Task;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * {@link TaskStore} over the {@code tasks} and {@code submitted_tasks} tables.
 */
@ApplicationScoped
public class PanacheTaskStore implements TaskStore {

    @Override
    public List<Task> findExpiringBetween(Instant from, Instant to) {
        return QuarkusTransaction.joiningExisting().call(() -> Task.findExpiringBetween(from, to));
    }

    @Override
    public Set<Long> findSubmitterIds(Long taskId) {
        return QuarkusTransaction.joiningExisting().call(() -> SubmittedTask.findSubmitterIds(taskId));
    }
}
