package villagecompute.campus.services;

import villagecompute.campus.data.models.Task;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Read access to tasks and submissions for the reminder job.
 */
public interface TaskStore {

    /**
     * Tasks whose deadline lies in {@code [from, to)}.
     */
    List<Task> findExpiringBetween(Instant from, Instant to);

    /**
     * Ids of the students who already submitted the task.
     */
    Set<Long> findSubmitterIds(Long taskId);
}
