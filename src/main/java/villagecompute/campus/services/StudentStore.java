package villagecompute.campus.services;

import villagecompute.campus.data.models.User;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read and block access to students for the recurring jobs.
 */
public interface StudentStore {

    Optional<User> findById(Long studentId);

    /**
     * Ids of the students enrolled in a batch.
     */
    List<Long> findStudentIdsInBatch(Long batchId);

    /**
     * Unblocked students with a positive fee whose promise day is one of {@code promiseDays}.
     */
    List<User> findActiveByPromiseDays(Collection<Integer> promiseDays);

    /**
     * Blocks a student if not already blocked. Joins the caller's transaction when there is one.
     *
     * @return true if the student was active and is now blocked, false if already blocked or missing
     */
    boolean blockIfActive(Long studentId, String reason, Instant blockedAt);
}
