package villagecompute.campus.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.campus.data.models.User;
import villagecompute.campus.data.models.UserBatch;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link StudentStore} over the {@code users} and {@code user_batches} tables.
 *
 * <p>
 * Every operation joins the caller's transaction or opens a short one of its own.
 */
@ApplicationScoped
public class PanacheStudentStore implements StudentStore {

    private static final Logger LOG = Logger.getLogger(PanacheStudentStore.class);

    @Override
    public Optional<User> findById(Long studentId) {
        if (studentId == null) {
            return Optional.empty();
        }
        return QuarkusTransaction.joiningExisting().call(() -> User.<User> findByIdOptional(studentId));
    }

    @Override
    public List<Long> findStudentIdsInBatch(Long batchId) {
        return QuarkusTransaction.joiningExisting().call(() -> UserBatch.findStudentIds(batchId));
    }

    @Override
    public List<User> findActiveByPromiseDays(Collection<Integer> promiseDays) {
        return QuarkusTransaction.joiningExisting().call(() -> User.findActiveByPromiseDays(promiseDays));
    }

    @Override
    public boolean blockIfActive(Long studentId, String reason, Instant blockedAt) {
        boolean blocked = QuarkusTransaction.joiningExisting()
                .call(() -> User.blockIfActive(studentId, reason, blockedAt));
        if (blocked) {
            LOG.infof("Blocked student %d: %s", studentId, reason);
        }
        return blocked;
    }
}
