package villagecompute.campus.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Portal user (student) as seen by the recurring jobs.
 *
 * <p>
 * Only the columns the jobs read or write are mapped: contact data, the monthly fee, the promised payment day and the
 * block state. Account management lives elsewhere.
 *
 * <h3>Schema Mapping:</h3>
 * <ul>
 * <li>id (BIGSERIAL, PK)</li>
 * <li>name, email (TEXT)</li>
 * <li>fees (NUMERIC) - Monthly fee; zero means no voucher is issued</li>
 * <li>expected_fee_promise_date (INT) - Day of month (1-31) the student promised to pay</li>
 * <li>blocked (BOOLEAN), block_reason (TEXT), blocked_at (TIMESTAMPTZ)</li>
 * </ul>
 */
@Entity
@Table(
        name = "users")
@NamedQuery(
        name = User.QUERY_FIND_ACTIVE_BY_PROMISE_DAYS,
        query = "FROM User WHERE blocked = false AND fees > 0 AND expectedFeePromiseDate IN :days ORDER BY id")
@NamedQuery(
        name = User.QUERY_BLOCK_IF_ACTIVE,
        query = "UPDATE User SET blocked = true, blockReason = :reason, blockedAt = :blockedAt "
                + "WHERE id = :id AND blocked = false")
public class User extends PanacheEntityBase {

    /**
     * Named query constant: active fee-paying students whose promise day is in a set. Query:
     * {@code FROM User WHERE blocked = false AND fees > 0 AND expectedFeePromiseDate IN :days ORDER BY id}
     */
    public static final String QUERY_FIND_ACTIVE_BY_PROMISE_DAYS = "User.findActiveByPromiseDays";

    /**
     * Named query constant: conditional block that only touches unblocked rows.
     */
    public static final String QUERY_BLOCK_IF_ACTIVE = "User.blockIfActive";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            nullable = false)
    public String name;

    @Column(
            nullable = false)
    public String email;

    @Column(
            precision = 12,
            scale = 2)
    public BigDecimal fees;

    @Column(
            name = "expected_fee_promise_date")
    public Integer expectedFeePromiseDate;

    @Column(
            nullable = false)
    public boolean blocked;

    @Column(
            name = "block_reason",
            columnDefinition = "TEXT")
    public String blockReason;

    @Column(
            name = "blocked_at")
    public Instant blockedAt;

    /**
     * Finds unblocked students with a positive fee whose promise day is one of {@code days}.
     *
     * @param days
     *            promise days of month
     * @return matching students ordered by id (empty list if days is empty)
     */
    public static List<User> findActiveByPromiseDays(Collection<Integer> days) {
        if (days == null || days.isEmpty()) {
            return List.of();
        }
        return find("#" + QUERY_FIND_ACTIVE_BY_PROMISE_DAYS, Parameters.with("days", days)).list();
    }

    /**
     * Blocks a student unless already blocked. Must run inside a transaction.
     *
     * @return true if this call changed the row
     */
    public static boolean blockIfActive(Long id, String reason, Instant blockedAt) {
        return getEntityManager().createNamedQuery(QUERY_BLOCK_IF_ACTIVE).setParameter("reason", reason)
                .setParameter("blockedAt", blockedAt).setParameter("id", id).executeUpdate() == 1;
    }
}
