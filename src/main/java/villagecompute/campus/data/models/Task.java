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

import java.time.Instant;
import java.util.List;

/**
 * Assignment given to a batch of students, with a submission deadline.
 */
@Entity
@Table(
        name = "tasks")
@NamedQuery(
        name = Task.QUERY_FIND_EXPIRING_BETWEEN,
        query = "FROM Task WHERE expiryDate >= :from AND expiryDate < :to ORDER BY expiryDate, id")
public class Task extends PanacheEntityBase {

    public static final String QUERY_FIND_EXPIRING_BETWEEN = "Task.findExpiringBetween";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            nullable = false)
    public String title;

    @Column(
            name = "batch_id")
    public Long batchId;

    @Column(
            name = "expiry_date",
            nullable = false)
    public Instant expiryDate;

    /**
     * Finds tasks whose deadline lies in {@code [from, to)}.
     */
    public static List<Task> findExpiringBetween(Instant from, Instant to) {
        return find("#" + QUERY_FIND_EXPIRING_BETWEEN, Parameters.with("from", from).and("to", to)).list();
    }
}
