package villagecompute.campus.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.util.List;

/**
 * Enrollment of a student in a batch (join row).
 */
@Entity
@Table(
        name = "user_batches",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_user_batches_user_batch",
                columnNames = {"user_id", "batch_id"}))
public class UserBatch extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "user_id",
            nullable = false)
    public Long userId;

    @Column(
            name = "batch_id",
            nullable = false)
    public Long batchId;

    public static List<Long> findStudentIds(Long batchId) {
        if (batchId == null) {
            return List.of();
        }
        return getEntityManager()
                .createQuery("SELECT ub.userId FROM UserBatch ub WHERE ub.batchId = :batchId ORDER BY ub.userId",
                        Long.class)
                .setParameter("batchId", batchId).getResultList();
    }
}
