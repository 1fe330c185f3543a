package villagecompute.campus.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A student's submission for a task. Only its existence matters to the reminder job.
 */
@Entity
@Table(
        name = "submitted_tasks")
public class SubmittedTask extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "task_id",
            nullable = false)
    public Long taskId;

    @Column(
            name = "student_id",
            nullable = false)
    public Long studentId;

    @Column(
            name = "submitted_at")
    public Instant submittedAt;

    public static Set<Long> findSubmitterIds(Long taskId) {
        return new HashSet<>(getEntityManager()
                .createQuery("SELECT st.studentId FROM SubmittedTask st WHERE st.taskId = :taskId", Long.class)
                .setParameter("taskId", taskId).getResultList());
    }
}
