package villagecompute.campus.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-app notification shown to a student.
 *
 * <h3>Schema Mapping:</h3>
 * <ul>
 * <li>id (UUID, PK) - Primary identifier</li>
 * <li>user_id (BIGINT) - Reference to users</li>
 * <li>type (TEXT) - Notification type, e.g. {@code task_reminder}, {@code voucher_overdue}</li>
 * <li>title, message (TEXT)</li>
 * <li>data (JSON) - Structured payload for the UI (task_id, voucher_id, ...)</li>
 * <li>read_at (TIMESTAMPTZ) - Read timestamp (null for unread)</li>
 * <li>created_at (TIMESTAMPTZ)</li>
 * </ul>
 *
 * <h3>Named Queries:</h3>
 * <ul>
 * <li>{@link #QUERY_FIND_BY_USER_ID} - All notifications for a user, newest first</li>
 * <li>{@link #QUERY_FIND_BY_USER_AND_TYPE} - Notifications of one type for a user</li>
 * </ul>
 */
@Entity
@Table(
        name = "user_notifications")
@NamedQuery(
        name = UserNotification.QUERY_FIND_BY_USER_ID,
        query = "FROM UserNotification WHERE userId = :userId ORDER BY createdAt DESC")
@NamedQuery(
        name = UserNotification.QUERY_FIND_BY_USER_AND_TYPE,
        query = "FROM UserNotification WHERE userId = :userId AND type = :type ORDER BY createdAt DESC")
public class UserNotification extends PanacheEntityBase {

    public static final String QUERY_FIND_BY_USER_ID = "UserNotification.findByUserId";
    public static final String QUERY_FIND_BY_USER_AND_TYPE = "UserNotification.findByUserAndType";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public Long userId;

    @Column(
            nullable = false)
    public String type;

    @Column(
            nullable = false)
    public String title;

    @Column(
            nullable = false,
            columnDefinition = "TEXT")
    public String message;

    @Column(
            name = "data")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> data;

    @Column(
            name = "read_at")
    public Instant readAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Finds all notifications for a user, newest first.
     *
     * @param userId
     *            the user's id
     * @return notifications (empty list if userId is null)
     */
    public static List<UserNotification> findByUserId(Long userId) {
        if (userId == null) {
            return List.of();
        }
        return find("#" + QUERY_FIND_BY_USER_ID, Parameters.with("userId", userId)).list();
    }

    public static List<UserNotification> findByUserAndType(Long userId, String type) {
        if (userId == null || type == null) {
            return List.of();
        }
        return find("#" + QUERY_FIND_BY_USER_AND_TYPE, Parameters.with("userId", userId).and("type", type)).list();
    }
}
