package villagecompute.campus.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * Outbound email queue entry.
 *
 * <p>
 * The recurring jobs only enqueue: a row with status {@code QUEUED} is the hand-off to the mail relay, which owns the
 * later transitions. Both the rendered bodies and the raw template data are stored.
 *
 * <h3>Schema Mapping:</h3>
 * <ul>
 * <li>id (UUID, PK) - Primary identifier</li>
 * <li>user_id (BIGINT, nullable) - Reference to users</li>
 * <li>email_address (VARCHAR, NOT NULL) - Recipient address</li>
 * <li>recipient_name (VARCHAR)</li>
 * <li>template_name (VARCHAR, NOT NULL) - Template identifier, e.g. {@code task_reminder}</li>
 * <li>subject (VARCHAR, NOT NULL)</li>
 * <li>html_body, text_body (TEXT) - Rendered Qute templates</li>
 * <li>template_data (JSON) - Values the template is rendered with</li>
 * <li>status (VARCHAR, NOT NULL) - QUEUED, SENT, FAILED</li>
 * <li>sent_at (TIMESTAMPTZ), error_message (TEXT)</li>
 * <li>created_at (TIMESTAMPTZ, NOT NULL) - Queue timestamp</li>
 * </ul>
 */
@Entity
@Table(
        name = "email_delivery_logs")
@NamedQuery(
        name = EmailDeliveryLog.QUERY_FIND_BY_USER_ID,
        query = "FROM EmailDeliveryLog WHERE userId = :userId ORDER BY createdAt DESC")
@NamedQuery(
        name = EmailDeliveryLog.QUERY_FIND_QUEUED,
        query = "FROM EmailDeliveryLog WHERE status = :status ORDER BY createdAt ASC")
public class EmailDeliveryLog extends PanacheEntityBase {

    /**
     * Named query constant: Find all delivery logs for a user. Query:
     * {@code FROM EmailDeliveryLog WHERE userId = :userId ORDER BY createdAt DESC}
     */
    public static final String QUERY_FIND_BY_USER_ID = "EmailDeliveryLog.findByUserId";

    /**
     * Named query constant: Find queued deliveries in FIFO order. Query:
     * {@code FROM EmailDeliveryLog WHERE status = :status ORDER BY createdAt ASC}
     */
    public static final String QUERY_FIND_QUEUED = "EmailDeliveryLog.findQueued";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "user_id")
    public Long userId;

    @Column(
            name = "email_address",
            nullable = false)
    public String emailAddress;

    @Column(
            name = "recipient_name")
    public String recipientName;

    @Column(
            name = "template_name",
            nullable = false)
    public String templateName;

    @Column(
            nullable = false,
            length = 500)
    public String subject;

    @Column(
            name = "html_body",
            columnDefinition = "TEXT")
    public String htmlBody;

    @Column(
            name = "text_body",
            columnDefinition = "TEXT")
    public String textBody;

    @Column(
            name = "template_data")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> templateData;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false,
            length = 20)
    public DeliveryStatus status = DeliveryStatus.QUEUED;

    @Column(
            name = "sent_at")
    public Instant sentAt;

    @Column(
            name = "error_message",
            columnDefinition = "TEXT")
    public String errorMessage;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Email delivery status. Only {@code QUEUED} is written by this service.
     */
    public enum DeliveryStatus {
        QUEUED, SENT, FAILED
    }

    public static List<EmailDeliveryLog> findByUserId(Long userId) {
        if (userId == null) {
            return List.of();
        }
        return find("#" + QUERY_FIND_BY_USER_ID, Parameters.with("userId", userId)).list();
    }

    /**
     * Finds queued deliveries, oldest first.
     */
    public static List<EmailDeliveryLog> findQueued() {
        return find("#" + QUERY_FIND_QUEUED, Parameters.with("status", DeliveryStatus.QUEUED)).list();
    }
}
