package villagecompute.campus.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.campus.data.models.UserNotification;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link NotificationSink} backed by the {@code user_notifications} table.
 *
 * <p>
 * Each notification is written in its own transaction, so a failure here never marks the caller's transaction for
 * rollback.
 *
 * <h3>Error Handling:</h3>
 * <p>
 * Exceptions are logged and turned into a {@code false} return. Notification failures should never fail a job.
 */
@ApplicationScoped
public class NotificationService implements NotificationSink {

    private static final Logger LOG = Logger.getLogger(NotificationService.class);

    @Inject
    Clock clock;

    @Override
    public boolean createNotification(Long recipientId, String type, String title, String message,
            Map<String, Object> data) {
        if (recipientId == null) {
            LOG.warnf("Skipping %s notification without recipient", type);
            return false;
        }
        try {
            QuarkusTransaction.requiringNew().run(() -> {
                UserNotification notification = new UserNotification();
                notification.userId = recipientId;
                notification.type = type;
                notification.title = title;
                notification.message = message;
                notification.data = data == null ? null : new LinkedHashMap<>(data);
                notification.createdAt = clock.instant();
                notification.persist();
            });
            LOG.debugf("Created notification: user_id=%d, type=%s", recipientId, type);
            return true;
        } catch (Exception e) {
            LOG.errorf(e, "Failed to create %s notification for user %d", type, recipientId);
            return false;
        }
    }
}
