package villagecompute.campus.services;

import java.util.Map;

/**
 * In-app notification channel used by the recurring jobs.
 *
 * <p>
 * Implementations must never throw: a failed notification is reported through the return value so the calling job can
 * count it and carry on with the next student.
 */
public interface NotificationSink {

    /**
     * Creates an in-app notification.
     *
     * @param recipientId
     *            user id of the recipient
     * @param type
     *            notification type, e.g. {@code voucher_generated}
     * @param title
     *            short title
     * @param message
     *            body text
     * @param data
     *            structured payload for the UI, may be null
     * @return true if the notification was stored
     */
    boolean createNotification(Long recipientId, String type, String title, String message, Map<String, Object> data);
}
