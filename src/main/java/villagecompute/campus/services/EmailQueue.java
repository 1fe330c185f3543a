package villagecompute.campus.services;

import java.util.Map;

/**
 * Outbound email queue used by the recurring jobs. Queuing is the hand-off; delivery happens elsewhere.
 *
 * <p>
 * Implementations must never throw; see {@link NotificationSink}.
 */
public interface EmailQueue {

    /**
     * Queues a templated email.
     *
     * @param recipientId
     *            user id of the recipient, may be null for non-user addresses
     * @param to
     *            recipient address
     * @param recipientName
     *            display name used in the greeting
     * @param template
     *            template name, resolved as {@code templates/email/<template>.html} and {@code .txt}
     * @param subject
     *            subject line
     * @param templateData
     *            values the templates are rendered with
     * @return true if the email was queued
     */
    boolean queueEmail(Long recipientId, String to, String recipientName, String template, String subject,
            Map<String, Object> templateData);
}
