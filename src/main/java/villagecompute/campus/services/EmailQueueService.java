package villagecompute.campus.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.qute.Engine;
import io.quarkus.qute.Template;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.campus.data.models.EmailDeliveryLog;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link EmailQueue} that renders Qute templates and stores the result as a {@code QUEUED}
 * {@link EmailDeliveryLog}.
 *
 * <p>
 * Templates live under {@code src/main/resources/templates/email/} as {@code <name>.html} and {@code <name>.txt}.
 * A missing template leaves the corresponding body empty; the raw template data is always stored so the relay can
 * re-render.
 */
@ApplicationScoped
public class EmailQueueService implements EmailQueue {

    private static final Logger LOG = Logger.getLogger(EmailQueueService.class);

    @Inject
    Engine engine;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "villagecompute.email.platform-name",
            defaultValue = "Village Campus")
    String platformName;

    @Override
    public boolean queueEmail(Long recipientId, String to, String recipientName, String template, String subject,
            Map<String, Object> templateData) {
        if (to == null || to.isBlank()) {
            LOG.warnf("Skipping %s email for user %s: no address", template, recipientId);
            return false;
        }
        try {
            Map<String, Object> data = new LinkedHashMap<>(templateData == null ? Map.of() : templateData);
            data.putIfAbsent("recipientName", recipientName);
            data.putIfAbsent("platformName", platformName);

            String htmlBody = render(template, "html", data);
            String textBody = render(template, "txt", data);

            QuarkusTransaction.requiringNew().run(() -> {
                EmailDeliveryLog log = new EmailDeliveryLog();
                log.userId = recipientId;
                log.emailAddress = to;
                log.recipientName = recipientName;
                log.templateName = template;
                log.subject = subject;
                log.htmlBody = htmlBody;
                log.textBody = textBody;
                log.templateData = data;
                log.status = EmailDeliveryLog.DeliveryStatus.QUEUED;
                log.createdAt = clock.instant();
                log.persist();
            });
            LOG.debugf("Queued %s email to %s", template, to);
            return true;
        } catch (Exception e) {
            LOG.errorf(e, "Failed to queue %s email to %s", template, to);
            return false;
        }
    }

    private String render(String template, String extension, Map<String, Object> data) {
        Template compiled = engine.getTemplate("email/" + template + "." + extension);
        if (compiled == null) {
            return null;
        }
        return compiled.data(data).render();
    }
}
