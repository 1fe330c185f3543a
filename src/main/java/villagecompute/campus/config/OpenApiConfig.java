package villagecompute.campus.config;

import org.eclipse.microprofile.openapi.annotations.Components;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeIn;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeType;
import org.eclipse.microprofile.openapi.annotations.info.Contact;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.security.SecurityScheme;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.core.Application;

/**
 * OpenAPI 3.0 configuration for the Village Campus scheduler API.
 *
 * @see <a href="https://github.com/eclipse/microprofile-open-api">MicroProfile OpenAPI Spec</a>
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Village Campus API",
                version = "1.0.0",
                description = """
                        Recurring background jobs for the campus platform: task deadline reminders and the
                        monthly fee voucher lifecycle.

                        ## Triggering
                        An external cron calls `POST /api/scheduled-jobs/execute` every few minutes. Every
                        enabled job whose next run is due executes once; overlapping calls are safe.

                        ## Authentication
                        The trigger endpoint checks the `X-Scheduler-Token` header when a token is configured.
                        Admin endpoints are expected behind an authenticated gateway.
                        """,
                contact = @Contact(
                        name = "Village Compute",
                        url = "https://villagecompute.com"),
                license = @License(
                        name = "Proprietary")),
        servers = {@Server(
                url = "http://localhost:8080",
                description = "Local Development")},
        tags = {@Tag(
                name = "Scheduler",
                description = "Dispatch of due scheduled jobs"),
                @Tag(
                        name = "Admin - Scheduled Jobs",
                        description = "Scheduled job registry and run history"),
                @Tag(
                        name = "Admin - Vouchers",
                        description = "On-demand voucher generation")},
        components = @Components(
                securitySchemes = {@SecurityScheme(
                        securitySchemeName = "schedulerToken",
                        type = SecuritySchemeType.APIKEY,
                        apiKeyName = "X-Scheduler-Token",
                        in = SecuritySchemeIn.HEADER,
                        description = "Shared secret for the dispatch trigger.")}))
public class OpenApiConfig extends Application {
}
