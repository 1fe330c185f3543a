package villagecompute.campus.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Produces the application {@link Clock}.
 *
 * <p>
 * Everything that stamps rows or decides "now" injects this clock instead of calling {@code Instant.now()}, so tests
 * can pass an explicit dispatch instant and get deterministic windows.
 */
@ApplicationScoped
public class TimeConfig {

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}
