package uk.gegc.examinsight.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of time for grading timestamps, weekly trend windows and calendar streaks.
 * Tests replace it with a fixed clock.
 */
@Configuration
public class ClockConfig {

    @Value("${app.timezone:UTC}")
    private String timezone;

    @Bean
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "UTC"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }
}
