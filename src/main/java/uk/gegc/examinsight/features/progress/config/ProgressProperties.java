package uk.gegc.examinsight.features.progress.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for streaks and achievement triggers.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "examinsight.progress")
public class ProgressProperties {

    /**
     * Minimum percentage for an attempt to count as a success.
     */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private double passThreshold = 70.0;

    /**
     * Which streak definition is reported to users.
     */
    @NotNull
    private StreakMode streakMode = StreakMode.THRESHOLD;

    /**
     * An attempt earns speed_demon when it takes strictly less than this many seconds per question.
     */
    @Min(1)
    private int speedSecondsPerQuestion = 60;

    public enum StreakMode {
        /**
         * Consecutive successful attempts regardless of dates.
         */
        THRESHOLD,
        /**
         * Consecutive calendar days with at least one attempt, anchored on today.
         */
        CALENDAR
    }
}
