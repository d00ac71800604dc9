package uk.gegc.examinsight.features.performance.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the performance dashboard.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "examinsight.performance")
public class PerformanceProperties {

    /**
     * Number of rolling 7-day windows in the weekly trend.
     */
    @Min(1)
    private int trendWeeks = 8;

    /**
     * Topics below this accuracy are improvement candidates.
     */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private double improvementThreshold = 70.0;

    /**
     * Minimum answered questions before a topic can be flagged.
     */
    @Min(1)
    private int improvementMinSamples = 3;

    @Min(1)
    private int maxImprovementAreas = 5;

    @Min(1)
    private int xpPerCorrectAnswer = 10;

    @Min(1)
    private int xpPerLevel = 1000;

    @Min(1)
    private int recentAttemptsLimit = 10;
}
