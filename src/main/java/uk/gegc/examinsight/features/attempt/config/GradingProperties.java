package uk.gegc.examinsight.features.attempt.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for exam grading.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "examinsight.grading")
public class GradingProperties {

    /**
     * Points awarded per correctly answered question.
     */
    @Min(1)
    private int pointsPerQuestion = 5;
}
