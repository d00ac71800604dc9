package uk.gegc.examinsight.features.performance.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "WeeklyPerformance", description = "One rolling 7-day window; the last window ends now")
public record WeeklyPerformance(
        @Schema(example = "Week 8") String week,
        @Schema(description = "Window start, exclusive") Instant windowStart,
        @Schema(description = "Window end, inclusive") Instant windowEnd,
        @Schema(example = "2") int exams,
        @Schema(description = "Mean percentage, 0 when the window is empty", example = "82.5") double averageScore
) {
}
