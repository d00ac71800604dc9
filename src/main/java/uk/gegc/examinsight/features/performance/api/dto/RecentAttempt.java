package uk.gegc.examinsight.features.performance.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "RecentAttempt", description = "A recent attempt joined with its exam")
public record RecentAttempt(
        UUID attemptId,
        UUID examId,
        @Schema(description = "Folder name or exam title; null when the exam was deleted") String examName,
        @Schema(description = "Questions in the exam", example = "10") int questionCount,
        @Schema(example = "40") int score,
        @Schema(example = "80.0") double percentage,
        @Schema(example = "300") int timeSpentSeconds,
        Instant completedAt
) {
}
