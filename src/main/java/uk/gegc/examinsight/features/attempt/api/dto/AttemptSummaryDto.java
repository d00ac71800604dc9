package uk.gegc.examinsight.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AttemptSummaryDto", description = "Completed attempt in the user's history")
public record AttemptSummaryDto(
        @Schema(description = "Attempt UUID") UUID id,
        @Schema(description = "Exam UUID") UUID examId,
        @Schema(description = "Points scored", example = "35") int score,
        @Schema(description = "Percentage", example = "70.0") double percentage,
        @Schema(description = "Correct answers", example = "7") int correctCount,
        @Schema(description = "Questions in the exam", example = "10") int totalQuestions,
        @Schema(description = "Seconds spent", example = "480") int timeSpentSeconds,
        @Schema(description = "Completion timestamp") Instant completedAt
) {
}
