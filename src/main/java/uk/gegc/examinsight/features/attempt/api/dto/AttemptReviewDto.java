package uk.gegc.examinsight.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "AttemptReviewDto", description = "Question-by-question review of a completed attempt")
public record AttemptReviewDto(
        @Schema(description = "Attempt UUID") UUID attemptId,
        @Schema(description = "Exam UUID") UUID examId,
        @Schema(description = "Exam title") String examTitle,
        @Schema(description = "Points scored", example = "15") int score,
        @Schema(description = "Percentage", example = "75.0") double percentage,
        @Schema(description = "Correct answers", example = "3") int correctCount,
        @Schema(description = "Incorrect or unanswered", example = "1") int incorrectCount,
        @Schema(description = "Seconds spent", example = "200") int timeSpentSeconds,
        @Schema(description = "Completion timestamp") Instant completedAt,
        @Schema(description = "Per-question review") List<QuestionReviewDto> questions
) {
}
