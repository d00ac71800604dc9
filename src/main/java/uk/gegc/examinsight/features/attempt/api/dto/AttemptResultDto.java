package uk.gegc.examinsight.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examinsight.features.attempt.domain.model.AttemptStatus;
import uk.gegc.examinsight.features.attempt.domain.model.TopicScore;
import uk.gegc.examinsight.features.progress.api.dto.AchievementDto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Schema(name = "AttemptResultDto", description = "Outcome of grading a submission")
public record AttemptResultDto(
        @Schema(description = "Attempt UUID") UUID attemptId,
        @Schema(description = "Exam UUID") UUID examId,
        @Schema(description = "Points scored", example = "20") int score,
        @Schema(description = "Percentage of correct answers", example = "100.0") double percentage,
        @Schema(description = "Correct answers", example = "4") int correctCount,
        @Schema(description = "Incorrect or unanswered", example = "0") int incorrectCount,
        @Schema(description = "Questions in the exam", example = "4") int totalQuestions,
        @Schema(description = "Seconds spent", example = "120") int timeSpentSeconds,
        @Schema(description = "Correct/total per topic") Map<String, TopicScore> performanceByTopic,
        @Schema(description = "Attempt status", example = "COMPLETED") AttemptStatus status,
        @Schema(description = "Completion timestamp") Instant completedAt,
        @Schema(description = "Consecutive successful attempts ending with this one", example = "3") int currentStreak,
        @Schema(description = "Longest run of successful attempts", example = "5") int longestStreak,
        @Schema(description = "Achievements this attempt qualifies for") List<AchievementDto> achievements,
        @Schema(description = "Per-question review") List<QuestionReviewDto> questions
) {
}
