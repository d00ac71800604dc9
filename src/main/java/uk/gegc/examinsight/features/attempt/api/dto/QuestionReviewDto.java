package uk.gegc.examinsight.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examinsight.features.exam.domain.model.QuestionDifficulty;

import java.util.Map;

@Schema(name = "QuestionReviewDto", description = "One question joined with the submitted answer")
public record QuestionReviewDto(
        @Schema(description = "Question id", example = "q1")
        String questionId,

        @Schema(description = "Question text")
        String text,

        @Schema(description = "Option label to option text")
        Map<String, String> options,

        @Schema(description = "Label the user chose, null when unanswered", example = "B")
        String userAnswer,

        @Schema(description = "Whether the user's answer was correct", example = "true")
        Boolean isCorrect,

        @Schema(description = "Label of the correct option", example = "B")
        String correctAnswer,

        @Schema(description = "Why the correct option is correct")
        String explanation,

        @Schema(description = "Question topic", example = "recursion")
        String topic,

        @Schema(description = "Question difficulty", example = "medium")
        QuestionDifficulty difficulty
) {
}
