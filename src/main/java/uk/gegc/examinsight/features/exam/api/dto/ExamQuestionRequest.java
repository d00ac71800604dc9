package uk.gegc.examinsight.features.exam.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import uk.gegc.examinsight.features.exam.domain.model.QuestionDifficulty;

import java.util.Map;

@Schema(name = "ExamQuestionRequest", description = "One generated multiple-choice question")
public record ExamQuestionRequest(
        @Schema(description = "Question id, unique within the exam", example = "q1")
        @NotBlank(message = "Question id must not be blank")
        String id,

        @Schema(description = "Question text", example = "What is the time complexity of binary search?")
        @NotBlank(message = "Question text must not be blank")
        String text,

        @Schema(description = "Exactly four options keyed by label", example = "{\"A\":\"O(n)\",\"B\":\"O(log n)\",\"C\":\"O(1)\",\"D\":\"O(n log n)\"}")
        @NotEmpty(message = "Question options must not be empty")
        Map<String, String> options,

        @Schema(description = "Label of the correct option", example = "B")
        @NotBlank(message = "Correct answer must not be blank")
        String correctAnswer,

        @Schema(description = "Explanation of the correct answer")
        String explanation,

        @Schema(description = "Topic the question tests", example = "Searching")
        String topic,

        @Schema(description = "Question difficulty", example = "medium")
        QuestionDifficulty difficulty,

        @Schema(description = "Source note the question was derived from", example = "Note 1: Algorithms")
        String sourceReference
) {
}
