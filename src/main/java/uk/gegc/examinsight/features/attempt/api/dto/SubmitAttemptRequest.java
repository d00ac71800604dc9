package uk.gegc.examinsight.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

@Schema(name = "SubmitAttemptRequest", description = "Answers for one exam submission")
public record SubmitAttemptRequest(
        @Schema(description = "Question id to chosen option label; unanswered questions may be omitted",
                example = "{\"q1\": \"A\", \"q2\": \"C\"}")
        @NotNull(message = "answers must not be null")
        Map<String, String> answers,

        @Schema(description = "Seconds spent on the exam", example = "540")
        @Min(value = 0, message = "timeSpentSeconds must be >= 0")
        int timeSpentSeconds
) {
}
