package uk.gegc.examinsight.features.exam.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examinsight.features.exam.domain.model.QuestionDifficulty;

import java.util.Map;

@Schema(name = "ExamQuestionDto", description = "Question as shown while taking an exam; the answer key is never included")
public record ExamQuestionDto(
        String id,
        String text,
        Map<String, String> options,
        String topic,
        QuestionDifficulty difficulty,
        String sourceReference
) {
}
