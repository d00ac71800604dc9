package uk.gegc.examinsight.features.exam.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examinsight.features.exam.domain.model.ExamDifficulty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "ExamDto", description = "Exam ready to be taken")
public record ExamDto(
        UUID id,
        String title,
        String folderId,
        String folderName,
        ExamDifficulty difficulty,
        int questionCount,
        boolean active,
        Instant createdAt,
        Instant expiresAt,
        List<ExamQuestionDto> questions
) {
}
