package uk.gegc.examinsight.features.exam.api.dto;

import uk.gegc.examinsight.features.exam.domain.model.ExamDifficulty;

import java.time.Instant;
import java.util.UUID;

public record ExamSummaryDto(
        UUID id,
        String title,
        String folderName,
        int questionCount,
        ExamDifficulty difficulty,
        Instant createdAt
) {
}
