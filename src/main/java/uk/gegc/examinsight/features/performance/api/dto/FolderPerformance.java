package uk.gegc.examinsight.features.performance.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "FolderPerformance", description = "Statistics for exams sharing a display name")
public record FolderPerformance(
        @Schema(example = "Biology 101") String folder,
        @Schema(example = "3") int attempts,
        @Schema(example = "76.7") double averageScore,
        @Schema(example = "90.0") double bestScore,
        @Schema(example = "38.0") double averageTimePerQuestion,
        @Schema(example = "30") int totalQuestions
) {
}
