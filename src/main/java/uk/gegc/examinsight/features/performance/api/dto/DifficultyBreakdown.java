package uk.gegc.examinsight.features.performance.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "DifficultyBreakdown", description = "Correctness per question difficulty, re-derived from stored answers")
public record DifficultyBreakdown(DifficultyStats easy, DifficultyStats medium, DifficultyStats hard) {
}
