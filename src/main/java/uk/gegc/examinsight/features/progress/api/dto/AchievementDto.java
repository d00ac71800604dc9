package uk.gegc.examinsight.features.progress.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.examinsight.features.progress.domain.model.AchievementType;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AchievementDto", description = "An achievement held by the user")
public record AchievementDto(
        @Schema(description = "Achievement key", example = "perfect_score") AchievementType type,
        @Schema(description = "Display name", example = "Perfect Score!") String name,
        @Schema(description = "What earned it", example = "Scored 100% on an exam") String description,
        @Schema(description = "Exam on which it was first earned") UUID examId,
        @Schema(description = "When it was first earned") Instant earnedAt,
        @Schema(description = "True when this request unlocked it", example = "true") boolean newlyUnlocked
) {
}
