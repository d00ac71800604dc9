package uk.gegc.examinsight.features.progress.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.examinsight.features.progress.api.dto.AchievementDto;
import uk.gegc.examinsight.features.progress.domain.model.Achievement;

@Component
public class AchievementMapper {

    public AchievementDto toDto(Achievement achievement, boolean newlyUnlocked) {
        return new AchievementDto(
                achievement.getType(),
                achievement.getName(),
                achievement.getDescription(),
                achievement.getExamId(),
                achievement.getEarnedAt(),
                newlyUnlocked
        );
    }
}
