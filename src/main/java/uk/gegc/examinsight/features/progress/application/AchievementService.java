package uk.gegc.examinsight.features.progress.application;

import uk.gegc.examinsight.features.progress.api.dto.AchievementDto;
import uk.gegc.examinsight.features.progress.domain.model.AchievementType;

import java.util.List;
import java.util.UUID;

public interface AchievementService {

    /**
     * Records each achievement type for the user if not yet held. Types already held are
     * returned with {@code newlyUnlocked = false} and their original earn date.
     */
    List<AchievementDto> recordAll(UUID userId, UUID examId, List<AchievementType> types);

    List<AchievementDto> listForUser(UUID userId);
}
