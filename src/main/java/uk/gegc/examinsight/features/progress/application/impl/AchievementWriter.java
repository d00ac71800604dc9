package uk.gegc.examinsight.features.progress.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.examinsight.features.progress.domain.model.Achievement;
import uk.gegc.examinsight.features.progress.domain.repository.AchievementRepository;

/**
 * Inserts achievements in their own transaction so a unique-key collision with a concurrent
 * request rolls back only the insert and leaves the caller's transaction usable.
 */
@Component
@RequiredArgsConstructor
class AchievementWriter {

    private final AchievementRepository achievementRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Achievement insert(Achievement achievement) {
        return achievementRepository.saveAndFlush(achievement);
    }
}
