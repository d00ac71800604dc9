package uk.gegc.examinsight.features.progress.application.streak;

import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.progress.config.ProgressProperties.StreakMode;

import java.util.List;

/**
 * Computes current and longest streaks from a user's completed attempts.
 */
public interface StreakStrategy {

    StreakMode mode();

    /**
     * @param chronological completed attempts, oldest first
     */
    StreakResult compute(List<ExamAttempt> chronological);
}
