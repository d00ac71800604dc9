package uk.gegc.examinsight.features.progress.application;

import uk.gegc.examinsight.features.progress.domain.model.AchievementType;

import java.util.List;

/**
 * Gamification state after one attempt: streaks plus the achievement types the attempt qualifies for.
 */
public record ProgressEvaluation(int currentStreak, int longestStreak, List<AchievementType> achievements) {
}
