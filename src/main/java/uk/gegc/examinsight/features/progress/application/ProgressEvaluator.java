package uk.gegc.examinsight.features.progress.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.progress.application.streak.StreakCalculator;
import uk.gegc.examinsight.features.progress.application.streak.StreakResult;
import uk.gegc.examinsight.features.progress.config.ProgressProperties;
import uk.gegc.examinsight.features.progress.domain.model.AchievementType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Derives streaks and achievement triggers from a user's history plus a freshly graded attempt.
 * Pure computation; recording achievements is left to {@link AchievementService}.
 */
@Component
@RequiredArgsConstructor
public class ProgressEvaluator {

    private final StreakCalculator streakCalculator;
    private final ProgressProperties progressProperties;

    /**
     * @param history         the user's completed attempts in any order; may already contain {@code newAttempt}
     * @param newAttempt      the attempt just graded, treated as the most recent
     * @param previousLongest a previously stored longest streak; the result never drops below it
     */
    public ProgressEvaluation evaluateProgress(List<ExamAttempt> history, ExamAttempt newAttempt, int previousLongest) {
        List<ExamAttempt> chronological = new ArrayList<>();
        if (history != null) {
            history.stream()
                    .filter(ExamAttempt::isCompleted)
                    .filter(attempt -> !isSameAttempt(attempt, newAttempt))
                    .sorted(Comparator.comparing(ExamAttempt::getCompletedAt,
                            Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                    .forEach(chronological::add);
        }
        chronological.add(newAttempt);

        StreakResult streak = streakCalculator.compute(chronological);
        int longest = Math.max(Math.max(streak.longest(), previousLongest), streak.current());

        List<AchievementType> achievements = new ArrayList<>();
        if (newAttempt.getPercentage() >= 100.0) {
            achievements.add(AchievementType.PERFECT_SCORE);
        }
        if (chronological.size() == 1) {
            achievements.add(AchievementType.FIRST_EXAM);
        }
        long speedLimit = (long) newAttempt.getTotalQuestions() * progressProperties.getSpeedSecondsPerQuestion();
        if (newAttempt.getTimeSpentSeconds() < speedLimit) {
            achievements.add(AchievementType.SPEED_DEMON);
        }

        return new ProgressEvaluation(streak.current(), longest, List.copyOf(achievements));
    }

    private static boolean isSameAttempt(ExamAttempt candidate, ExamAttempt newAttempt) {
        if (candidate == newAttempt) {
            return true;
        }
        return candidate.getId() != null && Objects.equals(candidate.getId(), newAttempt.getId());
    }
}
