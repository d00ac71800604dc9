package uk.gegc.examinsight.features.progress.application.streak;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.progress.config.ProgressProperties;
import uk.gegc.examinsight.features.progress.config.ProgressProperties.StreakMode;

import java.util.List;

/**
 * Streak of consecutive attempts scoring at or above the pass threshold. Date gaps are ignored.
 */
@Component
@RequiredArgsConstructor
public class ThresholdStreakStrategy implements StreakStrategy {

    private final ProgressProperties progressProperties;

    @Override
    public StreakMode mode() {
        return StreakMode.THRESHOLD;
    }

    @Override
    public StreakResult compute(List<ExamAttempt> chronological) {
        int longest = 0;
        int run = 0;
        for (ExamAttempt attempt : chronological) {
            if (isSuccess(attempt)) {
                run++;
                longest = Math.max(longest, run);
            } else {
                run = 0;
            }
        }
        // the trailing run is the current streak
        return new StreakResult(run, longest);
    }

    private boolean isSuccess(ExamAttempt attempt) {
        return attempt.getPercentage() >= progressProperties.getPassThreshold();
    }
}
