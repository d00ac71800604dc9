package uk.gegc.examinsight.features.progress.application.streak;

import org.springframework.stereotype.Component;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.progress.config.ProgressProperties;
import uk.gegc.examinsight.features.progress.config.ProgressProperties.StreakMode;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Delegates to the streak strategy selected by {@code examinsight.progress.streak-mode}.
 */
@Component
public class StreakCalculator {

    private final ProgressProperties progressProperties;
    private final Map<StreakMode, StreakStrategy> strategies = new EnumMap<>(StreakMode.class);

    public StreakCalculator(ProgressProperties progressProperties, List<StreakStrategy> strategies) {
        this.progressProperties = progressProperties;
        for (StreakStrategy strategy : strategies) {
            this.strategies.put(strategy.mode(), strategy);
        }
    }

    public StreakResult compute(List<ExamAttempt> chronological) {
        StreakMode mode = progressProperties.getStreakMode();
        StreakStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new IllegalStateException("No streak strategy registered for mode " + mode);
        }
        return strategy.compute(chronological);
    }
}
