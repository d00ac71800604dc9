package uk.gegc.examinsight.features.progress.application.streak;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.progress.config.ProgressProperties.StreakMode;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Streak of consecutive calendar days with at least one completed attempt.
 * The current streak is zero unless the user has an attempt today, in the clock's zone.
 */
@Component
@RequiredArgsConstructor
public class CalendarStreakStrategy implements StreakStrategy {

    private final Clock clock;

    @Override
    public StreakMode mode() {
        return StreakMode.CALENDAR;
    }

    @Override
    public StreakResult compute(List<ExamAttempt> chronological) {
        ZoneId zone = clock.getZone();
        TreeSet<LocalDate> days = chronological.stream()
                .map(ExamAttempt::getCompletedAt)
                .filter(Objects::nonNull)
                .map(instant -> instant.atZone(zone).toLocalDate())
                .collect(TreeSet::new, TreeSet::add, TreeSet::addAll);
        if (days.isEmpty()) {
            return StreakResult.NONE;
        }

        int current = 0;
        LocalDate cursor = LocalDate.now(clock);
        while (days.contains(cursor)) {
            current++;
            cursor = cursor.minusDays(1);
        }

        int longest = 0;
        int run = 0;
        LocalDate previous = null;
        for (LocalDate day : days) {
            run = previous != null && previous.plusDays(1).equals(day) ? run + 1 : 1;
            longest = Math.max(longest, run);
            previous = day;
        }
        return new StreakResult(current, longest);
    }
}
