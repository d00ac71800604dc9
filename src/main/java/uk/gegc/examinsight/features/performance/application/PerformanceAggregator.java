package uk.gegc.examinsight.features.performance.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.examinsight.features.attempt.application.grading.AnswerChecker;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.attempt.domain.model.TopicScore;
import uk.gegc.examinsight.features.exam.domain.model.Exam;
import uk.gegc.examinsight.features.exam.domain.model.ExamQuestion;
import uk.gegc.examinsight.features.exam.domain.model.QuestionDifficulty;
import uk.gegc.examinsight.features.performance.api.dto.*;
import uk.gegc.examinsight.features.performance.config.PerformanceProperties;
import uk.gegc.examinsight.features.progress.application.streak.StreakCalculator;
import uk.gegc.examinsight.features.progress.application.streak.StreakResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Computes the dashboard snapshot from a user's attempts and the exams they reference.
 * <p>
 * The result depends only on the inputs and the clock, so repeated calls over the same history
 * yield equal snapshots. Attempts whose exam is missing still count toward totals, averages and
 * timing, but are skipped by the passes that need question metadata.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class PerformanceAggregator {

    static final String UNKNOWN_TOPIC = "Unknown";
    private static final Duration WEEK = Duration.ofDays(7);

    private final PerformanceProperties performanceProperties;
    private final StreakCalculator streakCalculator;
    private final Clock clock;

    public PerformanceSnapshot aggregate(List<ExamAttempt> attempts, Map<UUID, Exam> exams) {
        List<ExamAttempt> completed = chronological(attempts);
        Map<UUID, Exam> examsById = exams != null ? exams : Map.of();

        int totalExams = completed.size();
        double averageScore = completed.stream().mapToDouble(ExamAttempt::getPercentage).average().orElse(0.0);
        double bestScore = completed.stream().mapToDouble(ExamAttempt::getPercentage).max().orElse(0.0);
        long totalTimeSpent = completed.stream().mapToLong(ExamAttempt::getTimeSpentSeconds).sum();

        StreakResult streak = completed.isEmpty() ? StreakResult.NONE : streakCalculator.compute(completed);

        long xp = completed.stream().mapToLong(ExamAttempt::getCorrectCount).sum()
                * performanceProperties.getXpPerCorrectAnswer();
        int level = (int) (xp / performanceProperties.getXpPerLevel()) + 1;

        List<TopicPerformance> topics = topicPerformance(completed);

        return new PerformanceSnapshot(
                totalExams,
                averageScore,
                bestScore,
                totalTimeSpent,
                streak.current(),
                Math.max(streak.longest(), streak.current()),
                xp,
                level,
                topics,
                difficultyAnalysis(completed, examsById),
                weeklyPerformance(completed),
                timingAnalysis(completed, examsById, totalTimeSpent),
                improvementAreas(topics),
                folderPerformance(completed, examsById),
                scoreTrends(completed, examsById),
                recentAttempts(completed, examsById)
        );
    }

    private List<ExamAttempt> chronological(List<ExamAttempt> attempts) {
        if (attempts == null) {
            return List.of();
        }
        return attempts.stream()
                .filter(ExamAttempt::isCompleted)
                .sorted(Comparator.comparing(ExamAttempt::getCompletedAt,
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                .toList();
    }

    private List<TopicPerformance> topicPerformance(List<ExamAttempt> attempts) {
        Map<String, TopicScore> merged = new TreeMap<>();
        for (ExamAttempt attempt : attempts) {
            if (attempt.getPerformanceByTopic() == null) {
                continue;
            }
            attempt.getPerformanceByTopic().forEach((topic, score) ->
                    merged.merge(topic != null ? topic : UNKNOWN_TOPIC, score, TopicScore::merge));
        }
        return merged.entrySet().stream()
                .map(e -> new TopicPerformance(e.getKey(), e.getValue().correct(), e.getValue().total(),
                        e.getValue().accuracy()))
                .toList();
    }

    private DifficultyBreakdown difficultyAnalysis(List<ExamAttempt> attempts, Map<UUID, Exam> exams) {
        Map<QuestionDifficulty, TopicScore> buckets = new EnumMap<>(QuestionDifficulty.class);
        for (ExamAttempt attempt : attempts) {
            Exam exam = exams.get(attempt.getExamId());
            if (exam == null || exam.getQuestions() == null) {
                continue;
            }
            for (ExamQuestion question : exam.getQuestions()) {
                QuestionDifficulty difficulty = question.difficulty() != null
                        ? question.difficulty()
                        : QuestionDifficulty.MEDIUM;
                boolean correct = AnswerChecker.isCorrect(question, attempt.getAnswers());
                buckets.merge(difficulty, TopicScore.EMPTY.record(correct), TopicScore::merge);
            }
        }
        return new DifficultyBreakdown(
                toDifficultyStats(buckets.get(QuestionDifficulty.EASY)),
                toDifficultyStats(buckets.get(QuestionDifficulty.MEDIUM)),
                toDifficultyStats(buckets.get(QuestionDifficulty.HARD))
        );
    }

    private DifficultyStats toDifficultyStats(TopicScore score) {
        if (score == null) {
            return DifficultyStats.EMPTY;
        }
        return new DifficultyStats(score.correct(), score.total(), score.accuracy());
    }

    private List<WeeklyPerformance> weeklyPerformance(List<ExamAttempt> attempts) {
        int weeks = performanceProperties.getTrendWeeks();
        Instant now = clock.instant();
        List<WeeklyPerformance> result = new ArrayList<>(weeks);
        for (int k = 1; k <= weeks; k++) {
            Instant end = now.minus(WEEK.multipliedBy(weeks - k));
            Instant start = end.minus(WEEK);
            int count = 0;
            double sum = 0.0;
            for (ExamAttempt attempt : attempts) {
                Instant completedAt = attempt.getCompletedAt();
                if (completedAt != null && completedAt.isAfter(start) && !completedAt.isAfter(end)) {
                    count++;
                    sum += attempt.getPercentage();
                }
            }
            result.add(new WeeklyPerformance("Week " + k, start, end, count, count > 0 ? sum / count : 0.0));
        }
        return result;
    }

    private TimingAnalysis timingAnalysis(List<ExamAttempt> attempts, Map<UUID, Exam> exams, long totalTimeSpent) {
        long totalQuestions = attempts.stream().mapToLong(ExamAttempt::getTotalQuestions).sum();
        double averagePerQuestion = totalQuestions > 0 ? (double) totalTimeSpent / totalQuestions : 0.0;

        ExamAttempt fastest = null;
        ExamAttempt slowest = null;
        for (ExamAttempt attempt : attempts) {
            if (fastest == null || attempt.getTimeSpentSeconds() < fastest.getTimeSpentSeconds()) {
                fastest = attempt;
            }
            if (slowest == null || attempt.getTimeSpentSeconds() > slowest.getTimeSpentSeconds()) {
                slowest = attempt;
            }
        }
        return new TimingAnalysis(averagePerQuestion, toTiming(fastest, exams), toTiming(slowest, exams));
    }

    private ExamTiming toTiming(ExamAttempt attempt, Map<UUID, Exam> exams) {
        if (attempt == null) {
            return null;
        }
        return new ExamTiming(attempt.getId(), attempt.getExamId(), displayName(attempt, exams),
                attempt.getTimeSpentSeconds(), attempt.getCompletedAt());
    }

    private List<TopicPerformance> improvementAreas(List<TopicPerformance> topics) {
        return topics.stream()
                .filter(t -> t.total() >= performanceProperties.getImprovementMinSamples())
                .filter(t -> t.accuracy() < performanceProperties.getImprovementThreshold())
                .sorted(Comparator.comparingDouble(TopicPerformance::accuracy)
                        .thenComparing(TopicPerformance::topic))
                .limit(performanceProperties.getMaxImprovementAreas())
                .toList();
    }

    private List<FolderPerformance> folderPerformance(List<ExamAttempt> attempts, Map<UUID, Exam> exams) {
        Map<String, List<ExamAttempt>> byFolder = new LinkedHashMap<>();
        for (ExamAttempt attempt : attempts) {
            Exam exam = exams.get(attempt.getExamId());
            if (exam == null) {
                continue;
            }
            byFolder.computeIfAbsent(exam.getDisplayName(), key -> new ArrayList<>()).add(attempt);
        }

        List<FolderPerformance> result = new ArrayList<>(byFolder.size());
        byFolder.forEach((folder, folderAttempts) -> {
            double average = folderAttempts.stream().mapToDouble(ExamAttempt::getPercentage).average().orElse(0.0);
            double best = folderAttempts.stream().mapToDouble(ExamAttempt::getPercentage).max().orElse(0.0);
            long time = folderAttempts.stream().mapToLong(ExamAttempt::getTimeSpentSeconds).sum();
            int questions = folderAttempts.stream().mapToInt(ExamAttempt::getTotalQuestions).sum();
            result.add(new FolderPerformance(folder, folderAttempts.size(), average, best,
                    questions > 0 ? (double) time / questions : 0.0, questions));
        });
        return result;
    }

    private List<ScoreTrendPoint> scoreTrends(List<ExamAttempt> attempts, Map<UUID, Exam> exams) {
        return attempts.stream()
                .map(a -> new ScoreTrendPoint(a.getCompletedAt(), a.getPercentage(), displayName(a, exams)))
                .toList();
    }

    private List<RecentAttempt> recentAttempts(List<ExamAttempt> attempts, Map<UUID, Exam> exams) {
        List<RecentAttempt> result = new ArrayList<>();
        int limit = performanceProperties.getRecentAttemptsLimit();
        for (int i = attempts.size() - 1; i >= 0 && result.size() < limit; i--) {
            ExamAttempt attempt = attempts.get(i);
            Exam exam = exams.get(attempt.getExamId());
            result.add(new RecentAttempt(
                    attempt.getId(),
                    attempt.getExamId(),
                    exam != null ? exam.getDisplayName() : null,
                    exam != null ? exam.getQuestionCount() : attempt.getTotalQuestions(),
                    attempt.getScore(),
                    attempt.getPercentage(),
                    attempt.getTimeSpentSeconds(),
                    attempt.getCompletedAt()
            ));
        }
        return result;
    }

    private String displayName(ExamAttempt attempt, Map<UUID, Exam> exams) {
        Exam exam = exams.get(attempt.getExamId());
        return exam != null ? exam.getDisplayName() : null;
    }
}
