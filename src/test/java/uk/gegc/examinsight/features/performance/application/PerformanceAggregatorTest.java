package uk.gegc.examinsight.features.performance.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.examinsight.features.attempt.domain.model.AttemptStatus;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.attempt.domain.model.TopicScore;
import uk.gegc.examinsight.features.exam.domain.model.Exam;
import uk.gegc.examinsight.features.exam.domain.model.QuestionDifficulty;
import uk.gegc.examinsight.features.performance.api.dto.PerformanceSnapshot;
import uk.gegc.examinsight.features.performance.api.dto.TopicPerformance;
import uk.gegc.examinsight.features.performance.api.dto.WeeklyPerformance;
import uk.gegc.examinsight.features.performance.config.PerformanceProperties;
import uk.gegc.examinsight.features.progress.application.streak.CalendarStreakStrategy;
import uk.gegc.examinsight.features.progress.application.streak.StreakCalculator;
import uk.gegc.examinsight.features.progress.application.streak.ThresholdStreakStrategy;
import uk.gegc.examinsight.features.progress.config.ProgressProperties;
import uk.gegc.examinsight.support.ExamTestData;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PerformanceAggregator")
class PerformanceAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-07-01T12:00:00Z");

    private PerformanceAggregator aggregator;
    private UUID userId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ProgressProperties progressProperties = new ProgressProperties();
        StreakCalculator streakCalculator = new StreakCalculator(progressProperties,
                List.of(new ThresholdStreakStrategy(progressProperties), new CalendarStreakStrategy(clock)));
        aggregator = new PerformanceAggregator(new PerformanceProperties(), streakCalculator, clock);
        userId = UUID.randomUUID();
    }

    @Test
    @DisplayName("aggregate: empty history yields zeroed snapshot with eight empty weeks")
    void emptyHistory() {
        PerformanceSnapshot snapshot = aggregator.aggregate(List.of(), Map.of());

        assertThat(snapshot.totalExams()).isZero();
        assertThat(snapshot.averageScore()).isZero();
        assertThat(snapshot.level()).isEqualTo(1);
        assertThat(snapshot.weeklyPerformance()).hasSize(8)
                .allSatisfy(week -> {
                    assertThat(week.exams()).isZero();
                    assertThat(week.averageScore()).isZero();
                });
        assertThat(snapshot.timeAnalysis().fastestExam()).isNull();
        assertThat(snapshot.difficultyAnalysis().easy().total()).isZero();
        assertThat(snapshot.recentAttempts()).isEmpty();
    }

    @Test
    @DisplayName("aggregate: topic accuracy comes from merged counts, not averaged percentages")
    void mergedTopicAccuracy() {
        // Given five recursion attempts at 40, 50, 60, 80 and 90 percent with uneven sizes
        List<ExamAttempt> attempts = new ArrayList<>();
        int[][] counts = {{2, 5}, {1, 2}, {3, 5}, {4, 5}, {9, 10}};
        for (int i = 0; i < counts.length; i++) {
            attempts.add(ExamTestData.attempt(userId, UUID.randomUUID(), counts[i][0], counts[i][1], 100,
                    NOW.minus(Duration.ofDays(5 - i)), Map.of("recursion", new TopicScore(counts[i][0], counts[i][1]))));
        }

        // When
        PerformanceSnapshot snapshot = aggregator.aggregate(attempts, Map.of());

        // Then 19 / 27 = 70.37%
        TopicPerformance recursion = snapshot.topicPerformance().get(0);
        assertThat(recursion.correct()).isEqualTo(19);
        assertThat(recursion.total()).isEqualTo(27);
        assertThat(recursion.accuracy()).isCloseTo(100.0 * 19 / 27, within(1e-9));
        assertThat(snapshot.improvementAreas()).isEmpty();
    }

    @Test
    @DisplayName("aggregate: weak topic with enough samples is an improvement area")
    void improvementArea() {
        List<ExamAttempt> attempts = List.of(
                ExamTestData.attempt(userId, UUID.randomUUID(), 1, 3, 60, NOW.minusSeconds(100),
                        Map.of("graphs", new TopicScore(1, 3))),
                ExamTestData.attempt(userId, UUID.randomUUID(), 0, 2, 60, NOW.minusSeconds(50),
                        Map.of("sorting", new TopicScore(0, 2))));

        PerformanceSnapshot snapshot = aggregator.aggregate(attempts, Map.of());

        assertThat(snapshot.improvementAreas()).extracting(TopicPerformance::topic).containsExactly("graphs");
    }

    @Test
    @DisplayName("aggregate: improvement areas are capped at five, weakest first")
    void improvementAreasCapped() {
        List<ExamAttempt> attempts = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            attempts.add(ExamTestData.attempt(userId, UUID.randomUUID(), i, 10, 60, NOW.minusSeconds(1000 - i),
                    Map.of("topic" + i, new TopicScore(i, 10))));
        }

        PerformanceSnapshot snapshot = aggregator.aggregate(attempts, Map.of());

        assertThat(snapshot.improvementAreas()).extracting(TopicPerformance::topic)
                .containsExactly("topic0", "topic1", "topic2", "topic3", "topic4");
    }

    @Test
    @DisplayName("aggregate: totals, xp, level and timing")
    void totalsAndTiming() {
        List<ExamAttempt> attempts = List.of(
                ExamTestData.attempt(userId, UUID.randomUUID(), 10, 10, 300, NOW.minusSeconds(300)),
                ExamTestData.attempt(userId, UUID.randomUUID(), 5, 10, 100, NOW.minusSeconds(200)),
                ExamTestData.attempt(userId, UUID.randomUUID(), 0, 10, 100, NOW.minusSeconds(100)));

        PerformanceSnapshot snapshot = aggregator.aggregate(attempts, Map.of());

        assertThat(snapshot.totalExams()).isEqualTo(3);
        assertThat(snapshot.averageScore()).isEqualTo(50.0);
        assertThat(snapshot.bestScore()).isEqualTo(100.0);
        assertThat(snapshot.totalTimeSpent()).isEqualTo(500);
        assertThat(snapshot.xp()).isEqualTo(150);
        assertThat(snapshot.level()).isEqualTo(1);
        assertThat(snapshot.timeAnalysis().averageTimePerQuestion()).isCloseTo(500.0 / 30, within(1e-9));
        assertThat(snapshot.timeAnalysis().fastestExam().attemptId()).isEqualTo(attempts.get(1).getId());
        assertThat(snapshot.timeAnalysis().slowestExam().attemptId()).isEqualTo(attempts.get(0).getId());
        assertThat(snapshot.currentStreak()).isZero();
        assertThat(snapshot.longestStreak()).isEqualTo(1);
    }

    @Test
    @DisplayName("aggregate: level rises every 1000 xp")
    void levelUp() {
        List<ExamAttempt> attempts = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            attempts.add(ExamTestData.attempt(userId, UUID.randomUUID(), 10, 10, 60, NOW.minusSeconds(100L * (11 - i))));
        }

        PerformanceSnapshot snapshot = aggregator.aggregate(attempts, Map.of());

        assertThat(snapshot.xp()).isEqualTo(1100);
        assertThat(snapshot.level()).isEqualTo(2);
        assertThat(snapshot.recentAttempts()).hasSize(10);
        assertThat(snapshot.recentAttempts().get(0).attemptId()).isEqualTo(attempts.get(10).getId());
    }

    @Test
    @DisplayName("aggregate: weekly windows are oldest first and the last one ends now")
    void weeklyWindows() {
        List<ExamAttempt> attempts = List.of(
                ExamTestData.attempt(userId, UUID.randomUUID(), 6, 10, 60, NOW.minus(Duration.ofDays(1))),
                ExamTestData.attempt(userId, UUID.randomUUID(), 8, 10, 60, NOW),
                ExamTestData.attempt(userId, UUID.randomUUID(), 4, 10, 60, NOW.minus(Duration.ofDays(50))),
                ExamTestData.attempt(userId, UUID.randomUUID(), 9, 10, 60, NOW.minus(Duration.ofDays(70))));

        List<WeeklyPerformance> weeks = aggregator.aggregate(attempts, Map.of()).weeklyPerformance();

        assertThat(weeks).extracting(WeeklyPerformance::week)
                .containsExactly("Week 1", "Week 2", "Week 3", "Week 4", "Week 5", "Week 6", "Week 7", "Week 8");
        assertThat(weeks.get(7).windowEnd()).isEqualTo(NOW);
        assertThat(weeks.get(7).exams()).isEqualTo(2);
        assertThat(weeks.get(7).averageScore()).isEqualTo(70.0);
        assertThat(weeks.get(0).exams()).isEqualTo(1);
        assertThat(weeks.get(0).averageScore()).isEqualTo(40.0);
        assertThat(weeks.subList(1, 7)).allSatisfy(week -> assertThat(week.averageScore()).isZero());
    }

    @Test
    @DisplayName("aggregate: difficulty is re-derived from stored answers; deleted exams are skipped")
    void difficultyAndMissingExam() {
        // Given
        Exam exam = ExamTestData.exam(userId, List.of(
                ExamTestData.question("q1", "A", "math", QuestionDifficulty.EASY),
                ExamTestData.question("q2", "B", "math", QuestionDifficulty.HARD),
                ExamTestData.question("q3", "C", "math", null)));
        exam.setFolderName("Algebra");
        ExamAttempt graded = ExamAttempt.builder()
                .id(UUID.randomUUID())
                .examId(exam.getId())
                .userId(userId)
                .answers(Map.of("q1", "A", "q2", "A", "q3", "C"))
                .score(10)
                .percentage(200.0 / 3)
                .correctCount(2)
                .incorrectCount(1)
                .totalQuestions(3)
                .timeSpentSeconds(90)
                .performanceByTopic(Map.of("math", new TopicScore(2, 3)))
                .status(AttemptStatus.COMPLETED)
                .completedAt(NOW.minusSeconds(500))
                .build();
        ExamAttempt orphan = ExamTestData.attempt(userId, UUID.randomUUID(), 4, 4, 40, NOW.minusSeconds(100));

        // When
        PerformanceSnapshot snapshot = aggregator.aggregate(List.of(graded, orphan), Map.of(exam.getId(), exam));

        // Then
        assertThat(snapshot.totalExams()).isEqualTo(2);
        assertThat(snapshot.difficultyAnalysis().easy().correct()).isEqualTo(1);
        assertThat(snapshot.difficultyAnalysis().easy().total()).isEqualTo(1);
        assertThat(snapshot.difficultyAnalysis().hard().correct()).isZero();
        assertThat(snapshot.difficultyAnalysis().hard().total()).isEqualTo(1);
        assertThat(snapshot.difficultyAnalysis().medium().total()).isEqualTo(1);
        assertThat(snapshot.folderPerformance()).hasSize(1);
        assertThat(snapshot.folderPerformance().get(0).folder()).isEqualTo("Algebra");
        assertThat(snapshot.folderPerformance().get(0).attempts()).isEqualTo(1);
        assertThat(snapshot.recentAttempts().get(0).examName()).isNull();
        assertThat(snapshot.recentAttempts().get(1).examName()).isEqualTo("Algebra");
        assertThat(snapshot.scoreTrends()).hasSize(2);
    }

    @Test
    @DisplayName("aggregate: in-progress attempts are ignored")
    void ignoresInProgress() {
        ExamAttempt inProgress = ExamAttempt.builder()
                .id(UUID.randomUUID())
                .examId(UUID.randomUUID())
                .userId(userId)
                .answers(Map.of())
                .performanceByTopic(Map.of())
                .status(AttemptStatus.IN_PROGRESS)
                .build();

        assertThat(aggregator.aggregate(List.of(inProgress), Map.of()).totalExams()).isZero();
    }

    @Test
    @DisplayName("aggregate: same history gives equal snapshots")
    void idempotent() {
        List<ExamAttempt> attempts = ExamTestData.attemptsWithScores(userId, NOW.minusSeconds(10), 3, 7, 9, 10, 6);

        assertThat(aggregator.aggregate(attempts, Map.of())).isEqualTo(aggregator.aggregate(attempts, Map.of()));
    }
}
