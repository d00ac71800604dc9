package uk.gegc.examinsight.features.performance.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Dashboard read model recomputed from a user's completed attempts on every read.
 */
@Schema(name = "PerformanceSnapshot", description = "Aggregated statistics over all completed attempts")
public record PerformanceSnapshot(
        @Schema(example = "12") int totalExams,
        @Schema(description = "Mean percentage", example = "74.2") double averageScore,
        @Schema(description = "Highest percentage", example = "100.0") double bestScore,
        @Schema(description = "Seconds across all attempts", example = "5400") long totalTimeSpent,
        @Schema(example = "3") int currentStreak,
        @Schema(example = "5") int longestStreak,
        @Schema(example = "870") long xp,
        @Schema(example = "1") int level,
        List<TopicPerformance> topicPerformance,
        DifficultyBreakdown difficultyAnalysis,
        List<WeeklyPerformance> weeklyPerformance,
        TimingAnalysis timeAnalysis,
        @Schema(description = "Weakest topics with enough samples, weakest first") List<TopicPerformance> improvementAreas,
        List<FolderPerformance> folderPerformance,
        List<ScoreTrendPoint> scoreTrends,
        @Schema(description = "Most recent attempts, newest first") List<RecentAttempt> recentAttempts
) {
}
