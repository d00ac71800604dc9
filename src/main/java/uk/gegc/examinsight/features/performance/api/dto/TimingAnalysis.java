package uk.gegc.examinsight.features.performance.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "TimingAnalysis")
public record TimingAnalysis(
        @Schema(description = "Total seconds over total questions", example = "42.5") double averageTimePerQuestion,
        @Schema(description = "Attempt with the least time spent, null without attempts") ExamTiming fastestExam,
        @Schema(description = "Attempt with the most time spent, null without attempts") ExamTiming slowestExam
) {
}
