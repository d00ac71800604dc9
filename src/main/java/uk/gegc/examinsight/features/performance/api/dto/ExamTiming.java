package uk.gegc.examinsight.features.performance.api.dto;

import java.time.Instant;
import java.util.UUID;

public record ExamTiming(UUID attemptId, UUID examId, String examName, int timeSpentSeconds, Instant completedAt) {
}
