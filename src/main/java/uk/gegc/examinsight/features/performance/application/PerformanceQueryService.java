package uk.gegc.examinsight.features.performance.application;

import uk.gegc.examinsight.features.attempt.api.dto.AttemptReviewDto;
import uk.gegc.examinsight.features.performance.api.dto.PerformanceSnapshot;

import java.util.UUID;

/**
 * Read side for dashboards: loads stored attempts and exams and hands them to {@link PerformanceAggregator}.
 */
public interface PerformanceQueryService {

    PerformanceSnapshot getUserPerformance(UUID userId);

    /**
     * Per-question review of one of the caller's completed attempts, including answer keys and explanations.
     *
     * @throws uk.gegc.examinsight.shared.exception.ResourceNotFoundException   if the attempt or its exam is missing
     * @throws uk.gegc.examinsight.shared.exception.ForbiddenException          if the attempt belongs to another user
     * @throws uk.gegc.examinsight.shared.exception.AttemptNotCompletedException if the attempt is still in progress
     */
    AttemptReviewDto getAttemptReview(UUID attemptId, UUID userId);
}
