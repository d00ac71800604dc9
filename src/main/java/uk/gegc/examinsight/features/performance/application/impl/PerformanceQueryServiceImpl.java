package uk.gegc.examinsight.features.performance.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.examinsight.features.attempt.api.dto.AttemptReviewDto;
import uk.gegc.examinsight.features.attempt.domain.model.AttemptStatus;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.attempt.domain.repository.ExamAttemptRepository;
import uk.gegc.examinsight.features.attempt.infra.mapping.AttemptMapper;
import uk.gegc.examinsight.features.exam.domain.model.Exam;
import uk.gegc.examinsight.features.exam.domain.repository.ExamRepository;
import uk.gegc.examinsight.features.performance.api.dto.PerformanceSnapshot;
import uk.gegc.examinsight.features.performance.application.PerformanceAggregator;
import uk.gegc.examinsight.features.performance.application.PerformanceQueryService;
import uk.gegc.examinsight.shared.exception.AttemptNotCompletedException;
import uk.gegc.examinsight.shared.exception.ForbiddenException;
import uk.gegc.examinsight.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class PerformanceQueryServiceImpl implements PerformanceQueryService {

    private final ExamAttemptRepository attemptRepository;
    private final ExamRepository examRepository;
    private final PerformanceAggregator performanceAggregator;
    private final AttemptMapper attemptMapper;

    @Override
    public PerformanceSnapshot getUserPerformance(UUID userId) {
        List<ExamAttempt> attempts =
                attemptRepository.findByUserIdAndStatusOrderByCompletedAtAsc(userId, AttemptStatus.COMPLETED);
        Set<UUID> examIds = attempts.stream().map(ExamAttempt::getExamId).collect(Collectors.toSet());
        Map<UUID, Exam> exams = examRepository.findAllById(examIds).stream()
                .collect(Collectors.toMap(Exam::getId, Function.identity()));
        if (exams.size() < examIds.size()) {
            log.debug("User {} has attempts for {} exam(s) that no longer exist", userId, examIds.size() - exams.size());
        }
        return performanceAggregator.aggregate(attempts, exams);
    }

    @Override
    public AttemptReviewDto getAttemptReview(UUID attemptId, UUID userId) {
        ExamAttempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt " + attemptId + " not found"));
        if (!attempt.getUserId().equals(userId)) {
            throw new ForbiddenException("You do not have access to attempt " + attemptId);
        }
        if (!attempt.isCompleted()) {
            throw new AttemptNotCompletedException(attemptId);
        }
        Exam exam = examRepository.findById(attempt.getExamId())
                .orElseThrow(() -> new ResourceNotFoundException("Exam " + attempt.getExamId() + " not found"));
        return attemptMapper.toReviewDto(attempt, exam);
    }
}
