package uk.gegc.examinsight.features.attempt.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.examinsight.features.attempt.api.dto.AttemptResultDto;
import uk.gegc.examinsight.features.attempt.api.dto.AttemptSummaryDto;
import uk.gegc.examinsight.features.attempt.api.dto.SubmitAttemptRequest;
import uk.gegc.examinsight.features.attempt.application.AttemptMetrics;
import uk.gegc.examinsight.features.attempt.application.AttemptService;
import uk.gegc.examinsight.features.attempt.application.grading.ExamGrader;
import uk.gegc.examinsight.features.attempt.domain.model.AttemptStatus;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.attempt.domain.repository.ExamAttemptRepository;
import uk.gegc.examinsight.features.attempt.infra.mapping.AttemptMapper;
import uk.gegc.examinsight.features.exam.domain.model.Exam;
import uk.gegc.examinsight.features.exam.domain.repository.ExamRepository;
import uk.gegc.examinsight.features.progress.api.dto.AchievementDto;
import uk.gegc.examinsight.features.progress.application.AchievementService;
import uk.gegc.examinsight.features.progress.application.ProgressEvaluation;
import uk.gegc.examinsight.features.progress.application.ProgressEvaluator;
import uk.gegc.examinsight.shared.exception.AttemptAlreadyCompletedException;
import uk.gegc.examinsight.shared.exception.ForbiddenException;
import uk.gegc.examinsight.shared.exception.ResourceNotFoundException;
import uk.gegc.examinsight.shared.exception.ValidationException;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class AttemptServiceImpl implements AttemptService {

    private final ExamRepository examRepository;
    private final ExamAttemptRepository attemptRepository;
    private final ExamGrader examGrader;
    private final ProgressEvaluator progressEvaluator;
    private final AchievementService achievementService;
    private final AttemptMapper attemptMapper;
    private final AttemptMetrics attemptMetrics;
    private final Clock clock;

    @Override
    public AttemptResultDto submitAttempt(UUID userId, UUID examId, SubmitAttemptRequest request) {
        Exam exam = examRepository.findById(examId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam " + examId + " not found"));
        if (!exam.isOwnedBy(userId)) {
            throw new ForbiddenException("You do not have access to exam " + examId);
        }
        if (!exam.isOpenForSubmission(clock.instant())) {
            attemptMetrics.incrementRejected(AttemptMetrics.REASON_EXAM_CLOSED);
            throw new ValidationException("Exam " + examId + " is no longer accepting submissions");
        }
        if (attemptRepository.existsByExamIdAndUserIdAndStatus(examId, userId, AttemptStatus.COMPLETED)) {
            attemptMetrics.incrementRejected(AttemptMetrics.REASON_ALREADY_COMPLETED);
            throw new AttemptAlreadyCompletedException(examId, userId);
        }

        ExamAttempt graded = examGrader.grade(exam, request.answers(), request.timeSpentSeconds());

        ExamAttempt saved;
        try {
            saved = attemptRepository.saveAndFlush(graded);
        } catch (DataIntegrityViolationException e) {
            // a concurrent submission won the completion_key unique index
            log.warn("Concurrent completion of exam {} by user {} rejected", examId, userId);
            attemptMetrics.incrementRejected(AttemptMetrics.REASON_ALREADY_COMPLETED);
            throw new AttemptAlreadyCompletedException(examId, userId);
        }
        attemptMetrics.incrementGraded(saved.getPercentage());
        log.info("User {} completed exam {}: {}/{} correct ({}%)",
                userId, examId, saved.getCorrectCount(), saved.getTotalQuestions(), saved.getPercentage());

        List<ExamAttempt> history =
                attemptRepository.findByUserIdAndStatusOrderByCompletedAtAsc(userId, AttemptStatus.COMPLETED);
        ProgressEvaluation progress = progressEvaluator.evaluateProgress(history, saved, 0);
        List<AchievementDto> achievements = achievementService.recordAll(userId, examId, progress.achievements());

        return attemptMapper.toResultDto(saved, exam, progress, achievements);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<AttemptSummaryDto> listCompletedAttempts(UUID userId, Pageable pageable) {
        return attemptRepository.findByUserIdAndStatus(userId, AttemptStatus.COMPLETED, pageable)
                .map(attemptMapper::toSummaryDto);
    }
}
