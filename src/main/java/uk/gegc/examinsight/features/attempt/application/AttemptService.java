package uk.gegc.examinsight.features.attempt.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.examinsight.features.attempt.api.dto.AttemptResultDto;
import uk.gegc.examinsight.features.attempt.api.dto.AttemptSummaryDto;
import uk.gegc.examinsight.features.attempt.api.dto.SubmitAttemptRequest;

import java.util.UUID;

public interface AttemptService {

    /**
     * Grades a submission, stores the attempt, evaluates streaks and records achievements.
     *
     * @throws uk.gegc.examinsight.shared.exception.ResourceNotFoundException         if the exam does not exist
     * @throws uk.gegc.examinsight.shared.exception.ForbiddenException                if the exam belongs to another user
     * @throws uk.gegc.examinsight.shared.exception.ValidationException               if the exam is closed or the input is malformed
     * @throws uk.gegc.examinsight.shared.exception.AttemptAlreadyCompletedException if the user already completed the exam
     */
    AttemptResultDto submitAttempt(UUID userId, UUID examId, SubmitAttemptRequest request);

    Page<AttemptSummaryDto> listCompletedAttempts(UUID userId, Pageable pageable);
}
