package uk.gegc.examinsight.features.exam.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.examinsight.features.exam.api.dto.CreateExamRequest;
import uk.gegc.examinsight.features.exam.api.dto.ExamDto;
import uk.gegc.examinsight.features.exam.api.dto.ExamSummaryDto;

import java.util.UUID;

public interface ExamService {

    /**
     * Stores an exam produced by the generation step after checking its structure.
     */
    ExamDto createExam(UUID userId, CreateExamRequest request);

    /**
     * Returns the exam for taking, without correct answers or explanations.
     */
    ExamDto getExamForTaking(UUID userId, UUID examId);

    Page<ExamSummaryDto> listActiveExams(UUID userId, Pageable pageable);
}
