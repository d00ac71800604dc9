package uk.gegc.examinsight.features.exam.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.examinsight.features.exam.api.dto.CreateExamRequest;
import uk.gegc.examinsight.features.exam.api.dto.ExamDto;
import uk.gegc.examinsight.features.exam.api.dto.ExamSummaryDto;
import uk.gegc.examinsight.features.exam.application.ExamService;
import uk.gegc.examinsight.features.exam.application.validation.ExamStructureValidator;
import uk.gegc.examinsight.features.exam.domain.model.Exam;
import uk.gegc.examinsight.features.exam.domain.model.ExamDifficulty;
import uk.gegc.examinsight.features.exam.domain.model.ExamQuestion;
import uk.gegc.examinsight.features.exam.domain.repository.ExamRepository;
import uk.gegc.examinsight.features.exam.infra.mapping.ExamMapper;
import uk.gegc.examinsight.shared.exception.ForbiddenException;
import uk.gegc.examinsight.shared.exception.ResourceNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class ExamServiceImpl implements ExamService {

    private final ExamRepository examRepository;
    private final ExamStructureValidator examStructureValidator;
    private final ExamMapper examMapper;

    @Override
    public ExamDto createExam(UUID userId, CreateExamRequest request) {
        List<ExamQuestion> questions = examStructureValidator.validateAndNormalize(request.questions());

        Exam exam = new Exam();
        exam.setUserId(userId);
        exam.setTitle(request.title().trim());
        exam.setFolderId(request.folderId());
        exam.setFolderName(request.folderName());
        exam.setQuestions(new ArrayList<>(questions));
        exam.setQuestionCount(questions.size());
        exam.setDifficulty(request.difficulty() != null ? request.difficulty() : ExamDifficulty.MIXED);
        exam.setSourceNoteIds(request.sourceNoteIds() != null ? new ArrayList<>(request.sourceNoteIds()) : new ArrayList<>());
        exam.setExpiresAt(request.expiresAt());
        exam.setActive(true);

        Exam saved = examRepository.save(exam);
        log.info("Created exam {} with {} questions for user {}", saved.getId(), saved.getQuestionCount(), userId);
        return examMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public ExamDto getExamForTaking(UUID userId, UUID examId) {
        Exam exam = examRepository.findById(examId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam " + examId + " not found"));
        if (!exam.isOwnedBy(userId)) {
            throw new ForbiddenException("You do not have access to exam " + examId);
        }
        return examMapper.toDto(exam);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ExamSummaryDto> listActiveExams(UUID userId, Pageable pageable) {
        return examRepository.findByUserIdAndActiveTrue(userId, pageable)
                .map(examMapper::toSummaryDto);
    }
}
