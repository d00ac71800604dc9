package uk.gegc.examinsight.features.exam.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.examinsight.features.exam.api.dto.ExamDto;
import uk.gegc.examinsight.features.exam.api.dto.ExamQuestionDto;
import uk.gegc.examinsight.features.exam.api.dto.ExamSummaryDto;
import uk.gegc.examinsight.features.exam.domain.model.Exam;
import uk.gegc.examinsight.features.exam.domain.model.ExamQuestion;

@Component
public class ExamMapper {

    public ExamDto toDto(Exam exam) {
        return new ExamDto(
                exam.getId(),
                exam.getTitle(),
                exam.getFolderId(),
                exam.getFolderName(),
                exam.getDifficulty(),
                exam.getQuestionCount(),
                exam.isActive(),
                exam.getCreatedAt(),
                exam.getExpiresAt(),
                exam.getQuestions().stream()
                        .map(this::toQuestionDto)
                        .toList()
        );
    }

    public ExamSummaryDto toSummaryDto(Exam exam) {
        return new ExamSummaryDto(
                exam.getId(),
                exam.getTitle(),
                exam.getFolderName(),
                exam.getQuestionCount(),
                exam.getDifficulty(),
                exam.getCreatedAt()
        );
    }

    private ExamQuestionDto toQuestionDto(ExamQuestion question) {
        return new ExamQuestionDto(
                question.id(),
                question.text(),
                question.options(),
                question.topic(),
                question.difficulty(),
                question.sourceReference()
        );
    }
}
