package uk.gegc.examinsight.features.attempt.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.examinsight.features.attempt.api.dto.AttemptResultDto;
import uk.gegc.examinsight.features.attempt.api.dto.AttemptReviewDto;
import uk.gegc.examinsight.features.attempt.api.dto.AttemptSummaryDto;
import uk.gegc.examinsight.features.attempt.api.dto.QuestionReviewDto;
import uk.gegc.examinsight.features.attempt.application.grading.AnswerChecker;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.exam.domain.model.Exam;
import uk.gegc.examinsight.features.exam.domain.model.ExamQuestion;
import uk.gegc.examinsight.features.progress.api.dto.AchievementDto;
import uk.gegc.examinsight.features.progress.application.ProgressEvaluation;

import java.util.List;
import java.util.Map;

@Component
public class AttemptMapper {

    public AttemptSummaryDto toSummaryDto(ExamAttempt attempt) {
        return new AttemptSummaryDto(
                attempt.getId(),
                attempt.getExamId(),
                attempt.getScore(),
                attempt.getPercentage(),
                attempt.getCorrectCount(),
                attempt.getTotalQuestions(),
                attempt.getTimeSpentSeconds(),
                attempt.getCompletedAt()
        );
    }

    public AttemptResultDto toResultDto(ExamAttempt attempt,
                                        Exam exam,
                                        ProgressEvaluation progress,
                                        List<AchievementDto> achievements) {
        return new AttemptResultDto(
                attempt.getId(),
                attempt.getExamId(),
                attempt.getScore(),
                attempt.getPercentage(),
                attempt.getCorrectCount(),
                attempt.getIncorrectCount(),
                attempt.getTotalQuestions(),
                attempt.getTimeSpentSeconds(),
                attempt.getPerformanceByTopic(),
                attempt.getStatus(),
                attempt.getCompletedAt(),
                progress.currentStreak(),
                progress.longestStreak(),
                achievements,
                toQuestionReviews(exam, attempt.getAnswers())
        );
    }

    public AttemptReviewDto toReviewDto(ExamAttempt attempt, Exam exam) {
        return new AttemptReviewDto(
                attempt.getId(),
                attempt.getExamId(),
                exam.getTitle(),
                attempt.getScore(),
                attempt.getPercentage(),
                attempt.getCorrectCount(),
                attempt.getIncorrectCount(),
                attempt.getTimeSpentSeconds(),
                attempt.getCompletedAt(),
                toQuestionReviews(exam, attempt.getAnswers())
        );
    }

    private List<QuestionReviewDto> toQuestionReviews(Exam exam, Map<String, String> answers) {
        return exam.getQuestions().stream()
                .map(question -> toQuestionReview(question, answers))
                .toList();
    }

    private QuestionReviewDto toQuestionReview(ExamQuestion question, Map<String, String> answers) {
        return new QuestionReviewDto(
                question.id(),
                question.text(),
                question.options(),
                answers != null ? answers.get(question.id()) : null,
                AnswerChecker.isCorrect(question, answers),
                question.correctAnswer(),
                question.explanation(),
                question.topic(),
                question.difficulty()
        );
    }
}
