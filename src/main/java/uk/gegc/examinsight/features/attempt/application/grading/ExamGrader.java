package uk.gegc.examinsight.features.attempt.application.grading;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.examinsight.features.attempt.config.GradingProperties;
import uk.gegc.examinsight.features.attempt.domain.model.AttemptStatus;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.attempt.domain.model.TopicScore;
import uk.gegc.examinsight.features.exam.domain.model.Exam;
import uk.gegc.examinsight.features.exam.domain.model.ExamQuestion;
import uk.gegc.examinsight.shared.exception.ValidationException;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a submission against an exam's answer key. Has no side effects; the caller persists the result.
 */
@Component
@RequiredArgsConstructor
public class ExamGrader {

    private final GradingProperties gradingProperties;
    private final Clock clock;

    public ExamAttempt grade(Exam exam, Map<String, String> answers, int timeSpentSeconds) {
        List<ExamQuestion> questions = exam.getQuestions();
        if (questions == null || questions.isEmpty()) {
            throw new ValidationException("Exam " + exam.getId() + " has no questions to grade");
        }
        if (answers == null) {
            throw new ValidationException("Answers are required");
        }
        if (timeSpentSeconds < 0) {
            throw new ValidationException("timeSpentSeconds must be >= 0");
        }

        int correct = 0;
        Map<String, TopicScore> byTopic = new LinkedHashMap<>();
        for (ExamQuestion question : questions) {
            boolean isCorrect = AnswerChecker.isCorrect(question, answers);
            if (isCorrect) {
                correct++;
            }
            byTopic.merge(question.topic(), TopicScore.EMPTY.record(isCorrect), TopicScore::merge);
        }

        int total = questions.size();
        return ExamAttempt.builder()
                .examId(exam.getId())
                .userId(exam.getUserId())
                .answers(new HashMap<>(answers))
                .score(correct * gradingProperties.getPointsPerQuestion())
                .percentage(100.0 * correct / total)
                .correctCount(correct)
                .incorrectCount(total - correct)
                .totalQuestions(total)
                .timeSpentSeconds(timeSpentSeconds)
                .performanceByTopic(byTopic)
                .status(AttemptStatus.COMPLETED)
                .completedAt(clock.instant())
                .completionKey(ExamAttempt.completionKeyFor(exam.getId(), exam.getUserId()))
                .build();
    }
}
