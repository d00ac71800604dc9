package uk.gegc.examinsight.support;

import uk.gegc.examinsight.features.attempt.domain.model.AttemptStatus;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;
import uk.gegc.examinsight.features.attempt.domain.model.TopicScore;
import uk.gegc.examinsight.features.exam.domain.model.Exam;
import uk.gegc.examinsight.features.exam.domain.model.ExamQuestion;
import uk.gegc.examinsight.features.exam.domain.model.QuestionDifficulty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builders for exams and attempts shared by unit tests.
 */
public final class ExamTestData {

    public static final Map<String, String> OPTIONS = Map.of("A", "first", "B", "second", "C", "third", "D", "fourth");

    private ExamTestData() {
    }

    public static ExamQuestion question(String id, String correctAnswer, String topic, QuestionDifficulty difficulty) {
        return new ExamQuestion(id, "Question " + id, OPTIONS, correctAnswer, "Because " + correctAnswer,
                topic, difficulty, "Note 1");
    }

    public static ExamQuestion question(String id, String topic) {
        return question(id, "A", topic, QuestionDifficulty.MEDIUM);
    }

    public static Exam exam(UUID userId, List<ExamQuestion> questions) {
        Exam exam = new Exam();
        exam.setId(UUID.randomUUID());
        exam.setUserId(userId);
        exam.setTitle("Exam");
        exam.setQuestions(new ArrayList<>(questions));
        exam.setQuestionCount(questions.size());
        return exam;
    }

    /**
     * A completed attempt with {@code correct} of {@code total} right, all in one topic.
     */
    public static ExamAttempt attempt(UUID userId, UUID examId, int correct, int total, int timeSpent, Instant completedAt) {
        return attempt(userId, examId, correct, total, timeSpent, completedAt, Map.of("general", new TopicScore(correct, total)));
    }

    public static ExamAttempt attempt(UUID userId, UUID examId, int correct, int total, int timeSpent,
                                      Instant completedAt, Map<String, TopicScore> byTopic) {
        return ExamAttempt.builder()
                .id(UUID.randomUUID())
                .examId(examId)
                .userId(userId)
                .answers(Map.of())
                .score(correct * 5)
                .percentage(100.0 * correct / total)
                .correctCount(correct)
                .incorrectCount(total - correct)
                .totalQuestions(total)
                .timeSpentSeconds(timeSpent)
                .performanceByTopic(byTopic)
                .status(AttemptStatus.COMPLETED)
                .completedAt(completedAt)
                .completionKey(ExamAttempt.completionKeyFor(examId, userId))
                .build();
    }

    /**
     * Completed attempts with the given percentages out of 10 questions, one day apart ending at {@code last}.
     */
    public static List<ExamAttempt> attemptsWithScores(UUID userId, Instant last, int... correctOutOfTen) {
        List<ExamAttempt> attempts = new ArrayList<>();
        for (int i = 0; i < correctOutOfTen.length; i++) {
            Instant completedAt = last.minusSeconds(86_400L * (correctOutOfTen.length - 1 - i));
            attempts.add(attempt(userId, UUID.randomUUID(), correctOutOfTen[i], 10, 300, completedAt));
        }
        return attempts;
    }
}
