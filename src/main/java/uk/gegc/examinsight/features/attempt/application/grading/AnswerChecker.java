package uk.gegc.examinsight.features.attempt.application.grading;

import uk.gegc.examinsight.features.exam.domain.model.ExamQuestion;

import java.util.Map;

/**
 * Single source of per-question correctness, shared by grading, analytics and review.
 */
public final class AnswerChecker {

    private AnswerChecker() {
    }

    /**
     * A question is correct when the submitted label equals its answer key exactly (case-sensitive).
     * Unanswered questions are incorrect.
     */
    public static boolean isCorrect(ExamQuestion question, Map<String, String> answers) {
        if (question == null || answers == null || question.correctAnswer() == null) {
            return false;
        }
        String submitted = answers.get(question.id());
        return question.correctAnswer().equals(submitted);
    }
}
