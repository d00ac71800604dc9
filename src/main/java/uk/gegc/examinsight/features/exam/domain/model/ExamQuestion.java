package uk.gegc.examinsight.features.exam.domain.model;

import java.util.Map;

/**
 * One multiple-choice exam item as produced by exam generation.
 * Stored inside the exam's JSON question list and never modified after the exam is created.
 *
 * @param id              question id, unique within its exam
 * @param text            the question prompt
 * @param options         option label to option text, e.g. {@code A -> "Paris"}
 * @param correctAnswer   label of the correct option
 * @param explanation     why the correct option is correct
 * @param topic           free-text topic used for mastery breakdowns
 * @param difficulty      per-question difficulty
 * @param sourceReference the source note the question was derived from
 */
public record ExamQuestion(
        String id,
        String text,
        Map<String, String> options,
        String correctAnswer,
        String explanation,
        String topic,
        QuestionDifficulty difficulty,
        String sourceReference
) {
}
