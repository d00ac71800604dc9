package uk.gegc.examinsight.features.exam.domain.model;

/**
 * Declared difficulty mix of an exam as a whole.
 */
public enum ExamDifficulty {
    EASY,
    MEDIUM,
    HARD,
    MIXED
}
