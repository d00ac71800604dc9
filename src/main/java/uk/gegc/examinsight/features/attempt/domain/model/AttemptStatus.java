package uk.gegc.examinsight.features.attempt.domain.model;

public enum AttemptStatus {
    IN_PROGRESS,
    COMPLETED
}
