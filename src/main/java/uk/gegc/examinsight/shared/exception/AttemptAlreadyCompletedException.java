package uk.gegc.examinsight.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * Exception thrown when a user submits answers for an exam they have already completed.
 * A completed attempt is never overwritten.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class AttemptAlreadyCompletedException extends RuntimeException {

    private final UUID examId;
    private final UUID userId;

    public AttemptAlreadyCompletedException(UUID examId, UUID userId) {
        super("Exam " + examId + " has already been completed by this user");
        this.examId = examId;
        this.userId = userId;
    }

    public UUID getExamId() {
        return examId;
    }

    public UUID getUserId() {
        return userId;
    }
}
