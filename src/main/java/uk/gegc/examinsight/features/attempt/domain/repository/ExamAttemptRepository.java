package uk.gegc.examinsight.features.attempt.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.examinsight.features.attempt.domain.model.AttemptStatus;
import uk.gegc.examinsight.features.attempt.domain.model.ExamAttempt;

import java.util.List;
import java.util.UUID;

@Repository
public interface ExamAttemptRepository extends JpaRepository<ExamAttempt, UUID> {

    boolean existsByExamIdAndUserIdAndStatus(UUID examId, UUID userId, AttemptStatus status);

    /**
     * Full attempt history of a user in chronological order; the input of streaks and analytics.
     */
    List<ExamAttempt> findByUserIdAndStatusOrderByCompletedAtAsc(UUID userId, AttemptStatus status);

    Page<ExamAttempt> findByUserIdAndStatus(UUID userId, AttemptStatus status, Pageable pageable);
}
