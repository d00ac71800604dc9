package uk.gegc.examinsight.features.attempt.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One graded exam attempt. Rows are written once by grading and never updated.
 * <p>
 * {@code completionKey} is {@code examId:userId} for completed attempts and {@code null} otherwise;
 * its unique index allows at most one completed attempt per exam and user.
 * </p>
 */
@Entity
@Immutable
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Table(name = "exam_attempts",
        uniqueConstraints = @UniqueConstraint(name = "uk_exam_attempts_completion_key", columnNames = "completion_key"),
        indexes = @Index(name = "idx_exam_attempts_user_status", columnList = "user_id, status"))
public class ExamAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "exam_id", nullable = false, updatable = false)
    private UUID examId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "answers", nullable = false)
    private Map<String, String> answers;

    @Column(name = "score", nullable = false)
    private int score;

    @Column(name = "percentage", nullable = false)
    private double percentage;

    @Column(name = "correct_count", nullable = false)
    private int correctCount;

    @Column(name = "incorrect_count", nullable = false)
    private int incorrectCount;

    @Column(name = "total_questions", nullable = false)
    private int totalQuestions;

    @Column(name = "time_spent_seconds", nullable = false)
    private int timeSpentSeconds;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "performance_by_topic", nullable = false)
    private Map<String, TopicScore> performanceByTopic;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private AttemptStatus status;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "completion_key", length = 80, updatable = false)
    private String completionKey;

    public static String completionKeyFor(UUID examId, UUID userId) {
        return examId + ":" + userId;
    }

    public boolean isCompleted() {
        return status == AttemptStatus.COMPLETED;
    }
}
