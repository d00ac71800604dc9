package uk.gegc.examinsight.features.exam.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "exams")
public class Exam {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "folder_id", length = 255)
    private String folderId;

    @Column(name = "folder_name", length = 255)
    private String folderName;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "questions", nullable = false)
    private List<ExamQuestion> questions = new ArrayList<>();

    @Column(name = "question_count", nullable = false)
    private int questionCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "difficulty", nullable = false, length = 20)
    private ExamDifficulty difficulty = ExamDifficulty.MIXED;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "source_note_ids")
    private List<String> sourceNoteIds = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    /**
     * Name shown next to attempts in dashboards: the folder name when the exam came from a folder, otherwise the title.
     */
    public String getDisplayName() {
        return folderName != null && !folderName.isBlank() ? folderName : title;
    }

    public boolean isOwnedBy(UUID candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }

    public boolean isOpenForSubmission(Instant now) {
        return active && (expiresAt == null || expiresAt.isAfter(now));
    }
}
