package uk.gegc.examinsight.features.progress.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * An achievement earned by a user. At most one row exists per user and type.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "user_achievements",
        uniqueConstraints = @UniqueConstraint(name = "uk_user_achievements_user_type",
                columnNames = {"user_id", "achievement_type"}))
public class Achievement {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "achievement_type", nullable = false, length = 40, updatable = false)
    private AchievementType type;

    @Column(name = "achievement_name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "exam_id")
    private UUID examId;

    @Column(name = "earned_at", nullable = false)
    private Instant earnedAt;

    public static Achievement earned(UUID userId, AchievementType type, UUID examId, Instant earnedAt) {
        Achievement achievement = new Achievement();
        achievement.setUserId(userId);
        achievement.setType(type);
        achievement.setName(type.getDisplayName());
        achievement.setDescription(type.getDescription());
        achievement.setExamId(examId);
        achievement.setEarnedAt(earnedAt);
        return achievement;
    }
}
