package uk.gegc.examinsight.features.progress.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.examinsight.features.progress.domain.model.Achievement;
import uk.gegc.examinsight.features.progress.domain.model.AchievementType;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AchievementRepository extends JpaRepository<Achievement, UUID> {

    boolean existsByUserIdAndType(UUID userId, AchievementType type);

    Optional<Achievement> findByUserIdAndType(UUID userId, AchievementType type);

    List<Achievement> findByUserIdOrderByEarnedAtDesc(UUID userId);
}
