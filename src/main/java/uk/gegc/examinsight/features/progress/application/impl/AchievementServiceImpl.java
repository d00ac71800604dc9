package uk.gegc.examinsight.features.progress.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.examinsight.features.progress.api.dto.AchievementDto;
import uk.gegc.examinsight.features.progress.application.AchievementService;
import uk.gegc.examinsight.features.progress.domain.model.Achievement;
import uk.gegc.examinsight.features.progress.domain.model.AchievementType;
import uk.gegc.examinsight.features.progress.domain.repository.AchievementRepository;
import uk.gegc.examinsight.features.progress.infra.mapping.AchievementMapper;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class AchievementServiceImpl implements AchievementService {

    private final AchievementRepository achievementRepository;
    private final AchievementWriter achievementWriter;
    private final AchievementMapper achievementMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public List<AchievementDto> recordAll(UUID userId, UUID examId, List<AchievementType> types) {
        List<AchievementDto> result = new ArrayList<>();
        for (AchievementType type : types) {
            result.add(record(userId, examId, type));
        }
        return result;
    }

    private AchievementDto record(UUID userId, UUID examId, AchievementType type) {
        Optional<Achievement> existing = achievementRepository.findByUserIdAndType(userId, type);
        if (existing.isPresent()) {
            return achievementMapper.toDto(existing.get(), false);
        }

        try {
            Achievement saved = achievementWriter.insert(Achievement.earned(userId, type, examId, clock.instant()));
            log.info("User {} unlocked achievement {} on exam {}", userId, type.getKey(), examId);
            Counter.builder("achievements.unlocked")
                    .description("Number of achievements unlocked")
                    .tag("type", type.getKey())
                    .register(meterRegistry)
                    .increment();
            return achievementMapper.toDto(saved, true);
        } catch (DataIntegrityViolationException e) {
            log.info("Achievement {} for user {} was recorded concurrently", type.getKey(), userId);
            return achievementRepository.findByUserIdAndType(userId, type)
                    .map(winner -> achievementMapper.toDto(winner, false))
                    .orElseGet(() -> achievementMapper.toDto(
                            Achievement.earned(userId, type, examId, clock.instant()), false));
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<AchievementDto> listForUser(UUID userId) {
        return achievementRepository.findByUserIdOrderByEarnedAtDesc(userId).stream()
                .map(achievement -> achievementMapper.toDto(achievement, false))
                .toList();
    }
}
