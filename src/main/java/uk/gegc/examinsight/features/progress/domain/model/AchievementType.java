package uk.gegc.examinsight.features.progress.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum AchievementType {
    PERFECT_SCORE("perfect_score", "Perfect Score!", "Scored 100% on an exam"),
    FIRST_EXAM("first_exam", "First Steps", "Completed your first exam"),
    SPEED_DEMON("speed_demon", "Speed Demon", "Completed an exam in under 1 minute per question");

    private final String key;
    private final String displayName;
    private final String description;

    AchievementType(String key, String displayName, String description) {
        this.key = key;
        this.displayName = displayName;
        this.description = description;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
