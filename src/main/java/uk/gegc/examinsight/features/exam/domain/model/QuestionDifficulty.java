package uk.gegc.examinsight.features.exam.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QuestionDifficulty {
    EASY,
    MEDIUM,
    HARD;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static QuestionDifficulty fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return QuestionDifficulty.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
