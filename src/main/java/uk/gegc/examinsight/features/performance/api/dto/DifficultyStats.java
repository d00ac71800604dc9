package uk.gegc.examinsight.features.performance.api.dto;

public record DifficultyStats(int correct, int total, double accuracy) {

    public static final DifficultyStats EMPTY = new DifficultyStats(0, 0, 0.0);
}
