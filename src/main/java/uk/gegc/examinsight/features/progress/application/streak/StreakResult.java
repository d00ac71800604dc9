package uk.gegc.examinsight.features.progress.application.streak;

public record StreakResult(int current, int longest) {

    public static final StreakResult NONE = new StreakResult(0, 0);
}
