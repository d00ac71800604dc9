package uk.gegc.examinsight.features.attempt.domain.model;

/**
 * Correct and total answer counts for one topic.
 */
public record TopicScore(int correct, int total) {

    public static final TopicScore EMPTY = new TopicScore(0, 0);

    public TopicScore record(boolean isCorrect) {
        return new TopicScore(correct + (isCorrect ? 1 : 0), total + 1);
    }

    public TopicScore merge(TopicScore other) {
        return new TopicScore(correct + other.correct, total + other.total);
    }

    /**
     * Accuracy as a percentage in [0, 100]; 0 when nothing was answered.
     */
    public double accuracy() {
        return total > 0 ? 100.0 * correct / total : 0.0;
    }
}
