package uk.gegc.examinsight.features.attempt.application;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for exam submissions.
 */
@Slf4j
@Component
public class AttemptMetrics {

    public static final String REASON_ALREADY_COMPLETED = "already_completed";
    public static final String REASON_EXAM_CLOSED = "exam_closed";

    private final MeterRegistry meterRegistry;
    private final Counter gradedCounter;

    public AttemptMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.gradedCounter = Counter.builder("exam.attempts.graded")
                .description("Number of exam attempts graded and stored")
                .register(meterRegistry);
    }

    public void incrementGraded(double percentage) {
        gradedCounter.increment();
        log.debug("Metric: exam.attempts.graded incremented, percentage={}", percentage);
    }

    public void incrementRejected(String reason) {
        Counter.builder("exam.attempts.rejected")
                .description("Number of exam submissions rejected before grading")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }
}
