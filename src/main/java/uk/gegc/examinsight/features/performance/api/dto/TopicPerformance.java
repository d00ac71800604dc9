package uk.gegc.examinsight.features.performance.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "TopicPerformance", description = "Merged correct/total counts for one topic")
public record TopicPerformance(
        @Schema(example = "recursion") String topic,
        @Schema(example = "7") int correct,
        @Schema(example = "10") int total,
        @Schema(description = "100 * correct / total", example = "70.0") double accuracy
) {
}
