package uk.gegc.examinsight.features.performance.api.dto;

import java.time.Instant;

public record ScoreTrendPoint(Instant date, double score, String folderName) {
}
