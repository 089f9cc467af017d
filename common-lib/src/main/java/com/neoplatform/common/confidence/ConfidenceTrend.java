package com.neoplatform.common.confidence;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Latest trend together with the change between the last two snapshots.
 * {@code current} and {@code previous} are {@code null} while fewer than two snapshots exist.
 */
public record ConfidenceTrend(
    @JsonProperty("trend")          Trend trend,
    @JsonProperty("sufficientData") boolean sufficientData,
    @JsonProperty("delta")          double delta,
    @JsonProperty("current")        Double current,
    @JsonProperty("previous")       Double previous
) {
    public static ConfidenceTrend insufficientData() {
        return new ConfidenceTrend(Trend.STABLE, false, 0.0, null, null);
    }
}
