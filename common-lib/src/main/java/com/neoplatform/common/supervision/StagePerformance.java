package com.neoplatform.common.supervision;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate over a stage supervisor's retained history.
 * Rates are per supervision; all values are 0 when the history is empty.
 */
public record StagePerformance(
    @JsonProperty("stageName")             String stageName,
    @JsonProperty("totalSupervisions")     int totalSupervisions,
    @JsonProperty("validSupervisions")     int validSupervisions,
    @JsonProperty("successRate")           double successRate,
    @JsonProperty("averageConfidence")     double averageConfidence,
    @JsonProperty("totalErrors")           int totalErrors,
    @JsonProperty("totalWarnings")         int totalWarnings,
    @JsonProperty("errorRate")             double errorRate,
    @JsonProperty("warningRate")           double warningRate
) {
    public static StagePerformance empty(String stageName) {
        return new StagePerformance(stageName, 0, 0, 0.0, 0.0, 0, 0, 0.0, 0.0);
    }

    public boolean hasHistory() {
        return totalSupervisions > 0;
    }
}
