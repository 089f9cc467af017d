package com.neoplatform.common.supervision;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Accumulated outputs of one multi-stage analysis run. Every field is optional;
 * {@code null} or empty fields are not supervised.
 */
public record RunState(
    @JsonProperty("asteroidData")         Map<String, Object> asteroidData,
    @JsonProperty("trajectoryAnalysis")   Map<String, Object> trajectoryAnalysis,
    @JsonProperty("impactAnalysis")       Map<String, Object> impactAnalysis,
    @JsonProperty("mitigationStrategies") List<Map<String, Object>> mitigationStrategies,
    @JsonProperty("visualizationData")    Map<String, Object> visualizationData,
    @JsonProperty("mlPredictions")        Map<String, Object> mlPredictions,
    @JsonProperty("explanation")          String explanation
) {
    public static RunState empty() {
        return new RunState(null, null, null, null, null, null, null);
    }
}
