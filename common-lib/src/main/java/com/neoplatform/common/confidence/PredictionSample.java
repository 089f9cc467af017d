package com.neoplatform.common.confidence;

import java.util.Map;

/**
 * Narrative prediction produced by a language-model stage: a summary text and the
 * model's self-reported confidence. Both fields are optional.
 */
public record PredictionSample(String summary, Double confidenceLevel) {

    public static PredictionSample fromMap(Map<String, Object> data) {
        if (data == null) return null;
        Object summary = data.get("summary");
        return new PredictionSample(
            summary != null ? String.valueOf(summary) : null,
            ObservationSample.number(data.get("confidence_level")));
    }

    public int summaryWordCount() {
        if (summary == null || summary.isBlank()) return 0;
        return summary.trim().split("\\s+").length;
    }
}
