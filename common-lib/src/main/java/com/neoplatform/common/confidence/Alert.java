package com.neoplatform.common.confidence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Standing notice raised by the {@link ConfidenceSystem}.
 * Only {@link ConfidenceSystem#resolveAlert(int)} marks an alert resolved.
 */
public record Alert(
    @JsonProperty("level")     AlertLevel level,
    @JsonProperty("message")   String message,
    @JsonProperty("stageName") String stageName,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("resolved")  boolean resolved
) {
    static Alert raise(AlertLevel level, String message, String stageName) {
        return new Alert(level, message, stageName, Instant.now(), false);
    }

    Alert asResolved() {
        return new Alert(level, message, stageName, timestamp, true);
    }
}
