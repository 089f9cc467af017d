package com.neoplatform.common.confidence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Health snapshot: the latest metrics (or {@code null} before the first update)
 * plus the number of unresolved alerts.
 */
public record HealthReport(
    @JsonProperty("status")       HealthStatus status,
    @JsonProperty("confidence")   double confidence,
    @JsonProperty("latest")       ConfidenceMetrics latest,
    @JsonProperty("activeAlerts") int activeAlerts,
    @JsonProperty("lastUpdated")  Instant lastUpdated
) {}
