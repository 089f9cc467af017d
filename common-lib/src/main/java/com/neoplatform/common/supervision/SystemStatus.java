package com.neoplatform.common.supervision;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neoplatform.common.confidence.ConfidenceTrend;
import com.neoplatform.common.confidence.HealthReport;

import java.time.Instant;

public record SystemStatus(
    @JsonProperty("health")           HealthReport health,
    @JsonProperty("activeAlerts")     int activeAlerts,
    @JsonProperty("trend")            ConfidenceTrend trend,
    @JsonProperty("supervisorsActive") int supervisorsActive,
    @JsonProperty("validatorsActive") int validatorsActive,
    @JsonProperty("lastUpdated")      Instant lastUpdated
) {}
