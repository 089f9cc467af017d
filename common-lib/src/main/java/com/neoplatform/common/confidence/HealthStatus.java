package com.neoplatform.common.confidence;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    NO_DATA
}
