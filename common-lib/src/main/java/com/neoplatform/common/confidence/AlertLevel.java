package com.neoplatform.common.confidence;

/**
 * Alert level derived from the overall confidence.
 *
 * <pre>
 *   overall &lt; 0.3 → CRITICAL
 *   overall &lt; 0.5 → HIGH
 *   overall &lt; 0.7 → MEDIUM
 *   otherwise     → LOW
 * </pre>
 * Thresholds are configurable through {@link ConfidenceSettings}.
 */
public enum AlertLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(AlertLevel other) {
        return ordinal() >= other.ordinal();
    }
}
