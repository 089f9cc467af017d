package com.neoplatform.common.confidence;

/**
 * Tunable constants of the {@link ConfidenceSystem}.
 *
 * @param weights                  component weights
 * @param criticalThreshold        overall below this → {@link AlertLevel#CRITICAL}
 * @param highThreshold            overall below this → {@link AlertLevel#HIGH}
 * @param mediumThreshold          overall below this → {@link AlertLevel#MEDIUM}
 * @param decliningAlertCeiling    a declining trend raises an alert only below this overall
 * @param trendWindow              number of most recent snapshots the trend looks at
 * @param trendThreshold           half-window mean difference needed to leave STABLE
 * @param historyCapacity          snapshots retained before the oldest is evicted
 * @param unresolvedAlertSoftLimit unresolved alerts beyond this are logged as a warning
 */
public record ConfidenceSettings(
    ConfidenceWeights weights,
    double criticalThreshold,
    double highThreshold,
    double mediumThreshold,
    double decliningAlertCeiling,
    int trendWindow,
    double trendThreshold,
    int historyCapacity,
    int unresolvedAlertSoftLimit
) {
    public ConfidenceSettings {
        if (weights == null) {
            throw new IllegalArgumentException("weights must not be null");
        }
        if (!(criticalThreshold <= highThreshold && highThreshold <= mediumThreshold)) {
            throw new IllegalArgumentException("alert thresholds must be ascending: "
                + criticalThreshold + ", " + highThreshold + ", " + mediumThreshold);
        }
        if (trendWindow < 2) {
            throw new IllegalArgumentException("trendWindow must be >= 2, was " + trendWindow);
        }
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("historyCapacity must be >= 1, was " + historyCapacity);
        }
        if (unresolvedAlertSoftLimit < 1) {
            throw new IllegalArgumentException("unresolvedAlertSoftLimit must be >= 1, was " + unresolvedAlertSoftLimit);
        }
    }

    public static ConfidenceSettings defaults() {
        return new ConfidenceSettings(ConfidenceWeights.defaults(),
            0.3, 0.5, 0.7, 0.8, 5, 0.05, 100, 100);
    }
}
