package com.neoplatform.common.confidence;

/**
 * Direction of the overall confidence over the most recent snapshots.
 */
public enum Trend {
    IMPROVING,
    STABLE,
    DECLINING
}
