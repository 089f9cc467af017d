package com.neoplatform.common.model;

/**
 * Machine-actionable decision returned to the orchestrating caller after supervision.
 */
public enum Recommendation {
    CONTINUE,
    RETRY,
    INVESTIGATE,
    STOP
}
