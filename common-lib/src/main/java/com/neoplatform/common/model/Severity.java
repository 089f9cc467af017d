package com.neoplatform.common.model;

/**
 * Severity of a single {@link ValidationResult}.
 *
 * <ul>
 *   <li>{@link #CRITICAL}: invalidates the stage output</li>
 *   <li>{@link #WARNING}: recoverable, needs attention</li>
 *   <li>{@link #INFO}: additional information only</li>
 *   <li>{@link #SUCCESS}: the check passed</li>
 * </ul>
 */
public enum Severity {
    CRITICAL,
    WARNING,
    INFO,
    SUCCESS
}
