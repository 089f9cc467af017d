package com.neoplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of one individual check performed by a validator.
 *
 * <p>{@code field}, {@code expectedValue} and {@code observedValue} are optional and may be
 * {@code null}. {@code confidence} must lie in [0.0, 1.0].
 */
public record ValidationResult(
    @JsonProperty("severity")      Severity severity,
    @JsonProperty("message")       String message,
    @JsonProperty("field")         String field,
    @JsonProperty("expectedValue") Object expectedValue,
    @JsonProperty("observedValue") Object observedValue,
    @JsonProperty("confidence")    double confidence,
    @JsonProperty("timestamp")     Instant timestamp
) {
    public ValidationResult {
        if (severity == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0.0, 1.0], was " + confidence);
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static ValidationResult of(Severity severity, String message, String field,
                                      Object expectedValue, Object observedValue,
                                      double confidence) {
        return new ValidationResult(severity, message, field, expectedValue, observedValue,
                                    confidence, Instant.now());
    }

    public static ValidationResult success(String message, String field) {
        return of(Severity.SUCCESS, message, field, null, null, 1.0);
    }

    public static ValidationResult critical(String message, String field) {
        return of(Severity.CRITICAL, message, field, null, null, 0.0);
    }

    @JsonIgnore
    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }

    @JsonIgnore
    public boolean isWarning() {
        return severity == Severity.WARNING;
    }
}
