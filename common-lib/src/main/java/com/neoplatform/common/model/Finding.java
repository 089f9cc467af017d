package com.neoplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Consolidated error or warning line of a stage supervision, tagged with the validator
 * that produced it.
 */
public record Finding(
    @JsonProperty("message")   String message,
    @JsonProperty("field")     String field,
    @JsonProperty("validator") String validator
) {
    public static Finding from(ValidationResult result, String validator) {
        return new Finding(result.message(), result.field(), validator);
    }
}
