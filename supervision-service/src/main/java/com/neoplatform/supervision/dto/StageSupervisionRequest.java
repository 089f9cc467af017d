package com.neoplatform.supervision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neoplatform.common.model.StageType;

import java.util.Map;

/**
 * Body of {@code POST /api/v1/supervision/stages/{stageName}}.
 * {@code observation} and {@code prediction} are optional raw samples in the data-feed shape.
 */
public record StageSupervisionRequest(
    @JsonProperty("output")      Map<String, Object> output,
    @JsonProperty("stageType")   StageType stageType,
    @JsonProperty("dataType")    String dataType,
    @JsonProperty("attributes")  Map<String, Object> attributes,
    @JsonProperty("observation") Map<String, Object> observation,
    @JsonProperty("prediction")  Map<String, Object> prediction
) {}
