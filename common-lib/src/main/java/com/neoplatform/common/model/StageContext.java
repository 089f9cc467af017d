package com.neoplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Context handed to every validator alongside the stage output.
 *
 * <p>{@code validatorName}, {@code runId} and {@code dataType} may be {@code null};
 * {@code attributes} is never {@code null}.
 */
public record StageContext(
    @JsonProperty("stageName")     String stageName,
    @JsonProperty("stageType")     StageType stageType,
    @JsonProperty("runId")         String runId,
    @JsonProperty("dataType")      String dataType,
    @JsonProperty("validatorName") String validatorName,
    @JsonProperty("attributes")    Map<String, Object> attributes
) {
    public StageContext {
        if (stageType == null) stageType = StageType.UNKNOWN;
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static StageContext of(String stageName, StageType stageType) {
        return new StageContext(stageName, stageType, null, null, null, Map.of());
    }

    public StageContext withStageType(StageType type) {
        return new StageContext(stageName, type, runId, dataType, validatorName, attributes);
    }

    public StageContext withValidator(String name) {
        return new StageContext(stageName, stageType, runId, dataType, name, attributes);
    }

    public StageContext withRunId(String id) {
        return new StageContext(stageName, stageType, id, dataType, validatorName, attributes);
    }
}
