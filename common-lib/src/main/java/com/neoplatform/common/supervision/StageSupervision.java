package com.neoplatform.common.supervision;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neoplatform.common.model.Finding;
import com.neoplatform.common.model.StageType;
import com.neoplatform.common.model.ValidationReport;

import java.time.Instant;
import java.util.List;

/**
 * Consolidated outcome of running every validator of one stage once.
 *
 * @param overallConfidence mean of the validator reports' confidences; 0.0 when no report
 * @param valid             true iff no validator report holds a critical result
 */
public record StageSupervision(
    @JsonProperty("stageName")         String stageName,
    @JsonProperty("stageType")         StageType stageType,
    @JsonProperty("reports")           List<ValidationReport> reports,
    @JsonProperty("overallConfidence") double overallConfidence,
    @JsonProperty("valid")             boolean valid,
    @JsonProperty("errors")            List<Finding> errors,
    @JsonProperty("warnings")          List<Finding> warnings,
    @JsonProperty("recommendations")   List<String> recommendations,
    @JsonProperty("timestamp")         Instant timestamp
) {
    public StageSupervision {
        reports         = List.copyOf(reports);
        errors          = List.copyOf(errors);
        warnings        = List.copyOf(warnings);
        recommendations = List.copyOf(recommendations);
    }
}
