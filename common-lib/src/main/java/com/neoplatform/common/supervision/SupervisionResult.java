package com.neoplatform.common.supervision;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.neoplatform.common.confidence.ConfidenceMetrics;
import com.neoplatform.common.model.Finding;
import com.neoplatform.common.model.Recommendation;
import com.neoplatform.common.model.ValidationReport;

import java.time.Instant;
import java.util.List;

/**
 * Answer of {@link PipelineSupervisor#superviseOne}.
 *
 * <p>{@code supervised == false} means the stage could not be supervised at all
 * (no mapping, or an unexpected fault); {@code error} then says why and the
 * recommendation is always {@link Recommendation#STOP}.
 * {@code confidenceMetrics} is {@code null} when no validator report was produced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SupervisionResult(
    @JsonProperty("stageName")         String stageName,
    @JsonProperty("supervised")        boolean supervised,
    @JsonProperty("validationReports") List<ValidationReport> validationReports,
    @JsonProperty("overallConfidence") double overallConfidence,
    @JsonProperty("valid")             boolean valid,
    @JsonProperty("errors")            List<Finding> errors,
    @JsonProperty("warnings")          List<Finding> warnings,
    @JsonProperty("recommendations")   List<String> recommendations,
    @JsonProperty("confidenceMetrics") ConfidenceMetrics confidenceMetrics,
    @JsonProperty("recommendation")    Recommendation recommendation,
    @JsonProperty("error")             String error,
    @JsonProperty("timestamp")         Instant timestamp
) {
    public static SupervisionResult notSupervised(String stageName, String error) {
        return new SupervisionResult(stageName, false, List.of(), 0.0, false,
            List.of(), List.of(), List.of(), null, Recommendation.STOP, error, Instant.now());
    }

    static SupervisionResult of(StageSupervision stage, ConfidenceMetrics metrics,
                                Recommendation recommendation) {
        return new SupervisionResult(stage.stageName(), true, stage.reports(),
            stage.overallConfidence(), stage.valid(), stage.errors(), stage.warnings(),
            stage.recommendations(), metrics, recommendation, null, stage.timestamp());
    }
}
