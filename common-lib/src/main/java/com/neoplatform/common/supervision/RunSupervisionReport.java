package com.neoplatform.common.supervision;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neoplatform.common.confidence.Alert;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Answer of {@link PipelineSupervisor#superviseRun}.
 * {@code stageReports} is keyed by stage name in pipeline order.
 */
public record RunSupervisionReport(
    @JsonProperty("runId")             String runId,
    @JsonProperty("timestamp")         Instant timestamp,
    @JsonProperty("stageReports")      Map<String, SupervisionResult> stageReports,
    @JsonProperty("overallConfidence") double overallConfidence,
    @JsonProperty("runValid")          boolean runValid,
    @JsonProperty("alerts")            List<Alert> alerts,
    @JsonProperty("recommendations")   List<String> recommendations
) {}
