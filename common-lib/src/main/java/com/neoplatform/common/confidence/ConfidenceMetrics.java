package com.neoplatform.common.confidence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point-in-time trustworthiness snapshot produced by the {@link ConfidenceSystem}.
 *
 * <p>Components:
 * <ul>
 *   <li>{@code domainPhysical}: mean confidence of non-narrative validator reports</li>
 *   <li>{@code conceptualCoherence}: mean confidence of narrative validator reports</li>
 *   <li>{@code orbitalUncertainty}: derived from the size-bound spread of the observed object</li>
 *   <li>{@code dataQuality}: completeness and consistency of the input sample</li>
 *   <li>{@code predictionQuality}: self-reported confidence and shape of the prediction</li>
 * </ul>
 * All values lie in [0.0, 1.0].
 */
public record ConfidenceMetrics(
    @JsonProperty("overall")             double overall,
    @JsonProperty("domainPhysical")      double domainPhysical,
    @JsonProperty("conceptualCoherence") double conceptualCoherence,
    @JsonProperty("orbitalUncertainty")  double orbitalUncertainty,
    @JsonProperty("dataQuality")         double dataQuality,
    @JsonProperty("predictionQuality")   double predictionQuality,
    @JsonProperty("trend")               Trend trend,
    @JsonProperty("alertLevel")          AlertLevel alertLevel,
    @JsonProperty("timestamp")           Instant timestamp
) {}
