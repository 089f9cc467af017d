package com.neoplatform.common.confidence;

/**
 * Weights of the five confidence components. Each lies in [0, 1] and they sum to 1.0.
 */
public record ConfidenceWeights(
    double domainPhysical,
    double conceptualCoherence,
    double orbitalUncertainty,
    double dataQuality,
    double predictionQuality
) {
    static final double SUM_TOLERANCE = 1e-6;

    public ConfidenceWeights {
        double[] all = {domainPhysical, conceptualCoherence, orbitalUncertainty, dataQuality, predictionQuality};
        double sum = 0.0;
        for (double w : all) {
            if (Double.isNaN(w) || w < 0.0 || w > 1.0) {
                throw new IllegalArgumentException("weight must be in [0.0, 1.0], was " + w);
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("weights must sum to 1.0, was " + sum);
        }
    }

    /** 30% domain-physical, 20% coherence, 20% orbital, 15% data quality, 15% prediction. */
    public static ConfidenceWeights defaults() {
        return new ConfidenceWeights(0.30, 0.20, 0.20, 0.15, 0.15);
    }

    public double combine(double physical, double coherence, double orbital,
                          double quality, double prediction) {
        return domainPhysical * physical
             + conceptualCoherence * coherence
             + orbitalUncertainty * orbital
             + dataQuality * quality
             + predictionQuality * prediction;
    }
}
