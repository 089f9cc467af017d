package com.neoplatform.common.model;

import java.util.List;

/**
 * Kind of computation stage in the hazard-analysis pipeline.
 *
 * <p>The stage type selects which checks a validator applies and which fixed
 * recommendation addendum the stage supervisor appends to its advice.
 */
public enum StageType {
    DATA_COLLECTION("data_collector",
        "Verify connectivity with external data APIs",
        "Validate the format of received data"),
    TRAJECTORY("trajectory",
        "Verify astronomical constants",
        "Validate energy conservation"),
    IMPACT("impact_analyzer",
        "Verify impact energy calculations",
        "Validate physical value ranges"),
    MITIGATION("mitigation",
        "Verify feasibility of mitigation strategies",
        "Validate cost-benefit calculations"),
    VISUALIZATION("visualization",
        "Verify integrity of visualization data",
        "Validate coordinate ranges"),
    ML_PREDICTION("ml_predictor",
        "Verify quality of training data",
        "Validate prediction ranges"),
    EXPLANATION("explainer",
        "Verify language coherence",
        "Validate adaptation to the target audience"),
    UNKNOWN("unknown");

    private final String defaultStageName;
    private final List<String> guidance;

    StageType(String defaultStageName, String... guidance) {
        this.defaultStageName = defaultStageName;
        this.guidance = List.of(guidance);
    }

    public String defaultStageName() {
        return defaultStageName;
    }

    /** Fixed advice lines appended to every supervision of a stage of this type. */
    public List<String> guidance() {
        return guidance;
    }
}
