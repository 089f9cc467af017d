package com.neoplatform.common.supervision;

import com.neoplatform.common.model.StageType;

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;

/**
 * Fixed, ordered mapping from a {@link RunState} field to the stage that produced it.
 * {@link PipelineSupervisor#superviseRun} walks the constants in declaration order.
 */
enum RunComponent {
    ASTEROID_DATA(RunState::asteroidData, StageType.DATA_COLLECTION, "asteroid"),
    TRAJECTORY_ANALYSIS(RunState::trajectoryAnalysis, StageType.TRAJECTORY, "trajectory"),
    IMPACT_ANALYSIS(RunState::impactAnalysis, StageType.IMPACT, "impact"),
    MITIGATION_STRATEGIES(RunState::mitigationStrategies, StageType.MITIGATION, "mitigation"),
    VISUALIZATION_DATA(RunState::visualizationData, StageType.VISUALIZATION, "visualization"),
    ML_PREDICTIONS(RunState::mlPredictions, StageType.ML_PREDICTION, "ml"),
    EXPLANATION(RunState::explanation, StageType.EXPLANATION, "explanation");

    private final Function<RunState, Object> extractor;
    private final StageType stageType;
    private final String dataType;

    RunComponent(Function<RunState, Object> extractor, StageType stageType, String dataType) {
        this.extractor = extractor;
        this.stageType = stageType;
        this.dataType  = dataType;
    }

    String stageName() { return stageType.defaultStageName(); }

    StageType stageType() { return stageType; }

    String dataType() { return dataType; }

    /**
     * The field as a stage output map, or {@code null} when the field is absent or empty.
     * Strategy lists are wrapped under {@code strategies}, explanation text under
     * {@code explanation_text}.
     */
    @SuppressWarnings("unchecked")
    Map<String, Object> toStageOutput(RunState state) {
        Object value = extractor.apply(state);
        if (value == null) return null;
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty() ? null : (Map<String, Object>) map;
        }
        if (value instanceof Collection<?> list) {
            return list.isEmpty() ? null : Map.of("strategies", list);
        }
        if (value instanceof String text) {
            return text.isBlank() ? null : Map.of("explanation_text", text);
        }
        return null;
    }
}
