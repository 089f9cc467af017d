package com.neoplatform.common.validation;

import com.neoplatform.common.model.StageContext;
import com.neoplatform.common.model.ValidationReport;
import com.neoplatform.common.model.ValidatorKind;

import java.util.Map;

/**
 * Contract for one domain-specific correctness check over a stage's output.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>never mutate {@code stageOutput}</li>
 *   <li>always return a report, never {@code null}</li>
 *   <li>signal a failure of their own logic with
 *       {@link com.neoplatform.common.exception.ValidatorException}</li>
 * </ul>
 *
 * <p>Variants: {@link PhysicalPlausibilityValidator}, {@link DataCompletenessValidator},
 * {@link ConceptualCoherenceValidator}.
 */
public interface Validator {

    String name();

    ValidatorKind kind();

    /**
     * Validates one stage output.
     *
     * @param stageOutput data produced by the stage; read-only
     * @param context     stage name, stage type and run metadata
     * @return a report tagged with this validator's name and kind
     */
    ValidationReport validate(Map<String, Object> stageOutput, StageContext context);
}
