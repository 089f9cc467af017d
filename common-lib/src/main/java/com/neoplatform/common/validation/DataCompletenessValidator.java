package com.neoplatform.common.validation;

import com.neoplatform.common.model.StageContext;
import com.neoplatform.common.model.StageType;
import com.neoplatform.common.model.ValidationReport;
import com.neoplatform.common.model.ValidatorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that the fields configured for a stage type are present and non-null,
 * emitting one result per field. Dotted names address nested maps
 * ({@code orbital_data.eccentricity}).
 *
 * <p>A stage type without configured fields yields an empty report.
 */
public class DataCompletenessValidator extends AbstractValidator {

    private static final Logger log = LoggerFactory.getLogger(DataCompletenessValidator.class);

    public static final String NAME = "DataCompletenessValidator";

    private final Map<StageType, List<String>> requiredFields;

    public DataCompletenessValidator() {
        this(defaultRequiredFields());
    }

    public DataCompletenessValidator(Map<StageType, List<String>> requiredFields) {
        super(NAME, ValidatorKind.COMPLETENESS);
        Map<StageType, List<String>> copy = new EnumMap<>(StageType.class);
        requiredFields.forEach((type, fields) -> copy.put(type, List.copyOf(fields)));
        this.requiredFields = copy;
    }

    public static Map<StageType, List<String>> defaultRequiredFields() {
        Map<StageType, List<String>> fields = new EnumMap<>(StageType.class);
        fields.put(StageType.DATA_COLLECTION, List.of(
            "id", "name", "diameter_min", "diameter_max", "hazardous", "orbital_data",
            "orbital_data.eccentricity", "orbital_data.inclination", "orbital_data.semi_major_axis"));
        fields.put(StageType.VISUALIZATION, List.of("charts", "metadata"));
        fields.put(StageType.ML_PREDICTION, List.of(
            "trajectory_prediction", "risk_evolution", "impact_probability",
            "confidence_score", "model_version"));
        fields.put(StageType.EXPLANATION, List.of("explanation_text"));
        return fields;
    }

    public List<String> requiredFieldsFor(StageType type) {
        return requiredFields.getOrDefault(type, List.of());
    }

    @Override
    protected void doValidate(Map<String, Object> output, StageContext context, ValidationReport report) {
        List<String> fields = requiredFieldsFor(context.stageType());
        if (fields.isEmpty()) {
            log.debug("[{}] no required fields configured for stageType={}", NAME, context.stageType());
            return;
        }
        report.addResults(checkRequiredFields(output, fields));
    }
}
