package com.neoplatform.common.validation;

import com.neoplatform.common.model.Severity;
import com.neoplatform.common.model.StageContext;
import com.neoplatform.common.model.StageType;
import com.neoplatform.common.model.ValidationReport;
import com.neoplatform.common.model.ValidationResult;
import com.neoplatform.common.model.ValidatorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConceptualCoherenceValidatorTest {

    static final String GOOD_EXPLANATION =
        "The asteroid follows an orbit that crosses Earth's path. An impact would release energy "
        + "proportional to the square of its velocity, and gravitational focusing raises the odds.";

    private final ConceptualCoherenceValidator validator = new ConceptualCoherenceValidator();

    private ValidationReport validate(Map<String, Object> output, StageType type) {
        return validator.validate(output, StageContext.of(type.defaultStageName(), type));
    }

    private static ValidationResult resultFor(ValidationReport report, String field) {
        return report.results().stream()
            .filter(r -> field.equals(r.field()))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no result for " + field));
    }

    @Test
    @DisplayName("reports are tagged as narrative")
    void narrativeKind() {
        assertEquals(ValidatorKind.COHERENCE, validator.kind());
        assertTrue(validator.kind().isNarrative());
    }

    @Nested
    @DisplayName("explanation")
    class Explanation {

        @Test
        @DisplayName("well-formed explanation → three SUCCESS results")
        void wellFormed() {
            ValidationReport report = validate(Map.of("explanation_text", GOOD_EXPLANATION), StageType.EXPLANATION);

            assertEquals(3, report.count());
            assertTrue(report.warnings().isEmpty());
            assertEquals(1.0, resultFor(report, "technical_coherence").confidence(), 1e-9);
            assertEquals(0.8, resultFor(report, "audience_adaptation").confidence(), 1e-9);
            assertEquals(0.85, resultFor(report, "scientific_accuracy").confidence(), 1e-9);
        }

        @Test
        @DisplayName("over-claiming phrases lower scientific accuracy below 0.8 → WARNING")
        void overclaiming() {
            String text = GOOD_EXPLANATION + " An impact is guaranteed, 100% certain.";
            ValidationResult result = resultFor(
                validate(Map.of("explanation_text", text), StageType.EXPLANATION), "scientific_accuracy");

            assertEquals(Severity.WARNING, result.severity());
            assertEquals(0.65, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("few technical terms → technical coherence WARNING")
        void lowCoherence() {
            ValidationResult result = resultFor(
                validate(Map.of("explanation_text", "It is a big rock."), StageType.EXPLANATION),
                "technical_coherence");
            assertEquals(Severity.WARNING, result.severity());
            assertEquals(0.0, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("missing explanation_text → CRITICAL")
        void missingText() {
            ValidationReport report = validate(Map.of(), StageType.EXPLANATION);
            assertFalse(report.isValid());
            assertEquals("explanation_text", report.errors().get(0).field());
        }
    }

    @Nested
    @DisplayName("mitigation")
    class Mitigation {

        @Test
        @DisplayName("known strategies are scored by feasibility, unknown ones are WARNING 0.3")
        void strategies() {
            Map<String, Object> output = Map.of("strategies", List.of(
                Map.of("name", "Kinetic Impactor"),
                Map.of("name", "nuclear-deflection"),
                Map.of("name", "laser ablation")));

            ValidationReport report = validate(output, StageType.MITIGATION);

            ValidationResult kinetic = resultFor(report, "strategy_0_feasibility");
            assertEquals(Severity.SUCCESS, kinetic.severity());
            assertEquals(0.9, kinetic.confidence(), 1e-9);

            ValidationResult nuclear = resultFor(report, "strategy_1_feasibility");
            assertEquals(Severity.WARNING, nuclear.severity());
            assertEquals(0.3, nuclear.confidence(), 1e-9);

            ValidationResult unknown = resultFor(report, "strategy_2_unknown");
            assertEquals(Severity.WARNING, unknown.severity());
            assertEquals(0.3, unknown.confidence(), 1e-9);
        }

        @Test
        @DisplayName("missing strategies → CRITICAL")
        void missingStrategies() {
            assertFalse(validate(Map.of(), StageType.MITIGATION).isValid());
        }
    }

    @Nested
    @DisplayName("visualization")
    class Visualization {

        @Test
        @DisplayName("half the descriptors incomplete → WARNING, matching metadata → SUCCESS")
        void descriptors() {
            Map<String, Object> output = Map.of(
                "charts", Map.of(
                    "orbit", Map.of("type", "3d", "data", List.of(1, 2)),
                    "risk", Map.of("type", "line")),
                "metadata", Map.of("total_visualizations", 2));

            ValidationReport report = validate(output, StageType.VISUALIZATION);

            ValidationResult completeness = resultFor(report, "descriptor_completeness");
            assertEquals(Severity.WARNING, completeness.severity());
            assertEquals(0.5, completeness.confidence(), 1e-9);
            assertEquals(Severity.SUCCESS, resultFor(report, "metadata_consistency").severity());
        }

        @Test
        @DisplayName("metadata consistency: undeclared 0.5, mismatch 0.0")
        void metadataConsistency() {
            assertEquals(0.5, validator.metadataConsistency(null, 3));
            assertEquals(0.5, validator.metadataConsistency(Map.of(), 3));
            assertEquals(0.0, validator.metadataConsistency(Map.of("total_visualizations", 2), 3));
        }
    }

    @Nested
    @DisplayName("heuristics")
    class Heuristics {

        @Test
        @DisplayName("audience adaptation: general 0.8, scientific 0.9, other 0.7")
        void audience() {
            assertEquals(0.8, validator.audienceAdaptation("general"));
            assertEquals(0.9, validator.audienceAdaptation("Scientific"));
            assertEquals(0.7, validator.audienceAdaptation("children"));
        }

        @Test
        @DisplayName("general coherence is floored at 0.5 for non-blank text")
        void generalCoherence() {
            assertEquals(0.5, validator.generalCoherence("hello"));
            assertEquals(0.0, validator.generalCoherence("   "));
        }

        @Test
        @DisplayName("content of other stage types is scored for general coherence")
        void generalStage() {
            ValidationReport report = validate(Map.of("content", GOOD_EXPLANATION), StageType.UNKNOWN);
            assertEquals(Severity.SUCCESS, resultFor(report, "general_coherence").severity());
        }
    }
}
