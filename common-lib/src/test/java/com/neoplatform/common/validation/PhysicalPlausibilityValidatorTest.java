package com.neoplatform.common.validation;

import com.neoplatform.common.model.Severity;
import com.neoplatform.common.model.StageContext;
import com.neoplatform.common.model.StageType;
import com.neoplatform.common.model.ValidationReport;
import com.neoplatform.common.model.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PhysicalPlausibilityValidatorTest {

    private final PhysicalPlausibilityValidator validator = new PhysicalPlausibilityValidator();

    private ValidationReport validate(Map<String, Object> output, StageType type) {
        return validator.validate(output, StageContext.of(type.defaultStageName(), type));
    }

    private static ValidationResult resultFor(ValidationReport report, String field) {
        return report.results().stream()
            .filter(r -> field.equals(r.field()))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no result for " + field));
    }

    private static Map<String, Object> trajectory(Object eccentricity, Object inclination) {
        Map<String, Object> elements = new HashMap<>();
        elements.put("semi_major_axis", 1.0);
        elements.put("eccentricity", eccentricity);
        elements.put("inclination", inclination);
        return Map.of(
            "orbital_elements", elements,
            "orbital_period", 1.0,
            "orbital_velocity", 29_780.0);
    }

    @Nested
    @DisplayName("trajectory")
    class Trajectory {

        @Test
        @DisplayName("plausible orbit → all checks succeed")
        void plausibleOrbit() {
            Map<String, Object> output = new HashMap<>(trajectory(0.2, 10.0));
            output.put("energy_analysis", Map.of(
                "total_energy", -2.0e10, "kinetic_energy", 3.0e10, "potential_energy", -5.0e10));

            ValidationReport report = validate(output, StageType.TRAJECTORY);

            assertTrue(report.isValid());
            assertEquals(1.0, report.overallConfidence(), 1e-9);
            assertEquals(Severity.SUCCESS, resultFor(report, "energy_conservation").severity());
            assertEquals(Severity.SUCCESS, resultFor(report, "kepler_third_law").severity());
        }

        @Test
        @DisplayName("eccentricity 0.999 is outside the half-open range → WARNING 0.3")
        void eccentricityUpperBoundExcluded() {
            ValidationResult result = resultFor(validate(trajectory(0.999, 10.0), StageType.TRAJECTORY),
                "eccentricity");
            assertEquals(Severity.WARNING, result.severity());
            assertEquals(0.3, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("inclination more than 10× above the bound → CRITICAL")
        void grossInclination() {
            ValidationReport report = validate(trajectory(0.2, 2000.0), StageType.TRAJECTORY);
            assertEquals(Severity.CRITICAL, resultFor(report, "inclination").severity());
            assertFalse(report.isValid());
        }

        @Test
        @DisplayName("negative inclination is a gross violation of a zero lower bound")
        void negativeInclination() {
            ValidationReport report = validate(trajectory(0.2, -5.0), StageType.TRAJECTORY);
            assertEquals(Severity.CRITICAL, resultFor(report, "inclination").severity());
        }

        @Test
        @DisplayName("numeric strings are accepted, non-numeric strings are CRITICAL")
        void numericStrings() {
            ValidationReport ok = validate(trajectory("0.2227", "10.8"), StageType.TRAJECTORY);
            assertEquals(Severity.SUCCESS, resultFor(ok, "eccentricity").severity());

            ValidationReport bad = validate(trajectory("abc", 10.0), StageType.TRAJECTORY);
            ValidationResult result = resultFor(bad, "eccentricity");
            assertEquals(Severity.CRITICAL, result.severity());
            assertTrue(result.message().contains("not numeric"));
        }

        @Test
        @DisplayName("energy imbalance above 1% → WARNING 0.5")
        void energyImbalance() {
            Map<String, Object> output = Map.of("energy_analysis", Map.of(
                "total_energy", 100.0, "kinetic_energy", 50.0, "potential_energy", 10.0));
            ValidationResult result = resultFor(validate(output, StageType.TRAJECTORY), "energy_conservation");
            assertEquals(Severity.WARNING, result.severity());
            assertEquals(0.5, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("period inconsistent with semi-major axis → Kepler WARNING")
        void keplerDeviation() {
            Map<String, Object> output = Map.of(
                "orbital_elements", Map.of("semi_major_axis", 1.0),
                "orbital_period", 2.0);
            ValidationResult result = resultFor(validate(output, StageType.TRAJECTORY), "kepler_third_law");
            assertEquals(Severity.WARNING, result.severity());
        }
    }

    @Nested
    @DisplayName("impact")
    class Impact {

        @Test
        @DisplayName("plausible impact → valid report")
        void plausibleImpact() {
            Map<String, Object> output = Map.of(
                "impact_energy", Map.of("total_energy_joules", 4.2e16, "total_energy_mt_tnt", 10.0),
                "crater_analysis", Map.of("diameter_km", 1.2),
                "seismic_effects", Map.of("magnitude", 6.1),
                "tsunami_effects", Map.of("max_wave_height_m", 15.0),
                "impact_velocity", 20_000.0);

            ValidationReport report = validate(output, StageType.IMPACT);
            assertTrue(report.isValid());
            assertEquals(6, report.count());
        }

        @Test
        @DisplayName("non-finite value anywhere → exactly one CRITICAL with its path")
        void nonFiniteFlagged() {
            Map<String, Object> energy = new HashMap<>();
            energy.put("total_energy_joules", Double.NaN);
            ValidationReport report = validate(Map.of("impact_energy", energy), StageType.IMPACT);

            assertEquals(1, report.errors().size());
            assertEquals("impact_energy.total_energy_joules", report.errors().get(0).field());
        }

        @Test
        @DisplayName("non-finite values inside lists are reported with an index path")
        void nonFiniteInList() {
            Map<String, Object> output = Map.of("samples", List.of(1.0, Double.POSITIVE_INFINITY));
            ValidationReport report = validate(output, StageType.VISUALIZATION);
            assertEquals("samples[1]", report.errors().get(0).field());
        }
    }

    @Nested
    @DisplayName("mitigation")
    class Mitigation {

        @Test
        @DisplayName("negative cost → CRITICAL, effectiveness in [0, 1] → SUCCESS")
        void negativeCost() {
            Map<String, Object> output = Map.of("strategies", List.of(
                Map.of("name", "kinetic_impactor", "effectiveness", 0.7, "cost", -1.0)));
            ValidationReport report = validate(output, StageType.MITIGATION);

            assertEquals(Severity.SUCCESS, resultFor(report, "strategy_0_effectiveness").severity());
            assertEquals(Severity.CRITICAL, resultFor(report, "strategy_0_cost").severity());
        }

        @Test
        @DisplayName("a strategy that is not a map → CRITICAL")
        void unstructuredStrategy() {
            ValidationReport report = validate(Map.of("strategies", List.of("nuke it")), StageType.MITIGATION);
            assertEquals(Severity.CRITICAL, resultFor(report, "strategy_0").severity());
        }
    }

    @Nested
    @DisplayName("constants and other stages")
    class ConstantsAndDefaults {

        @Test
        @DisplayName("constants within 0.1% succeed, deviating ones are CRITICAL 0.1")
        void constants() {
            Map<String, Object> output = Map.of("constants", Map.of("G", 6.6743e-11, "c", 3.5e8));
            ValidationReport report = validate(output, StageType.TRAJECTORY);

            assertEquals(Severity.SUCCESS, resultFor(report, "G").severity());
            ValidationResult c = resultFor(report, "c");
            assertEquals(Severity.CRITICAL, c.severity());
            assertEquals(0.1, c.confidence(), 1e-9);
        }

        @Test
        @DisplayName("clean output of an unchecked stage type → one SUCCESS result")
        void cleanUnknownStage() {
            ValidationReport report = validate(Map.of("value", 42), StageType.UNKNOWN);
            assertEquals(1, report.count());
            assertTrue(report.isValid());
        }

        @Test
        @DisplayName("report is tagged with stage and validator")
        void tagging() {
            ValidationReport report = validate(Map.of(), StageType.IMPACT);
            assertEquals("impact_analyzer", report.stageName());
            assertEquals(PhysicalPlausibilityValidator.NAME, report.validatorName());
        }
    }

    @Nested
    @DisplayName("checkRange()")
    class CheckRange {

        private final PhysicalRange range = PhysicalRange.of(1e12, 1e25, "J");

        @Test
        @DisplayName("in range → SUCCESS 1.0")
        void inRange() {
            ValidationResult result = validator.checkRange(1e15, range, "energy");
            assertEquals(Severity.SUCCESS, result.severity());
            assertEquals(1.0, result.confidence());
        }

        @Test
        @DisplayName("slightly out of range → WARNING, beyond 10× → CRITICAL")
        void outOfRange() {
            assertEquals(Severity.WARNING, validator.checkRange(5e25, range, "energy").severity());
            assertEquals(Severity.CRITICAL, validator.checkRange(5e26, range, "energy").severity());
            assertEquals(Severity.WARNING, validator.checkRange(5e11, range, "energy").severity());
            assertEquals(Severity.CRITICAL, validator.checkRange(5e10, range, "energy").severity());
        }
    }
}
