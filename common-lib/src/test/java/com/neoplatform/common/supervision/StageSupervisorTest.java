package com.neoplatform.common.supervision;

import com.neoplatform.common.exception.ValidatorException;
import com.neoplatform.common.model.Severity;
import com.neoplatform.common.model.StageContext;
import com.neoplatform.common.model.StageType;
import com.neoplatform.common.model.ValidationReport;
import com.neoplatform.common.model.ValidationResult;
import com.neoplatform.common.model.ValidatorKind;
import com.neoplatform.common.validation.AbstractValidator;
import com.neoplatform.common.validation.DataCompletenessValidator;
import com.neoplatform.common.validation.Validator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StageSupervisorTest {

    /** Emits one result per given confidence; below 0.5 → CRITICAL, below 0.7 → WARNING. */
    static final class FixedValidator extends AbstractValidator {
        private final double[] confidences;

        FixedValidator(String name, double... confidences) {
            super(name, ValidatorKind.PHYSICAL);
            this.confidences = confidences;
        }

        @Override
        protected void doValidate(Map<String, Object> output, StageContext context, ValidationReport report) {
            for (double c : confidences) {
                Severity severity = c < 0.5 ? Severity.CRITICAL : c < 0.7 ? Severity.WARNING : Severity.SUCCESS;
                report.addResult(ValidationResult.of(severity, "fixed " + c, "field", null, null, c));
            }
        }
    }

    /** Tries to write into the stage output. */
    static final class MutatingValidator extends AbstractValidator {
        MutatingValidator() {
            super("Mutating", ValidatorKind.COMPLETENESS);
        }

        @Override
        protected void doValidate(Map<String, Object> output, StageContext context, ValidationReport report) {
            output.put("injected", true);
        }
    }

    /** Throws outside the validator fault contract. */
    static final class RogueValidator implements Validator {
        @Override public String name() { return "Rogue"; }
        @Override public ValidatorKind kind() { return ValidatorKind.PHYSICAL; }
        @Override public ValidationReport validate(Map<String, Object> stageOutput, StageContext context) {
            throw new IllegalStateException("unexpected");
        }
    }

    /** Signals an expected validator fault directly. */
    static final class FailingValidator implements Validator {
        @Override public String name() { return "Failing"; }
        @Override public ValidatorKind kind() { return ValidatorKind.COHERENCE; }
        @Override public ValidationReport validate(Map<String, Object> stageOutput, StageContext context) {
            throw new ValidatorException(name(), "knowledge base unavailable");
        }
    }

    private static StageSupervisor supervisor(Validator... validators) {
        return new StageSupervisor("trajectory", StageType.TRAJECTORY, List.of(validators));
    }

    @Nested
    @DisplayName("fault containment")
    class FaultContainment {

        @Test
        @DisplayName("a failing validator becomes a critical report, the others still run")
        void failingValidatorContained() {
            StageSupervision outcome = supervisor(new FailingValidator(), new FixedValidator("Ok", 1.0))
                .supervise(Map.of(), null);

            assertEquals(2, outcome.reports().size());
            ValidationReport failed = outcome.reports().get(0);
            assertEquals("Failing", failed.validatorName());
            assertEquals(ValidatorKind.COHERENCE, failed.kind());
            assertEquals("Validator Failing failed: knowledge base unavailable",
                failed.results().get(0).message());
            assertFalse(outcome.valid());
            assertEquals(0.5, outcome.overallConfidence(), 1e-9);
        }

        @Test
        @DisplayName("runtime failures inside a validator's logic are contained the same way")
        void runtimeFailureWrapped() {
            Map<String, Object> output = new HashMap<>(Map.of("a", 1));
            StageSupervision outcome = supervisor(new MutatingValidator()).supervise(output, null);

            assertFalse(outcome.valid());
            assertEquals("Mutating", outcome.errors().get(0).validator());
            assertEquals(Map.of("a", 1), output);
        }

        @Test
        @DisplayName("exceptions outside the validator fault contract propagate")
        void unexpectedPropagates() {
            StageSupervisor supervisor = supervisor(new RogueValidator());
            assertThrows(IllegalStateException.class, () -> supervisor.supervise(Map.of(), null));
        }
    }

    @Nested
    @DisplayName("consolidation")
    class Consolidation {

        @Test
        @DisplayName("confidence is the mean of report confidences, findings carry their validator")
        void consolidate() {
            StageSupervision outcome = supervisor(
                    new FixedValidator("A", 1.0, 0.6),
                    new FixedValidator("B", 0.2))
                .supervise(Map.of(), StageContext.of("trajectory", StageType.TRAJECTORY));

            assertEquals((0.8 + 0.2) / 2, outcome.overallConfidence(), 1e-9);
            assertFalse(outcome.valid());
            assertEquals(1, outcome.errors().size());
            assertEquals("B", outcome.errors().get(0).validator());
            assertEquals(1, outcome.warnings().size());
            assertEquals("A", outcome.warnings().get(0).validator());
        }

        @Test
        @DisplayName("validators see the supervisor's stage type and their own name")
        void contextPropagation() {
            StageSupervisor supervisor = new StageSupervisor("data_collector", StageType.DATA_COLLECTION,
                List.of(new DataCompletenessValidator()));

            StageSupervision outcome = supervisor.supervise(Map.of("id", "1"),
                StageContext.of("whatever", StageType.UNKNOWN));

            assertEquals(StageType.DATA_COLLECTION, outcome.stageType());
            assertEquals(9, outcome.reports().get(0).count());
            assertEquals("data_collector", outcome.reports().get(0).stageName());
        }

        @Test
        @DisplayName("no validators → confidence 0.0, valid")
        void noValidators() {
            StageSupervision outcome = supervisor().supervise(Map.of(), null);
            assertEquals(0.0, outcome.overallConfidence());
            assertTrue(outcome.valid());
            assertTrue(outcome.reports().isEmpty());
        }
    }

    @Nested
    @DisplayName("recommendations")
    class Recommendations {

        @Test
        @DisplayName("high confidence, no findings → EXCELLENT plus stage guidance")
        void excellent() {
            List<String> lines = StageSupervisor.recommendations(0.95, 0, 0, StageType.DATA_COLLECTION);
            assertEquals(List.of(
                "EXCELLENT: High confidence, continue",
                "Verify connectivity with external data APIs",
                "Validate the format of received data"), lines);
        }

        @Test
        @DisplayName("ladder picks one line per dimension")
        void ladder() {
            List<String> lines = StageSupervisor.recommendations(0.2, 6, 11, StageType.UNKNOWN);
            assertEquals(3, lines.size());
            assertTrue(lines.get(0).startsWith("CRITICAL: Extremely low confidence"));
            assertTrue(lines.get(1).startsWith("CRITICAL: Too many errors"));
            assertTrue(lines.get(2).startsWith("MEDIUM: Many warnings"));

            List<String> moderate = StageSupervisor.recommendations(0.65, 1, 6, StageType.UNKNOWN);
            assertEquals(List.of(
                "MEDIUM: Moderate confidence, review warnings",
                "MEDIUM: Errors detected, fix before continuing",
                "LOW: Several warnings, verify inputs"), moderate);
        }
    }

    @Nested
    @DisplayName("history and performance")
    class HistoryAndPerformance {

        @Test
        @DisplayName("ring buffer drops the oldest outcome at capacity")
        void ringBuffer() {
            StageSupervisor supervisor = new StageSupervisor("trajectory", StageType.TRAJECTORY,
                List.of(new FixedValidator("A", 1.0)), 2);
            for (int i = 0; i < 3; i++) {
                supervisor.supervise(Map.of(), null);
            }
            assertEquals(2, supervisor.history(10).size());
            assertEquals(1, supervisor.history(1).size());
            assertTrue(supervisor.history(0).isEmpty());
        }

        @Test
        @DisplayName("empty history → empty performance summary")
        void emptySummary() {
            StagePerformance summary = supervisor(new FixedValidator("A", 1.0)).performanceSummary();
            assertFalse(summary.hasHistory());
            assertEquals(0.0, summary.successRate());
        }

        @Test
        @DisplayName("summary aggregates validity, confidence and finding rates")
        void summary() {
            StageSupervisor good = supervisor(new FixedValidator("A", 1.0));
            good.supervise(Map.of(), null);

            StageSupervisor mixed = new StageSupervisor("trajectory", StageType.TRAJECTORY,
                List.of(new FixedValidator("A", 1.0, 0.6, 0.2)));
            mixed.supervise(Map.of(), null);
            mixed.supervise(Map.of(), null);

            StagePerformance perf = mixed.performanceSummary();
            assertEquals(2, perf.totalSupervisions());
            assertEquals(0, perf.validSupervisions());
            assertEquals(0.0, perf.successRate());
            assertEquals(0.6, perf.averageConfidence(), 1e-9);
            assertEquals(2, perf.totalErrors());
            assertEquals(1.0, perf.warningRate(), 1e-9);

            assertEquals(1.0, good.performanceSummary().successRate());
        }

        @Test
        @DisplayName("invalid construction arguments are rejected")
        void invalidArguments() {
            assertThrows(IllegalArgumentException.class,
                () -> new StageSupervisor(" ", StageType.IMPACT, List.of()));
            assertThrows(IllegalArgumentException.class,
                () -> new StageSupervisor("impact_analyzer", StageType.IMPACT, List.of(), 0));
        }
    }
}
