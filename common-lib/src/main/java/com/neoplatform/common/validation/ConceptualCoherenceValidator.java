package com.neoplatform.common.validation;

import com.neoplatform.common.model.Severity;
import com.neoplatform.common.model.StageContext;
import com.neoplatform.common.model.ValidationReport;
import com.neoplatform.common.model.ValidationResult;
import com.neoplatform.common.model.ValidatorKind;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Scores narrative and structured-narrative stage output against {@link ReferenceKnowledge}.
 *
 * <h3>Checks by stage type</h3>
 * <ul>
 *   <li>EXPLANATION: technical coherence (≥ 0.7), audience adaptation (≥ 0.6),
 *       scientific accuracy (≥ 0.8)</li>
 *   <li>MITIGATION: each strategy looked up in the knowledge base; known strategies are
 *       scored by feasibility (≥ 0.5), unknown ones are a warning</li>
 *   <li>VISUALIZATION: descriptor completeness (≥ 0.8), metadata consistency (≥ 0.7)</li>
 *   <li>any other type: general coherence of a {@code content} text (≥ 0.7)</li>
 * </ul>
 * A score at or above its threshold is SUCCESS, below it WARNING; the score itself is the
 * result's confidence. A missing primary field is CRITICAL.
 */
public class ConceptualCoherenceValidator extends AbstractValidator {

    public static final String NAME = "ConceptualCoherenceValidator";

    static final double COHERENCE_THRESHOLD          = 0.7;
    static final double SCIENTIFIC_ACCURACY_THRESHOLD = 0.8;
    static final double AUDIENCE_THRESHOLD           = 0.6;
    static final double FEASIBILITY_THRESHOLD        = 0.5;
    static final double DESCRIPTOR_THRESHOLD         = 0.8;
    static final double METADATA_THRESHOLD           = 0.7;

    static final double ACCURACY_BASELINE            = 0.85;
    static final double OVERCLAIM_PENALTY            = 0.1;
    static final double UNKNOWN_STRATEGY_CONFIDENCE  = 0.3;

    private final ReferenceKnowledge knowledge;

    public ConceptualCoherenceValidator() {
        this(ReferenceKnowledge.defaults());
    }

    public ConceptualCoherenceValidator(ReferenceKnowledge knowledge) {
        super(NAME, ValidatorKind.COHERENCE);
        this.knowledge = knowledge;
    }

    @Override
    protected void doValidate(Map<String, Object> output, StageContext context, ValidationReport report) {
        switch (context.stageType()) {
            case EXPLANATION   -> validateExplanation(output, report);
            case MITIGATION    -> validateMitigation(output, report);
            case VISUALIZATION -> validateVisualization(output, report);
            default            -> validateGeneral(output, report);
        }
    }

    private void validateExplanation(Map<String, Object> data, ValidationReport report) {
        if (!(data.get("explanation_text") instanceof String text)) {
            report.addResult(ValidationResult.critical("Explanation text not found", "explanation_text"));
            return;
        }

        report.addResult(scored(terminologyCoverage(text), COHERENCE_THRESHOLD,
            "technical_coherence", "Technical coherence"));

        Object audience = data.getOrDefault("target_audience", "general");
        report.addResult(scored(audienceAdaptation(String.valueOf(audience)), AUDIENCE_THRESHOLD,
            "audience_adaptation", "Audience adaptation"));

        report.addResult(scored(scientificAccuracy(text), SCIENTIFIC_ACCURACY_THRESHOLD,
            "scientific_accuracy", "Scientific accuracy"));
    }

    private void validateMitigation(Map<String, Object> data, ValidationReport report) {
        List<?> strategies = asList(data.get("strategies"));
        if (strategies == null) {
            report.addResult(ValidationResult.critical("Mitigation strategies not found", "strategies"));
            return;
        }

        for (int i = 0; i < strategies.size(); i++) {
            Map<String, Object> strategy = asMap(strategies.get(i));
            Object rawName = strategy != null ? strategy.get("name") : null;
            String name = rawName != null ? String.valueOf(rawName) : "strategy_" + i;

            Optional<ReferenceKnowledge.KnownStrategy> known = knowledge.findStrategy(name);
            if (known.isPresent()) {
                double feasibility = known.get().feasibility().score();
                boolean viable = feasibility >= FEASIBILITY_THRESHOLD;
                report.addResult(ValidationResult.of(
                    viable ? Severity.SUCCESS : Severity.WARNING,
                    viable ? "Strategy " + name + " is technically feasible"
                           : "Strategy " + name + " has questionable feasibility",
                    "strategy_" + i + "_feasibility", null, known.get().feasibility(), feasibility));
            } else {
                report.addResult(ValidationResult.of(Severity.WARNING,
                    "Strategy " + name + " not found in knowledge base",
                    "strategy_" + i + "_unknown", null, name, UNKNOWN_STRATEGY_CONFIDENCE));
            }
        }
    }

    private void validateVisualization(Map<String, Object> data, ValidationReport report) {
        Map<String, Object> charts = asMap(data.get("charts"));
        if (charts == null) {
            report.addResult(ValidationResult.critical("Visualization descriptors not found", "charts"));
            return;
        }

        report.addResult(scored(descriptorCompleteness(charts), DESCRIPTOR_THRESHOLD,
            "descriptor_completeness", "Descriptor completeness"));

        Map<String, Object> metadata = asMap(data.get("metadata"));
        report.addResult(scored(metadataConsistency(metadata, charts.size()), METADATA_THRESHOLD,
            "metadata_consistency", "Metadata consistency"));
    }

    private void validateGeneral(Map<String, Object> data, ValidationReport report) {
        if (data.get("content") instanceof String content) {
            report.addResult(scored(generalCoherence(content), COHERENCE_THRESHOLD,
                "general_coherence", "General coherence"));
        }
    }

    private static ValidationResult scored(double score, double threshold, String field, String label) {
        boolean ok = score >= threshold;
        return ValidationResult.of(ok ? Severity.SUCCESS : Severity.WARNING,
            String.format("%s %s: %.2f", label, ok ? "adequate" : "low", score),
            field, threshold, score, score);
    }

    // ── scoring heuristics ────────────────────────────────────────────────────

    /** Share of reference terms that occur in {@code text}, in [0, 1]. */
    double terminologyCoverage(String text) {
        List<String> terms = knowledge.technicalTerms();
        if (terms.isEmpty()) return 1.0;
        String lower = text.toLowerCase(Locale.ROOT);
        long found = terms.stream().filter(lower::contains).count();
        return Math.min((double) found / terms.size(), 1.0);
    }

    double audienceAdaptation(String audience) {
        return switch (audience.toLowerCase(Locale.ROOT)) {
            case "general"    -> 0.8;
            case "scientific" -> 0.9;
            default           -> 0.7;
        };
    }

    double scientificAccuracy(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        long overclaims = knowledge.overclaimingPhrases().stream().filter(lower::contains).count();
        return Math.max(0.0, ACCURACY_BASELINE - overclaims * OVERCLAIM_PENALTY);
    }

    /** Share of chart descriptors that declare both a {@code type} and {@code data}. */
    double descriptorCompleteness(Map<String, Object> charts) {
        if (charts.isEmpty()) return 0.0;
        long complete = charts.values().stream()
            .map(AbstractValidator::asMap)
            .filter(chart -> chart != null && chart.get("type") != null && chart.get("data") != null)
            .count();
        return (double) complete / charts.size();
    }

    /** 1.0 when the declared visualization count matches, 0.5 when undeclared, 0.0 on mismatch. */
    double metadataConsistency(Map<String, Object> metadata, int chartCount) {
        if (metadata == null) return 0.5;
        Double declared = parseNumber(metadata.get("total_visualizations"));
        if (declared == null) return 0.5;
        return declared.intValue() == chartCount ? 1.0 : 0.0;
    }

    /** Terminology coverage, floored at 0.5 for any non-blank text. */
    double generalCoherence(String content) {
        if (content.isBlank()) return 0.0;
        return Math.max(0.5, terminologyCoverage(content));
    }
}
