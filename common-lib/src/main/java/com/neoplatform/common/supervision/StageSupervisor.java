package com.neoplatform.common.supervision;

import com.neoplatform.common.exception.ValidatorException;
import com.neoplatform.common.model.Finding;
import com.neoplatform.common.model.StageContext;
import com.neoplatform.common.model.StageType;
import com.neoplatform.common.model.ValidationReport;
import com.neoplatform.common.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Supervises one named computation stage with its assigned validators.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Run each validator in list order on a read-only view of the stage output.</li>
 *   <li>A {@link ValidatorException} is contained: the validator is represented by a
 *       synthetic report holding one critical result. Any other exception propagates.</li>
 *   <li>Consolidate: confidence = mean of the reports' confidences, valid iff no report
 *       holds a critical result, findings tagged with their validator.</li>
 *   <li>Build recommendation lines from the decision ladder below plus the stage-type
 *       guidance.</li>
 *   <li>Append to a bounded history; the oldest entry is dropped at capacity.</li>
 * </ol>
 *
 * <h3>Recommendation ladder</h3>
 * <pre>
 *   confidence:  &lt;0.3 CRITICAL · &lt;0.5 HIGH · &lt;0.7 MEDIUM · &lt;0.9 LOW · else EXCELLENT
 *   errors:      &gt;5 CRITICAL · &gt;2 HIGH · &gt;0 MEDIUM
 *   warnings:    &gt;10 MEDIUM · &gt;5 LOW
 * </pre>
 */
public class StageSupervisor {

    private static final Logger log = LoggerFactory.getLogger(StageSupervisor.class);

    public static final int DEFAULT_HISTORY_CAPACITY = 50;

    private final String name;
    private final StageType stageType;
    private final List<Validator> validators;
    private final int historyCapacity;
    private final Deque<StageSupervision> history = new ArrayDeque<>();

    public StageSupervisor(String name, StageType stageType, List<Validator> validators) {
        this(name, stageType, validators, DEFAULT_HISTORY_CAPACITY);
    }

    public StageSupervisor(String name, StageType stageType, List<Validator> validators,
                           int historyCapacity) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stage name must not be blank");
        }
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("historyCapacity must be >= 1, was " + historyCapacity);
        }
        this.name            = name;
        this.stageType       = stageType != null ? stageType : StageType.UNKNOWN;
        this.validators      = List.copyOf(validators);
        this.historyCapacity = historyCapacity;
    }

    public String name() { return name; }

    public StageType stageType() { return stageType; }

    public List<Validator> validators() { return validators; }

    public StageSupervision supervise(Map<String, Object> output, StageContext context) {
        StageContext base = context != null ? context : StageContext.of(name, stageType);
        StageType effectiveType = stageType != StageType.UNKNOWN ? stageType : base.stageType();
        Map<String, Object> readOnly = output != null ? Collections.unmodifiableMap(output) : Map.of();

        log.info("[StageSupervisor] supervising. stage={} type={} validators={}",
            name, effectiveType, validators.size());

        List<ValidationReport> reports = new ArrayList<>(validators.size());
        for (Validator validator : validators) {
            StageContext validatorContext = new StageContext(name, effectiveType, base.runId(),
                base.dataType(), validator.name(), base.attributes());
            try {
                reports.add(validator.validate(readOnly, validatorContext));
            } catch (ValidatorException e) {
                log.warn("[StageSupervisor] validator fault contained. stage={} validator={} reason={}",
                    name, validator.name(), e.getMessage());
                reports.add(ValidationReport.failed(name, validator.name(), validator.kind(), e.getReason()));
            }
        }

        StageSupervision outcome = consolidate(reports, effectiveType);
        record(outcome);

        log.info("[StageSupervisor] done. stage={} confidence={} valid={} errors={} warnings={}",
            name, String.format("%.2f", outcome.overallConfidence()), outcome.valid(),
            outcome.errors().size(), outcome.warnings().size());
        return outcome;
    }

    private StageSupervision consolidate(List<ValidationReport> reports, StageType effectiveType) {
        double confidence = reports.stream()
            .mapToDouble(ValidationReport::overallConfidence)
            .average()
            .orElse(0.0);
        boolean valid = reports.stream().allMatch(ValidationReport::isValid);

        List<Finding> errors = new ArrayList<>();
        List<Finding> warnings = new ArrayList<>();
        for (ValidationReport report : reports) {
            report.errors().forEach(r -> errors.add(Finding.from(r, report.validatorName())));
            report.warnings().forEach(r -> warnings.add(Finding.from(r, report.validatorName())));
        }

        List<String> recommendations = recommendations(confidence, errors.size(), warnings.size(), effectiveType);
        return new StageSupervision(name, effectiveType, reports, confidence, valid,
            errors, warnings, recommendations, Instant.now());
    }

    static List<String> recommendations(double confidence, int errors, int warnings, StageType type) {
        List<String> lines = new ArrayList<>();

        if (confidence < 0.3)      lines.add("CRITICAL: Extremely low confidence, full review required");
        else if (confidence < 0.5) lines.add("HIGH: Low confidence, verify the main calculations");
        else if (confidence < 0.7) lines.add("MEDIUM: Moderate confidence, review warnings");
        else if (confidence < 0.9) lines.add("LOW: Good confidence, refine details");
        else                       lines.add("EXCELLENT: High confidence, continue");

        if (errors > 5)      lines.add("CRITICAL: Too many errors, stop execution");
        else if (errors > 2) lines.add("HIGH: Multiple errors, review before continuing");
        else if (errors > 0) lines.add("MEDIUM: Errors detected, fix before continuing");

        if (warnings > 10)     lines.add("MEDIUM: Many warnings, review data quality");
        else if (warnings > 5) lines.add("LOW: Several warnings, verify inputs");

        lines.addAll(type.guidance());
        return lines;
    }

    private void record(StageSupervision outcome) {
        history.addLast(outcome);
        if (history.size() > historyCapacity) {
            history.removeFirst();
        }
    }

    /** Most recent {@code limit} supervisions, oldest first. */
    public List<StageSupervision> history(int limit) {
        if (limit <= 0) return List.of();
        return history.stream()
            .skip(Math.max(0, history.size() - limit))
            .toList();
    }

    public StagePerformance performanceSummary() {
        int total = history.size();
        if (total == 0) {
            return StagePerformance.empty(name);
        }
        int valid = 0;
        double confidenceSum = 0.0;
        int errors = 0;
        int warnings = 0;
        for (StageSupervision s : history) {
            if (s.valid()) valid++;
            confidenceSum += s.overallConfidence();
            errors   += s.errors().size();
            warnings += s.warnings().size();
        }
        return new StagePerformance(name, total, valid, (double) valid / total,
            confidenceSum / total, errors, warnings,
            (double) errors / total, (double) warnings / total);
    }
}
