package com.neoplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Roll-up of every {@link ValidationResult} one validator produced for one stage output.
 *
 * <h3>Derived values</h3>
 * <ul>
 *   <li>{@code overallConfidence}: arithmetic mean of all result confidences,
 *       recomputed on every insertion; 0.0 while the report is empty.</li>
 *   <li>{@code valid}: true iff the report holds no {@link Severity#CRITICAL} result.
 *       An empty report is valid by convention ("nothing checked yet").</li>
 * </ul>
 *
 * <p>Results keep their insertion order. The report is append-only: results can be added
 * but never removed or replaced.
 */
public final class ValidationReport {

    private final String stageName;
    private final String validatorName;
    private final ValidatorKind kind;
    private final Instant timestamp;
    private final List<ValidationResult> results = new ArrayList<>();

    private double overallConfidence;
    private int criticalCount;

    public ValidationReport(String stageName, String validatorName, ValidatorKind kind) {
        this.stageName     = Objects.requireNonNull(stageName, "stageName");
        this.validatorName = Objects.requireNonNull(validatorName, "validatorName");
        this.kind          = Objects.requireNonNull(kind, "kind");
        this.timestamp     = Instant.now();
    }

    /**
     * Synthetic report standing in for a validator that failed to run.
     * Holds exactly one critical result with confidence 0.0.
     */
    public static ValidationReport failed(String stageName, String validatorName,
                                          ValidatorKind kind, String reason) {
        ValidationReport report = new ValidationReport(stageName, validatorName, kind);
        report.addResult(ValidationResult.of(Severity.CRITICAL,
            "Validator " + validatorName + " failed: " + reason, null, null, null, 0.0));
        return report;
    }

    public void addResult(ValidationResult result) {
        Objects.requireNonNull(result, "result");
        results.add(result);
        if (result.isCritical()) criticalCount++;

        double total = 0.0;
        for (ValidationResult r : results) {
            total += r.confidence();
        }
        overallConfidence = total / results.size();
    }

    public void addResults(List<ValidationResult> batch) {
        batch.forEach(this::addResult);
    }

    @JsonProperty("stageName")
    public String stageName() { return stageName; }

    @JsonProperty("validatorName")
    public String validatorName() { return validatorName; }

    @JsonProperty("kind")
    public ValidatorKind kind() { return kind; }

    @JsonProperty("timestamp")
    public Instant timestamp() { return timestamp; }

    @JsonProperty("results")
    public List<ValidationResult> results() {
        return Collections.unmodifiableList(results);
    }

    @JsonProperty("overallConfidence")
    public double overallConfidence() { return overallConfidence; }

    @JsonProperty("valid")
    public boolean isValid() { return criticalCount == 0; }

    @JsonProperty("count")
    public int count() { return results.size(); }

    @JsonIgnore
    public boolean isEmpty() { return results.isEmpty(); }

    public List<ValidationResult> errors() {
        return results.stream().filter(ValidationResult::isCritical).toList();
    }

    public List<ValidationResult> warnings() {
        return results.stream().filter(ValidationResult::isWarning).toList();
    }

    public ReportSummary summary() {
        return new ReportSummary(stageName, validatorName, isValid(), overallConfidence,
                                 results.size(), criticalCount, warnings().size(), timestamp);
    }

    @Override
    public String toString() {
        return "ValidationReport[stage=" + stageName + ", validator=" + validatorName
            + ", count=" + results.size() + ", confidence=" + String.format("%.3f", overallConfidence)
            + ", valid=" + isValid() + "]";
    }

    /**
     * Flat summary of a report, suitable for logging and dashboards.
     */
    public record ReportSummary(
        @JsonProperty("stageName")         String stageName,
        @JsonProperty("validatorName")     String validatorName,
        @JsonProperty("valid")             boolean valid,
        @JsonProperty("confidence")        double confidence,
        @JsonProperty("totalValidations")  int totalValidations,
        @JsonProperty("errors")            int errors,
        @JsonProperty("warnings")          int warnings,
        @JsonProperty("timestamp")         Instant timestamp
    ) {}
}
