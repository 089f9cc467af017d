package com.neoplatform.common.validation;

import com.neoplatform.common.exception.ValidatorException;
import com.neoplatform.common.model.Severity;
import com.neoplatform.common.model.StageContext;
import com.neoplatform.common.model.ValidationReport;
import com.neoplatform.common.model.ValidationResult;
import com.neoplatform.common.model.ValidatorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class shared by the three validator variants.
 *
 * <p>{@link #validate} is a template method: it creates the report, delegates to
 * {@link #doValidate}, and converts any runtime failure inside the variant's own logic
 * into a {@link ValidatorException} so the supervisor can contain it.
 *
 * <p>Also exposes the two declarative helpers the variants are written in terms of:
 * {@link #checkRange} and {@link #checkRequiredFields}.
 */
public abstract class AbstractValidator implements Validator {

    private static final Logger log = LoggerFactory.getLogger(AbstractValidator.class);

    /** Marks a path segment that does not exist, as opposed to one mapped to {@code null}. */
    private static final Object MISSING = new Object();

    static final double OUT_OF_RANGE_CONFIDENCE = 0.3;

    private final String name;
    private final ValidatorKind kind;

    protected AbstractValidator(String name, ValidatorKind kind) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Override
    public String name() { return name; }

    @Override
    public ValidatorKind kind() { return kind; }

    @Override
    public final ValidationReport validate(Map<String, Object> stageOutput, StageContext context) {
        String stageName = context.stageName() != null ? context.stageName() : "unknown";
        ValidationReport report = new ValidationReport(stageName, name, kind);
        Map<String, Object> data = stageOutput != null ? stageOutput : Map.of();
        try {
            doValidate(data, context, report);
        } catch (ValidatorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ValidatorException(name,
                e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
        log.debug("[{}] stage={} type={} checks={} confidence={}",
            name, stageName, context.stageType(), report.count(), report.overallConfidence());
        return report;
    }

    protected abstract void doValidate(Map<String, Object> output, StageContext context,
                                       ValidationReport report);

    // ── shared helpers ────────────────────────────────────────────────────────

    /**
     * Checks {@code value} against {@code range}.
     * In range → SUCCESS (1.0); gross violation → CRITICAL (0.3); otherwise WARNING (0.3).
     */
    public ValidationResult checkRange(double value, PhysicalRange range, String field) {
        String observed = (value + " " + range.unit()).trim();
        if (range.contains(value)) {
            return ValidationResult.of(Severity.SUCCESS,
                "Value of " + field + " within expected range", field, null, observed, 1.0);
        }
        Severity severity = range.isGrossViolation(value) ? Severity.CRITICAL : Severity.WARNING;
        return ValidationResult.of(severity,
            "Value of " + field + " outside expected range", field,
            range.describe(), observed, OUT_OF_RANGE_CONFIDENCE);
    }

    /**
     * One result per required field: SUCCESS (1.0) when present and usable,
     * CRITICAL (0.0) when missing, null or a non-finite number. Dotted names address nested maps.
     */
    public List<ValidationResult> checkRequiredFields(Map<String, Object> data, List<String> fields) {
        List<ValidationResult> results = new ArrayList<>(fields.size());
        for (String field : fields) {
            Object value = resolvePath(data, field);
            if (value == MISSING) {
                results.add(ValidationResult.critical("Required field '" + field + "' not found", field));
            } else if (value == null) {
                results.add(ValidationResult.critical("Required field '" + field + "' is null", field));
            } else if (isNonFinite(value)) {
                results.add(ValidationResult.of(Severity.CRITICAL,
                    "Required field '" + field + "' is not finite", field, "finite number", value, 0.0));
            } else {
                results.add(ValidationResult.success("Field '" + field + "' present and valid", field));
            }
        }
        return results;
    }

    /**
     * Compares a computed value with a known reference value.
     * Relative error within {@code tolerance} → SUCCESS (1.0); otherwise CRITICAL (0.1).
     */
    public ValidationResult checkReferenceValue(double value, double expected, double tolerance,
                                                String constantName) {
        double relativeError = Math.abs(value - expected) / Math.abs(expected);
        if (relativeError <= tolerance) {
            return ValidationResult.of(Severity.SUCCESS,
                "Constant " + constantName + " matches reference value", constantName,
                null, value, 1.0);
        }
        return ValidationResult.of(Severity.CRITICAL,
            "Constant " + constantName + " deviates from reference value", constantName,
            expected, value, 0.1);
    }

    // ── data access ───────────────────────────────────────────────────────────

    /** Reads a nested value addressed by a dotted path; {@code null} when absent or null. */
    protected static Object lookup(Map<String, Object> data, String path) {
        Object value = resolvePath(data, path);
        return value == MISSING ? null : value;
    }

    @SuppressWarnings("unchecked")
    private static Object resolvePath(Map<String, Object> data, String path) {
        Object current = data;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return MISSING;
            }
            current = ((Map<String, Object>) map).get(segment);
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    protected static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    protected static List<?> asList(Object value) {
        return value instanceof List<?> list ? list : null;
    }

    /**
     * Interprets numbers and numeric strings; returns {@code null} for anything else.
     */
    protected static Double parseNumber(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean isNonFinite(Object value) {
        Double number = parseNumber(value);
        return number != null && !Double.isFinite(number);
    }

    /**
     * Reads {@code raw} as a number. A present but non-numeric value is a structural
     * fault and is recorded as a critical result; the method then returns {@code null}.
     */
    protected static Double readNumber(Object raw, String field, ValidationReport report) {
        if (raw == null) return null;
        Double number = parseNumber(raw);
        if (number == null) {
            report.addResult(ValidationResult.of(Severity.CRITICAL,
                "Field " + field + " is not numeric", field, "number", raw, 0.0));
        }
        return number;
    }

    /**
     * Range-checks {@code raw} if it is a finite number. Non-finite numbers are left to
     * the non-finite scan so they are reported once.
     */
    protected void addRangeCheck(Object raw, PhysicalRange range, String field, ValidationReport report) {
        Double value = readNumber(raw, field, report);
        if (value != null && Double.isFinite(value)) {
            report.addResult(checkRange(value, range, field));
        }
    }
}
