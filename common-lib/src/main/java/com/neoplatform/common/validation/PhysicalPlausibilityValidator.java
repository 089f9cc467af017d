package com.neoplatform.common.validation;

import com.neoplatform.common.model.Severity;
import com.neoplatform.common.model.StageContext;
import com.neoplatform.common.model.ValidationReport;
import com.neoplatform.common.model.ValidationResult;
import com.neoplatform.common.model.ValidatorKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks numeric stage output against known physical ranges and constants.
 *
 * <h3>Checks by stage type</h3>
 * <ul>
 *   <li>TRAJECTORY: orbital elements, period, velocity, energy conservation
 *       (1% tolerance) and Kepler's third law (10% tolerance)</li>
 *   <li>IMPACT: impact energy (J and Mt TNT), crater diameter, seismic magnitude,
 *       tsunami wave height, impact velocity</li>
 *   <li>MITIGATION: strategy effectiveness in [0, 1], non-negative cost</li>
 *   <li>any other type: non-finite scan only</li>
 * </ul>
 *
 * <p>For every stage type the whole output is scanned recursively and each non-finite
 * number is reported as CRITICAL. A {@code constants} block, when present, is compared
 * with reference SI values within 0.1%.
 */
public class PhysicalPlausibilityValidator extends AbstractValidator {

    public static final String NAME = "PhysicalPlausibilityValidator";

    static final double ENERGY_CONSERVATION_TOLERANCE = 0.01;
    static final double KEPLER_TOLERANCE              = 0.10;
    static final double CONSTANT_TOLERANCE            = 0.001;

    static final Map<String, PhysicalRange> RANGES = Map.ofEntries(
        Map.entry("orbital_period",      PhysicalRange.of(0.1, 1000, "years")),
        Map.entry("eccentricity",        PhysicalRange.halfOpen(0, 0.999, "")),
        Map.entry("inclination",         PhysicalRange.of(0, 180, "deg")),
        Map.entry("semi_major_axis",     PhysicalRange.of(0.1, 100, "AU")),
        Map.entry("velocity",            PhysicalRange.of(1e3, 1e5, "m/s")),
        Map.entry("kinetic_energy",      PhysicalRange.of(1e12, 1e25, "J")),
        Map.entry("impact_velocity",     PhysicalRange.of(11e3, 72e3, "m/s")),
        Map.entry("energy_mt_tnt",       PhysicalRange.of(0.001, 10000, "Mt TNT")),
        Map.entry("crater_diameter_km",  PhysicalRange.of(0.1, 1000, "km")),
        Map.entry("seismic_magnitude",   PhysicalRange.of(0, 10, "Richter")),
        Map.entry("max_wave_height_m",   PhysicalRange.of(0, 1000, "m")),
        Map.entry("effectiveness",       PhysicalRange.of(0, 1, ""))
    );

    /** Reference SI values of the physical constants an output may echo back. */
    static final Map<String, Double> CONSTANTS = new LinkedHashMap<>();
    static {
        CONSTANTS.put("G",       6.67430e-11);
        CONSTANTS.put("M_earth", 5.972e24);
        CONSTANTS.put("R_earth", 6.371e6);
        CONSTANTS.put("AU",      1.496e11);
        CONSTANTS.put("c",       2.998e8);
    }

    public PhysicalPlausibilityValidator() {
        super(NAME, ValidatorKind.PHYSICAL);
    }

    @Override
    protected void doValidate(Map<String, Object> output, StageContext context, ValidationReport report) {
        scanNonFinite(output, "", report);

        switch (context.stageType()) {
            case TRAJECTORY -> validateTrajectory(output, report);
            case IMPACT     -> validateImpact(output, report);
            case MITIGATION -> validateMitigation(output, report);
            default         -> {
                if (report.isValid()) {
                    report.addResult(ValidationResult.success(
                        "No non-finite numeric values found", null));
                }
            }
        }

        Map<String, Object> constants = asMap(output.get("constants"));
        if (constants != null) {
            validateConstants(constants, report);
        }
    }

    private void validateTrajectory(Map<String, Object> data, ValidationReport report) {
        Map<String, Object> elements = asMap(data.get("orbital_elements"));
        Double semiMajorAxis = null;
        if (elements != null) {
            addRangeCheck(elements.get("semi_major_axis"), RANGES.get("semi_major_axis"), "semi_major_axis", report);
            addRangeCheck(elements.get("eccentricity"), RANGES.get("eccentricity"), "eccentricity", report);
            addRangeCheck(elements.get("inclination"), RANGES.get("inclination"), "inclination", report);
            semiMajorAxis = parseNumber(elements.get("semi_major_axis"));
        }

        addRangeCheck(data.get("orbital_period"), RANGES.get("orbital_period"), "orbital_period", report);
        addRangeCheck(data.get("orbital_velocity"), RANGES.get("velocity"), "orbital_velocity", report);

        Map<String, Object> energy = asMap(data.get("energy_analysis"));
        if (energy != null) {
            validateEnergyConservation(energy, report);
        }

        Double period = parseNumber(data.get("orbital_period"));
        if (period != null && semiMajorAxis != null) {
            validateKeplerThirdLaw(period, semiMajorAxis, report);
        }
    }

    private void validateImpact(Map<String, Object> data, ValidationReport report) {
        Map<String, Object> energy = asMap(data.get("impact_energy"));
        if (energy != null) {
            addRangeCheck(energy.get("total_energy_joules"), RANGES.get("kinetic_energy"),
                "total_energy_joules", report);
            addRangeCheck(energy.get("total_energy_mt_tnt"), RANGES.get("energy_mt_tnt"),
                "total_energy_mt_tnt", report);
        }

        Map<String, Object> crater = asMap(data.containsKey("crater_analysis")
            ? data.get("crater_analysis") : data.get("crater_size"));
        if (crater != null) {
            addRangeCheck(crater.get("diameter_km"), RANGES.get("crater_diameter_km"),
                "crater_diameter_km", report);
        }

        Map<String, Object> seismic = asMap(data.get("seismic_effects"));
        if (seismic != null) {
            addRangeCheck(seismic.get("magnitude"), RANGES.get("seismic_magnitude"),
                "seismic_magnitude", report);
        }

        Map<String, Object> tsunami = asMap(data.get("tsunami_effects"));
        if (tsunami != null) {
            addRangeCheck(tsunami.get("max_wave_height_m"), RANGES.get("max_wave_height_m"),
                "max_wave_height_m", report);
        }

        addRangeCheck(data.get("impact_velocity"), RANGES.get("impact_velocity"), "impact_velocity", report);
    }

    private void validateMitigation(Map<String, Object> data, ValidationReport report) {
        List<?> strategies = asList(data.get("strategies"));
        if (strategies == null) return;

        for (int i = 0; i < strategies.size(); i++) {
            Map<String, Object> strategy = asMap(strategies.get(i));
            String prefix = "strategy_" + i;
            if (strategy == null) {
                report.addResult(ValidationResult.critical(
                    "Strategy " + i + " is not a structured entry", prefix));
                continue;
            }
            addRangeCheck(strategy.get("effectiveness"), RANGES.get("effectiveness"),
                prefix + "_effectiveness", report);

            Double cost = readNumber(strategy.get("cost"), prefix + "_cost", report);
            if (cost != null && cost < 0) {
                report.addResult(ValidationResult.of(Severity.CRITICAL,
                    "Cost of strategy " + i + " cannot be negative", prefix + "_cost", ">= 0", cost, 0.0));
            }
        }
    }

    private void validateEnergyConservation(Map<String, Object> energy, ValidationReport report) {
        Double total     = parseNumber(energy.get("total_energy"));
        Double kinetic   = parseNumber(energy.get("kinetic_energy"));
        Double potential = parseNumber(energy.get("potential_energy"));
        if (total == null || kinetic == null || potential == null) return;
        if (!Double.isFinite(total) || !Double.isFinite(kinetic) || !Double.isFinite(potential)) return;

        double relativeError = total != 0.0
            ? Math.abs(total - (kinetic + potential)) / Math.abs(total)
            : Double.POSITIVE_INFINITY;

        if (relativeError <= ENERGY_CONSERVATION_TOLERANCE) {
            report.addResult(ValidationResult.success("Energy conservation verified", "energy_conservation"));
        } else {
            report.addResult(ValidationResult.of(Severity.WARNING,
                String.format("Energy conservation error: %.2f%%", relativeError * 100),
                "energy_conservation",
                String.format("error < %.1f%%", ENERGY_CONSERVATION_TOLERANCE * 100),
                String.format("error = %.2f%%", relativeError * 100),
                0.5));
        }
    }

    /** T² = a³ with T in years and a in AU, for bodies orbiting the Sun. */
    private void validateKeplerThirdLaw(double periodYears, double semiMajorAxisAu, ValidationReport report) {
        if (!Double.isFinite(periodYears) || !Double.isFinite(semiMajorAxisAu) || semiMajorAxisAu <= 0) return;

        double expected = Math.pow(semiMajorAxisAu, 3);
        double actual   = periodYears * periodYears;
        double relativeError = Math.abs(actual - expected) / expected;

        if (relativeError <= KEPLER_TOLERANCE) {
            report.addResult(ValidationResult.success("Kepler's third law verified", "kepler_third_law"));
        } else {
            report.addResult(ValidationResult.of(Severity.WARNING,
                String.format("Kepler's third law deviation: %.2f%%", relativeError * 100),
                "kepler_third_law",
                String.format("T^2 = %.2f", expected),
                String.format("T^2 = %.2f", actual),
                OUT_OF_RANGE_CONFIDENCE));
        }
    }

    private void validateConstants(Map<String, Object> constants, ValidationReport report) {
        for (Map.Entry<String, Double> reference : CONSTANTS.entrySet()) {
            Double value = readNumber(constants.get(reference.getKey()), reference.getKey(), report);
            if (value != null && Double.isFinite(value)) {
                report.addResult(checkReferenceValue(value, reference.getValue(),
                    CONSTANT_TOLERANCE, reference.getKey()));
            }
        }
    }

    private void scanNonFinite(Object node, String path, ValidationReport report) {
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                scanNonFinite(entry.getValue(), path.isEmpty() ? key : path + "." + key, report);
            }
        } else if (node instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                scanNonFinite(list.get(i), path + "[" + i + "]", report);
            }
        } else if (node instanceof Number || node instanceof String) {
            Double value = parseNumber(node);
            if (value != null && !Double.isFinite(value)) {
                report.addResult(ValidationResult.of(Severity.CRITICAL,
                    "Non-finite value found in " + path, path, "finite number", node, 0.0));
            }
        }
    }
}
