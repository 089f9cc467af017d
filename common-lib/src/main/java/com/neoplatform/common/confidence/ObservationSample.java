package com.neoplatform.common.confidence;

import java.util.Map;

/**
 * Observational record of the analysed object, used for the orbital-uncertainty and
 * data-quality components. Every field is optional; {@code null} means absent.
 *
 * <p>{@link #fromMap} accepts the shape delivered by the NEO data feed, where orbital
 * elements arrive as numeric strings.
 */
public record ObservationSample(
    String id,
    String name,
    Double diameterMin,
    Double diameterMax,
    Double absoluteMagnitude,
    boolean orbitalDataPresent,
    Double eccentricity,
    Double inclination,
    Double semiMajorAxis
) {

    public static ObservationSample fromMap(Map<String, Object> data) {
        if (data == null) return null;
        Object orbital = data.get("orbital_data");
        Map<?, ?> orbitalData = orbital instanceof Map<?, ?> m ? m : Map.of();
        return new ObservationSample(
            text(data.get("id")),
            text(data.get("name")),
            number(data.get("diameter_min")),
            number(data.get("diameter_max")),
            number(data.get("absolute_magnitude_h")),
            orbital != null,
            number(orbitalData.get("eccentricity")),
            number(orbitalData.get("inclination")),
            number(orbitalData.get("semi_major_axis"))
        );
    }

    private static String text(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    /** Finite numbers and numeric strings; anything else reads as absent. */
    static Double number(Object value) {
        Double parsed = null;
        if (value instanceof Number n) {
            parsed = n.doubleValue();
        } else if (value instanceof String s && !s.isBlank()) {
            try {
                parsed = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return parsed != null && Double.isFinite(parsed) ? parsed : null;
    }
}
