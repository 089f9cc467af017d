package com.neoplatform.common.validation;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Small reference knowledge base the coherence validator scores narrative output against.
 *
 * @param strategies          known mitigation strategies keyed by normalized name
 * @param technicalTerms      terminology an explanation of a hazard is expected to use
 * @param overclaimingPhrases phrases signalling unwarranted certainty
 */
public record ReferenceKnowledge(
    Map<String, KnownStrategy> strategies,
    List<String> technicalTerms,
    List<String> overclaimingPhrases
) {

    /** Feasibility rating of a known mitigation strategy. */
    public enum Feasibility {
        HIGH(0.9), MEDIUM(0.6), LOW(0.3);

        private final double score;

        Feasibility(double score) { this.score = score; }

        public double score() { return score; }
    }

    public record KnownStrategy(String name, String description, Feasibility feasibility,
                                String timeRequired, double effectiveness) {}

    public ReferenceKnowledge {
        strategies          = Map.copyOf(strategies);
        technicalTerms      = List.copyOf(technicalTerms);
        overclaimingPhrases = List.copyOf(overclaimingPhrases);
    }

    public static ReferenceKnowledge defaults() {
        return new ReferenceKnowledge(
            Map.of(
                "kinetic_impactor", new KnownStrategy("kinetic_impactor",
                    "Spacecraft that strikes the asteroid to deflect it",
                    Feasibility.HIGH, "2-5 years", 0.7),
                "gravity_tractor", new KnownStrategy("gravity_tractor",
                    "Spacecraft that uses its own gravity to tow the asteroid",
                    Feasibility.MEDIUM, "5-10 years", 0.5),
                "nuclear_deflection", new KnownStrategy("nuclear_deflection",
                    "Stand-off nuclear detonation that deflects the asteroid",
                    Feasibility.LOW, "1-2 years", 0.9)
            ),
            List.of("asteroid", "orbit", "impact", "energy", "velocity", "gravit"),
            List.of("100%", "guaranteed", "certainly will", "impossible", "without any doubt")
        );
    }

    /** Looks a strategy up case- and separator-insensitively ("Kinetic Impactor" → kinetic_impactor). */
    public Optional<KnownStrategy> findStrategy(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(strategies.get(normalize(name)));
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
    }
}
