package com.neoplatform.common.model;

/**
 * Tag identifying which validator variant produced a {@link ValidationReport}.
 * The confidence system splits reports into domain-physical and narrative groups by this tag.
 */
public enum ValidatorKind {
    PHYSICAL,
    COMPLETENESS,
    COHERENCE;

    /** Narrative validators feed the conceptual-coherence component. */
    public boolean isNarrative() {
        return this == COHERENCE;
    }
}
