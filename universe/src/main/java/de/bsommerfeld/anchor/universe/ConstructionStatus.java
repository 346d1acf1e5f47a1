package de.bsommerfeld.anchor.universe;

/**
 * What happened when the toucher looked for a zero-argument construction path.
 */
public enum ConstructionStatus {

    /** Abstract, interface, or no declared zero-argument constructor. */
    NOT_ELIGIBLE,
    /** Eligible, but excluded by configuration. */
    SKIPPED,
    CONSTRUCTED,
    /** Constructor found, invocation threw or was refused access. */
    FAILED;

    public boolean attempted() {
        return this == CONSTRUCTED || this == FAILED;
    }
}
