package de.bsommerfeld.anchor.subsystem;

/**
 * Calls a short, fixed set of a subsystem's public entry points so that the
 * types and code paths behind them stay reachable.
 *
 * <p>
 * Results of the calls are irrelevant. Implementations must release every
 * resource they acquire before returning, on every path.
 */
public interface SubsystemAnchor {

    /** Configuration name of the subsystem, e.g. {@code "networking"}. */
    String name();

    /**
     * Invokes every entry point once. Failures of individual entry points are
     * expected and reported, not thrown.
     */
    AnchorReport anchor();
}
