package de.bsommerfeld.anchor.subsystem;

import de.bsommerfeld.anchor.core.attempt.Attempt;

/**
 * A single representative call into a subsystem.
 *
 * @param name   short identifier used in reports, e.g. {@code "resolve-local-host"}
 * @param action the call; may throw anything
 */
public record EntryPoint(String name, Attempt.VoidAction action) {
}
