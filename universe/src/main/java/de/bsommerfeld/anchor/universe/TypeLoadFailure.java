package de.bsommerfeld.anchor.universe;

/**
 * A type (or a whole source listing) that could not be loaded.
 *
 * @param name  binary type name, or the source name when the listing itself failed
 * @param cause the absorbed failure
 */
public record TypeLoadFailure(String name, Throwable cause) {
}
