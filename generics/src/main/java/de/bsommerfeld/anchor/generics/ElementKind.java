package de.bsommerfeld.anchor.generics;

/** Coarse category of a curated element type. */
public enum ElementKind {
    SIGNED_INTEGRAL,
    UNSIGNED_INTEGRAL,
    TEXT,
    BINARY,
    OPAQUE
}
