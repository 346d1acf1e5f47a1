package de.bsommerfeld.anchor.generics;

/** Outcome of inserting an element type's default value. */
public enum Insertion {
    NOT_ATTEMPTED,
    INSERTED,
    REJECTED
}
