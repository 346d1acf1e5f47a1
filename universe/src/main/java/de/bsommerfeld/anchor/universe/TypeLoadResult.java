package de.bsommerfeld.anchor.universe;

import java.util.List;

/**
 * Partial-success result of listing one {@link TypeSource}: whatever could be
 * loaded, plus what could not. Never all-or-nothing.
 */
public record TypeLoadResult(String source, List<Class<?>> loaded, List<TypeLoadFailure> failures) {

    public TypeLoadResult {
        loaded = List.copyOf(loaded);
        failures = List.copyOf(failures);
    }

    /** Result for a source whose listing failed before any type was loaded. */
    public static TypeLoadResult unlisted(String source, Throwable cause) {
        return new TypeLoadResult(source, List.of(), List.of(new TypeLoadFailure(source, cause)));
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
