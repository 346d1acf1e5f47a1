package de.bsommerfeld.anchor.universe;

import java.util.List;

/**
 * Discardable record of one touched type.
 *
 * @param identity     identity strings read from the type
 * @param methodNames  names of every declared method, all visibilities, static and instance
 * @param fieldNames   names of every declared field, all visibilities, static and instance
 * @param construction outcome of the zero-argument construction attempt
 */
public record TouchedType(
        TypeIdentity identity,
        List<String> methodNames,
        List<String> fieldNames,
        ConstructionStatus construction) {

    public TouchedType {
        methodNames = List.copyOf(methodNames);
        fieldNames = List.copyOf(fieldNames);
    }
}
