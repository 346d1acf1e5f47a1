package de.bsommerfeld.anchor.universe;

/**
 * A unit of the loaded type universe: a named module of the boot layer, a
 * class-path entry of the unnamed module, or a fixed list of type names.
 */
public interface TypeSource {

    String name();

    /**
     * Loads every type this source defines, without initializing them.
     * Implementations must not throw; failures belong in the result.
     */
    TypeLoadResult load();
}
