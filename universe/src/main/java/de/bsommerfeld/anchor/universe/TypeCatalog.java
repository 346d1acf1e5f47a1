package de.bsommerfeld.anchor.universe;

import java.util.List;

/**
 * Read-only view of the process's type sources. The walker never mutates it.
 */
public interface TypeCatalog {

    List<TypeSource> sources();
}
