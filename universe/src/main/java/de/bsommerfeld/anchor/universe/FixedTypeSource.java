package de.bsommerfeld.anchor.universe;

import java.util.List;

/**
 * A hand-picked list of type names resolved against one class loader. Used
 * for curated extras that are not on any walked module or class-path entry.
 */
public final class FixedTypeSource extends AbstractTypeSource {

    private final String name;
    private final ClassLoader loader;
    private final List<String> typeNames;

    public FixedTypeSource(String name, ClassLoader loader, List<String> typeNames) {
        this.name = name;
        this.loader = loader;
        this.typeNames = List.copyOf(typeNames);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    protected List<String> listTypeNames() {
        return typeNames;
    }

    @Override
    protected Class<?> loadType(String binaryName) throws ClassNotFoundException {
        return Class.forName(binaryName, false, loader);
    }
}
