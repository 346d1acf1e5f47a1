package de.bsommerfeld.anchor.universe;

import java.io.IOException;
import java.lang.module.ModuleReader;
import java.lang.module.ModuleReference;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Types of one named module, listed from its {@link ModuleReference} and
 * loaded through {@link Class#forName(Module, String)}, which never runs
 * static initializers.
 */
public final class ModuleTypeSource extends AbstractTypeSource {

    private final ModuleReference reference;
    private final Module module;

    public ModuleTypeSource(ModuleReference reference, Module module) {
        this.reference = reference;
        this.module = module;
    }

    @Override
    public String name() {
        return module.getName();
    }

    @Override
    protected List<String> listTypeNames() throws IOException {
        try (ModuleReader reader = reference.open();
                Stream<String> entries = reader.list()) {
            return entries.map(AbstractTypeSource::binaryName)
                    .flatMap(Optional::stream)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    protected Class<?> loadType(String binaryName) throws ClassNotFoundException {
        Class<?> type = Class.forName(module, binaryName);
        if (type == null) {
            throw new ClassNotFoundException(binaryName + " in module " + module.getName());
        }
        return type;
    }
}
