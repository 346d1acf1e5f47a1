package de.bsommerfeld.anchor.universe;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.anchor.core.config.ExerciserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.lang.module.ResolvedModule;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Catalog of everything currently loadable in the process.
 *
 * <ul>
 * <li>every resolved module of the boot {@link ModuleLayer}, sorted by name and
 * filtered by {@link ExerciserConfig#isModuleIncluded(String)}</li>
 * <li>every entry of {@code java.class.path}, when
 * {@link ExerciserConfig#walkClassPath()} is set</li>
 * </ul>
 *
 * Sources are created lazily; nothing is listed or loaded until the walker
 * asks each source for its types.
 */
@Singleton
public class RuntimeTypeCatalog implements TypeCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(RuntimeTypeCatalog.class);

    private final ExerciserConfig config;
    private final ModuleLayer layer;

    @Inject
    public RuntimeTypeCatalog(ExerciserConfig config) {
        this(config, ModuleLayer.boot());
    }

    RuntimeTypeCatalog(ExerciserConfig config, ModuleLayer layer) {
        this.config = config;
        this.layer = layer;
    }

    @Override
    public List<TypeSource> sources() {
        List<TypeSource> sources = new ArrayList<>(moduleSources());
        if (config.walkClassPath()) {
            sources.addAll(classPathSources());
        }
        LOG.debug("Type catalog lists {} sources", sources.size());
        return sources;
    }

    private List<TypeSource> moduleSources() {
        List<TypeSource> sources = new ArrayList<>();
        layer.configuration().modules().stream()
                .sorted(Comparator.comparing(ResolvedModule::name))
                .filter(resolved -> config.isModuleIncluded(resolved.name()))
                .forEach(resolved -> {
                    Optional<Module> module = layer.findModule(resolved.name());
                    if (module.isPresent()) {
                        sources.add(new ModuleTypeSource(resolved.reference(), module.get()));
                    } else {
                        LOG.debug("Resolved module {} is not defined in the layer", resolved.name());
                    }
                });
        return sources;
    }

    private List<TypeSource> classPathSources() {
        String classPath = System.getProperty("java.class.path", "");
        ClassLoader loader = ClassLoader.getSystemClassLoader();
        List<TypeSource> sources = new ArrayList<>();
        for (String element : classPath.split(File.pathSeparator)) {
            if (element.isBlank())
                continue;
            try {
                sources.add(new ClassPathTypeSource(Path.of(element), loader));
            } catch (InvalidPathException e) {
                LOG.debug("Ignoring malformed class-path entry '{}': {}", element, e.getMessage());
            }
        }
        return sources;
    }
}
