package de.bsommerfeld.anchor.universe;

import de.bsommerfeld.anchor.core.attempt.Attempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared partial-success loading for sources that can list their type names
 * up front. A failing listing yields an empty result; a failing type is
 * recorded and skipped.
 */
abstract class AbstractTypeSource implements TypeSource {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractTypeSource.class);

    private static final String CLASS_SUFFIX = ".class";

    /** Binary names of every type in this source. */
    protected abstract List<String> listTypeNames() throws IOException;

    /**
     * Loads one type without running its static initializer.
     *
     * @throws ClassNotFoundException if the source listed a name it cannot load
     */
    protected abstract Class<?> loadType(String binaryName) throws ClassNotFoundException;

    @Override
    public final TypeLoadResult load() {
        Attempt<List<String>> listing = Attempt.of(this::listTypeNames);
        if (!listing.succeeded()) {
            LOG.debug("Cannot list types of {}: {}", name(), listing.describe());
            return TypeLoadResult.unlisted(name(), listing.failure());
        }

        List<Class<?>> loaded = new ArrayList<>();
        List<TypeLoadFailure> failures = new ArrayList<>();
        for (String typeName : listing.value()) {
            Attempt<Class<?>> type = Attempt.of(() -> loadType(typeName));
            if (type.succeeded()) {
                loaded.add(type.value());
            } else {
                LOG.trace("Skipping {} in {}: {}", typeName, name(), type.describe());
                failures.add(new TypeLoadFailure(typeName, type.failure()));
            }
        }

        if (!failures.isEmpty()) {
            LOG.debug("{}: loaded {} types, {} failed", name(), loaded.size(), failures.size());
        }
        return new TypeLoadResult(name(), loaded, failures);
    }

    /**
     * Converts a resource path such as {@code java/util/Map$Entry.class} into
     * the binary name {@code java.util.Map$Entry}. Descriptors, multi-release
     * overlays and non-class resources yield empty.
     */
    static Optional<String> binaryName(String resourcePath) {
        String path = resourcePath.replace('\\', '/');
        if (!path.endsWith(CLASS_SUFFIX) || path.startsWith("META-INF/")) {
            return Optional.empty();
        }
        String simple = path.substring(path.lastIndexOf('/') + 1);
        if (simple.equals("module-info.class") || simple.equals("package-info.class")) {
            return Optional.empty();
        }
        return Optional.of(path.substring(0, path.length() - CLASS_SUFFIX.length()).replace('/', '.'));
    }
}
