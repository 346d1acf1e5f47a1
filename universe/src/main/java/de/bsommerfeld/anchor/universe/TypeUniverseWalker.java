package de.bsommerfeld.anchor.universe;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.anchor.core.attempt.Attempt;
import de.bsommerfeld.anchor.core.sink.KeepAlive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Walks every type of every source in the {@link TypeCatalog} and touches
 * each one exactly once.
 *
 * <h3>Touching</h3>
 * For each type, both identity strings of {@link TypeIdentity} are read and
 * handed to {@link KeepAlive}, then the {@link MemberToucher} constructs the
 * type and enumerates its members. A type listed by several sources (the same
 * class reachable from two class-path entries) is touched once.
 *
 * <h3>Failure policy</h3>
 * The walker never throws. A catalog that cannot list its sources yields an
 * empty pass, a source that cannot list its types contributes nothing, a
 * type that cannot be loaded or touched is counted and skipped.
 */
@Singleton
public class TypeUniverseWalker {

    private static final Logger LOG = LoggerFactory.getLogger(TypeUniverseWalker.class);

    private final TypeCatalog catalog;
    private final MemberToucher toucher;

    @Inject
    public TypeUniverseWalker(TypeCatalog catalog, MemberToucher toucher) {
        this.catalog = catalog;
        this.toucher = toucher;
    }

    public WalkSummary walk() {
        return walk(touched -> {
        });
    }

    /**
     * Runs one pass, reporting every touched type to {@code observer}.
     */
    public WalkSummary walk(Consumer<TouchedType> observer) {
        Attempt<List<TypeSource>> listing = Attempt.of(catalog::sources);
        if (!listing.succeeded()) {
            LOG.warn("Type catalog could not list its sources: {}", listing.describe());
            return new WalkSummary(0, 0, 0, 1, 0, 0);
        }

        Set<Class<?>> seen = new HashSet<>();
        int sources = 0;
        int touchedTypes = 0;
        int duplicates = 0;
        int loadFailures = 0;
        int constructed = 0;
        int constructionFailures = 0;

        for (TypeSource source : listing.value()) {
            sources++;
            TypeLoadResult result = load(source);
            loadFailures += result.failures().size();

            for (Class<?> type : result.loaded()) {
                if (!seen.add(type)) {
                    duplicates++;
                    continue;
                }
                Attempt<TouchedType> touched = Attempt.of(() -> touch(type, observer));
                if (!touched.succeeded()) {
                    LOG.trace("Touching {} failed: {}", type.getName(), touched.describe());
                    loadFailures++;
                    continue;
                }
                touchedTypes++;
                switch (touched.value().construction()) {
                    case CONSTRUCTED -> constructed++;
                    case FAILED -> constructionFailures++;
                    default -> {
                    }
                }
            }
            LOG.debug("Walked {}: {} types", source.name(), result.loaded().size());
        }

        WalkSummary summary = new WalkSummary(sources, touchedTypes, duplicates,
                loadFailures, constructed, constructionFailures);
        LOG.info("Type universe walk finished: {}", summary);
        return summary;
    }

    private TouchedType touch(Class<?> type, Consumer<TouchedType> observer) {
        TypeIdentity identity = TypeIdentity.of(type);
        KeepAlive.accept(identity.qualifiedName(), identity.uniqueName());
        TouchedType touched = toucher.touch(type, identity);
        observer.accept(touched);
        return touched;
    }

    private static TypeLoadResult load(TypeSource source) {
        Attempt<TypeLoadResult> result = Attempt.of(source::load);
        if (result.succeeded()) {
            return result.value();
        }
        LOG.debug("Source {} failed to load: {}", source.name(), result.describe());
        return TypeLoadResult.unlisted(source.name(), result.failure());
    }
}
