package de.bsommerfeld.anchor.universe;

import de.bsommerfeld.anchor.core.config.ExerciserConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TypeUniverseWalkerTest {

    private static final ClassLoader LOADER = TypeUniverseWalkerTest.class.getClassLoader();
    private final MemberToucher toucher = new MemberToucher(ExerciserConfig.defaults());

    @Test
    void walk_shouldTouchEveryLoadedTypeOnce() {
        TypeCatalog catalog = () -> List.of(
                new FixedTypeSource("a", LOADER, List.of("java.lang.String", "java.lang.Integer")),
                new FixedTypeSource("b", LOADER, List.of("java.lang.Integer", "java.lang.Long")));
        List<String> touched = new ArrayList<>();

        WalkSummary summary = new TypeUniverseWalker(catalog, toucher)
                .walk(type -> touched.add(type.identity().qualifiedName()));

        assertEquals(List.of("java.lang.String", "java.lang.Integer", "java.lang.Long"), touched);
        assertEquals(2, summary.sources());
        assertEquals(3, summary.typesTouched());
        assertEquals(1, summary.duplicates());
    }

    @Test
    void walk_shouldUseLoadableSubsetOfPartialSource() {
        TypeCatalog catalog = () -> List.of(
                new FixedTypeSource("partial", LOADER, List.of("com.example.Missing", "java.lang.Object")));
        List<String> touched = new ArrayList<>();

        WalkSummary summary = new TypeUniverseWalker(catalog, toucher)
                .walk(type -> touched.add(type.identity().qualifiedName()));

        assertEquals(List.of("java.lang.Object"), touched);
        assertEquals(1, summary.loadFailures());
    }

    @Test
    void walk_shouldContinueAfterSourceThatThrows() {
        TypeSource broken = new TypeSource() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public TypeLoadResult load() {
                throw new IllegalStateException("listing exploded");
            }
        };
        TypeCatalog catalog = () -> List.of(broken,
                new FixedTypeSource("after", LOADER, List.of("java.lang.String")));
        List<String> touched = new ArrayList<>();

        WalkSummary summary = new TypeUniverseWalker(catalog, toucher)
                .walk(type -> touched.add(type.identity().qualifiedName()));

        assertEquals(List.of("java.lang.String"), touched);
        assertEquals(2, summary.sources());
        assertEquals(1, summary.loadFailures());
    }

    @Test
    void walk_shouldNotThrowWhenCatalogFails() {
        TypeCatalog catalog = () -> {
            throw new IllegalStateException("no catalog");
        };

        WalkSummary summary = assertDoesNotThrow(() -> new TypeUniverseWalker(catalog, toucher).walk());

        assertEquals(0, summary.typesTouched());
    }

    @Test
    void walk_shouldAbsorbConstructionFailures() {
        TypeCatalog catalog = () -> List.of(new FixedTypeSource("fixtures", LOADER,
                List.of(Exploding.class.getName(), Quiet.class.getName())));

        WalkSummary summary = new TypeUniverseWalker(catalog, toucher).walk();

        assertEquals(2, summary.typesTouched());
        assertEquals(1, summary.constructed());
        assertEquals(1, summary.constructionFailures());
    }

    @Test
    void walk_shouldBeRepeatable() {
        TypeCatalog catalog = () -> List.of(new FixedTypeSource("a", LOADER, List.of("java.lang.String")));
        TypeUniverseWalker walker = new TypeUniverseWalker(catalog, toucher);

        assertEquals(walker.walk(), walker.walk());
    }

    @Test
    void walk_shouldTouchCoreRuntimeTypesWithoutRaising() {
        ExerciserConfig config = ExerciserConfig.defaults()
                .withWalkModules(List.of("java.base"))
                .withWalkClassPath(false);
        TypeUniverseWalker walker = new TypeUniverseWalker(new RuntimeTypeCatalog(config), new MemberToucher(config));
        List<String> touched = new ArrayList<>();

        WalkSummary summary = assertDoesNotThrow(() -> walker.walk(type -> touched.add(type.identity().uniqueName())));

        Set<String> distinct = new HashSet<>(touched);
        assertEquals(touched.size(), distinct.size());
        assertTrue(distinct.containsAll(List.of(
                "java.base/Ljava/lang/Object;",
                "java.base/Ljava/lang/String;",
                "java.base/Ljava/lang/Integer;")));
        assertEquals(1, summary.sources());
        assertTrue(summary.typesTouched() > 1000);
    }

    @Test
    void walk_shouldReportBothIdentityStrings() {
        TypeCatalog catalog = () -> List.of(new FixedTypeSource("a", LOADER, List.of("java.util.ArrayList")));
        List<TypeIdentity> identities = new ArrayList<>();

        new TypeUniverseWalker(catalog, toucher).walk(type -> identities.add(type.identity()));

        assertEquals(List.of(new TypeIdentity("java.util.ArrayList", "java.base/Ljava/util/ArrayList;")),
                identities.stream().collect(Collectors.toList()));
    }

    static final class Exploding {
        Exploding() {
            throw new UnsupportedOperationException("never");
        }
    }

    static final class Quiet {
    }
}
