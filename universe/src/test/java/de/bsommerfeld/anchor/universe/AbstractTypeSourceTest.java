package de.bsommerfeld.anchor.universe;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AbstractTypeSourceTest {

    @Test
    void binaryName_shouldConvertResourcePath() {
        assertEquals(Optional.of("java.lang.String"), AbstractTypeSource.binaryName("java/lang/String.class"));
    }

    @Test
    void binaryName_shouldKeepNestedTypeSeparator() {
        assertEquals(Optional.of("java.util.Map$Entry"), AbstractTypeSource.binaryName("java/util/Map$Entry.class"));
    }

    @Test
    void binaryName_shouldNormalizeWindowsSeparators() {
        assertEquals(Optional.of("com.example.Type"), AbstractTypeSource.binaryName("com\\example\\Type.class"));
    }

    @Test
    void binaryName_shouldSkipDescriptors() {
        assertTrue(AbstractTypeSource.binaryName("module-info.class").isEmpty());
        assertTrue(AbstractTypeSource.binaryName("com/example/package-info.class").isEmpty());
    }

    @Test
    void binaryName_shouldSkipMultiReleaseOverlays() {
        assertTrue(AbstractTypeSource.binaryName("META-INF/versions/11/com/example/Type.class").isEmpty());
    }

    @Test
    void binaryName_shouldSkipNonClassResources() {
        assertTrue(AbstractTypeSource.binaryName("logback.xml").isEmpty());
        assertTrue(AbstractTypeSource.binaryName("com/example/").isEmpty());
    }
}
