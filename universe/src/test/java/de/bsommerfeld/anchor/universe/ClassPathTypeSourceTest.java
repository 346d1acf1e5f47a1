package de.bsommerfeld.anchor.universe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class ClassPathTypeSourceTest {

    private static final ClassLoader LOADER = ClassPathTypeSourceTest.class.getClassLoader();

    @TempDir
    Path tempDir;

    @Test
    void load_shouldRecordUnloadableDirectoryEntriesAsFailures() throws IOException {
        Path classes = tempDir.resolve("classes");
        Files.createDirectories(classes.resolve("com/example/ghost"));
        Files.write(classes.resolve("com/example/ghost/Phantom.class"), new byte[] {0, 1, 2});
        Files.writeString(classes.resolve("com/example/ghost/notes.txt"), "not a class");

        TypeLoadResult result = new ClassPathTypeSource(classes, LOADER).load();

        assertTrue(result.loaded().isEmpty());
        assertEquals(1, result.failures().size());
        assertEquals("com.example.ghost.Phantom", result.failures().get(0).name());
    }

    @Test
    void load_shouldListJarEntriesAndLoadKnownTypes() throws IOException {
        Path jar = tempDir.resolve("fixture.jar");
        try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
            // java.lang.String resolves through the parent loader, the ghost does not
            addEntry(out, "java/lang/String.class");
            addEntry(out, "com/example/ghost/Phantom.class");
            addEntry(out, "META-INF/versions/17/com/example/ghost/Phantom.class");
            addEntry(out, "module-info.class");
        }

        TypeLoadResult result = new ClassPathTypeSource(jar, LOADER).load();

        assertEquals(1, result.loaded().size());
        assertEquals(String.class, result.loaded().get(0));
        assertEquals(1, result.failures().size());
        assertEquals("classpath:fixture.jar", result.source());
    }

    @Test
    void load_shouldReturnUnlistedResultForMissingEntry() {
        TypeLoadResult result = new ClassPathTypeSource(tempDir.resolve("missing.jar"), LOADER).load();

        assertTrue(result.loaded().isEmpty());
        assertEquals(1, result.failures().size());
        assertInstanceOf(IOException.class, result.failures().get(0).cause());
    }

    @Test
    void load_shouldReturnUnlistedResultForCorruptJar() throws IOException {
        Path jar = tempDir.resolve("broken.jar");
        Files.writeString(jar, "definitely not a zip");

        TypeLoadResult result = new ClassPathTypeSource(jar, LOADER).load();

        assertTrue(result.loaded().isEmpty());
        assertEquals("classpath:broken.jar", result.failures().get(0).name());
    }

    private static void addEntry(JarOutputStream out, String name) throws IOException {
        out.putNextEntry(new JarEntry(name));
        out.write(new byte[] {0});
        out.closeEntry();
    }
}
