package de.bsommerfeld.anchor.universe;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Types of one class-path entry (a directory or a jar) of the unnamed module.
 */
public final class ClassPathTypeSource extends AbstractTypeSource {

    private final Path entry;
    private final ClassLoader loader;

    public ClassPathTypeSource(Path entry, ClassLoader loader) {
        this.entry = entry;
        this.loader = loader;
    }

    @Override
    public String name() {
        return "classpath:" + entry.getFileName();
    }

    @Override
    protected List<String> listTypeNames() throws IOException {
        if (Files.isDirectory(entry)) {
            return listDirectory();
        }
        if (Files.isRegularFile(entry)) {
            return listJar();
        }
        throw new IOException("Class-path entry does not exist: " + entry);
    }

    @Override
    protected Class<?> loadType(String binaryName) throws ClassNotFoundException {
        return Class.forName(binaryName, false, loader);
    }

    private List<String> listDirectory() throws IOException {
        try (Stream<Path> walk = Files.walk(entry)) {
            return walk.filter(Files::isRegularFile)
                    .map(entry::relativize)
                    .map(Path::toString)
                    .map(AbstractTypeSource::binaryName)
                    .flatMap(Optional::stream)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private List<String> listJar() throws IOException {
        try (JarFile jar = new JarFile(entry.toFile())) {
            return jar.stream()
                    .filter(e -> !e.isDirectory())
                    .map(JarEntry::getName)
                    .map(AbstractTypeSource::binaryName)
                    .flatMap(Optional::stream)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
