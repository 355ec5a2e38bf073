package fr.lapetina.liveconfig.infrastructure.source;

import fr.lapetina.liveconfig.domain.model.KeyValue;
import fr.lapetina.liveconfig.domain.source.Source;
import fr.lapetina.liveconfig.domain.source.Watcher;
import fr.lapetina.liveconfig.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Source reading a configuration file, or every file of a directory.
 *
 * Each file becomes one fragment keyed by its file name, with its extension as format
 * ({@code application.yaml} is decoded as {@code yaml}). Hidden files are skipped.
 */
public final class FileSource implements Source {

    private static final Logger log = LoggerFactory.getLogger(FileSource.class);

    private final Path path;

    public FileSource(Path path) {
        this.path = Objects.requireNonNull(path, "path is required").toAbsolutePath().normalize();
    }

    public FileSource(String path) {
        this(Paths.get(path));
    }

    @Override
    public String getName() {
        return "file:" + path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public List<KeyValue> load() {
        if (!Files.exists(path)) {
            throw new ConfigException("Configuration file not found: " + path);
        }
        if (!Files.isDirectory(path)) {
            log.info("Loading configuration from file: {}", path);
            return List.of(read(path));
        }

        log.info("Loading configuration from directory: {}", path);
        List<KeyValue> fragments = new ArrayList<>();
        for (Path file : listFiles()) {
            fragments.add(read(file));
        }
        return fragments;
    }

    @Override
    public Watcher watch() {
        try {
            return new FileWatcher(this);
        } catch (IOException e) {
            throw new ConfigException("Failed to watch configuration path: " + path, e);
        }
    }

    boolean isDirectory() {
        return Files.isDirectory(path);
    }

    /**
     * Tells whether a file reported by the file system belongs to this source.
     */
    boolean accepts(Path candidate) {
        Path fileName = candidate.getFileName();
        if (fileName == null || fileName.toString().startsWith(".")) {
            return false;
        }
        if (isDirectory()) {
            return path.equals(candidate.toAbsolutePath().normalize().getParent());
        }
        return path.equals(candidate.toAbsolutePath().normalize());
    }

    List<Path> listFiles() {
        if (!isDirectory()) {
            return List.of(path);
        }
        try (Stream<Path> files = Files.list(path)) {
            return files.filter(Files::isRegularFile)
                    .filter(this::accepts)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ConfigException("Failed to list configuration directory: " + path, e);
        }
    }

    KeyValue read(Path file) {
        try {
            String fileName = file.getFileName().toString();
            return new KeyValue(fileName, Files.readAllBytes(file), extension(fileName));
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration file: " + file, e);
        }
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1);
    }

    @Override
    public String toString() {
        return "FileSource{path=" + path + '}';
    }
}
