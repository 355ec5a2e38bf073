package fr.lapetina.liveconfig.infrastructure.source;

import fr.lapetina.liveconfig.domain.model.KeyValue;
import fr.lapetina.liveconfig.domain.source.Watcher;
import fr.lapetina.liveconfig.exception.ConfigException;
import fr.lapetina.liveconfig.exception.WatcherStoppedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watches the directory of a {@link FileSource} and reports re-read files.
 *
 * {@link #next()} blocks on the {@link WatchService}; {@link #stop()} closes it, which unblocks
 * a pending {@link #next()}.
 */
final class FileWatcher implements Watcher {

    private static final Logger log = LoggerFactory.getLogger(FileWatcher.class);

    private final FileSource source;
    private final Path directory;
    private final WatchService watchService;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    FileWatcher(FileSource source) throws IOException {
        this.source = source;
        Path parent = source.getPath().getParent();
        this.directory = source.isDirectory() || parent == null ? source.getPath() : parent;
        this.watchService = FileSystems.getDefault().newWatchService();
        directory.register(watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY);
        log.info("Configuration hot-reload enabled for: {}", source.getPath());
    }

    @Override
    public List<KeyValue> next() {
        while (true) {
            if (stopped.get()) {
                throw new WatcherStoppedException(source.getName());
            }

            WatchKey key;
            try {
                key = watchService.take();
            } catch (ClosedWatchServiceException e) {
                throw new WatcherStoppedException(source.getName(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WatcherStoppedException(source.getName(), e);
            }

            Set<Path> changed = new LinkedHashSet<>();
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    changed.addAll(source.listFiles());
                    continue;
                }
                Path file = directory.resolve((Path) event.context());
                if (source.accepts(file)) {
                    changed.add(file);
                }
            }
            if (!key.reset()) {
                throw new ConfigException("Watched directory is no longer accessible: " + directory);
            }

            List<KeyValue> fragments = new ArrayList<>();
            for (Path file : changed) {
                if (Files.isRegularFile(file)) {
                    fragments.add(source.read(file));
                }
            }
            if (!fragments.isEmpty()) {
                log.info("Configuration file changed, reloading: files={}", changed);
                return fragments;
            }
        }
    }

    @Override
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            try {
                watchService.close();
            } catch (IOException e) {
                throw new ConfigException("Failed to close watch service for: " + directory, e);
            }
            log.info("Configuration hot-reload stopped for: {}", source.getPath());
        }
    }
}
