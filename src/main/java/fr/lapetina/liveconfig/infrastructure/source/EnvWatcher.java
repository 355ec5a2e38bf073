package fr.lapetina.liveconfig.infrastructure.source;

import fr.lapetina.liveconfig.domain.model.KeyValue;
import fr.lapetina.liveconfig.domain.source.Watcher;
import fr.lapetina.liveconfig.exception.WatcherStoppedException;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * The environment of a running process does not change: {@link #next()} blocks until stopped.
 */
final class EnvWatcher implements Watcher {

    private final String sourceName;
    private final CountDownLatch stopped = new CountDownLatch(1);

    EnvWatcher(String sourceName) {
        this.sourceName = sourceName;
    }

    @Override
    public List<KeyValue> next() {
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WatcherStoppedException(sourceName, e);
        }
        throw new WatcherStoppedException(sourceName);
    }

    @Override
    public void stop() {
        stopped.countDown();
    }
}
