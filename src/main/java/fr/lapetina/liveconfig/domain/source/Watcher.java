package fr.lapetina.liveconfig.domain.source;

import fr.lapetina.liveconfig.domain.model.KeyValue;

import java.util.List;

/**
 * Blocking change stream of a single source.
 *
 * Implementations must let {@link #stop()} be called from another thread while
 * {@link #next()} is blocked.
 */
public interface Watcher {

    /**
     * Blocks until the next batch of changed fragments is available.
     *
     * @return The changed fragments
     * @throws fr.lapetina.liveconfig.exception.WatcherStoppedException once the watcher is stopped
     * @throws fr.lapetina.liveconfig.exception.ConfigException on a transient failure
     */
    List<KeyValue> next();

    /**
     * Releases the watcher. A blocked or future {@link #next()} throws
     * {@link fr.lapetina.liveconfig.exception.WatcherStoppedException}.
     */
    void stop();
}
