package fr.lapetina.liveconfig.domain.source;

import fr.lapetina.liveconfig.domain.model.KeyValue;

import java.util.List;

/**
 * A configuration source: performs the initial bulk load and opens a change stream.
 *
 * Failures are reported as {@link fr.lapetina.liveconfig.exception.ConfigException}.
 */
public interface Source {

    /**
     * Returns the name of this source for logging and metrics.
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Reads every fragment currently provided by this source.
     */
    List<KeyValue> load();

    /**
     * Opens a watcher reporting subsequent changes.
     */
    Watcher watch();
}
