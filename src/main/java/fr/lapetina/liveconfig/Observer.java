package fr.lapetina.liveconfig;

import fr.lapetina.liveconfig.domain.model.Value;

/**
 * Callback for changes of a single configuration key.
 *
 * Observers are invoked inline on the reconciliation thread of the source that produced the
 * change, so they must return quickly and never block.
 */
@FunctionalInterface
public interface Observer {

    /**
     * Called after the cached value of {@code key} has been updated.
     *
     * @param key   The changed key
     * @param value The cached value, already holding the new payload
     */
    void onChange(String key, Value value);
}
