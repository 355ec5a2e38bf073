package fr.lapetina.liveconfig;

import fr.lapetina.liveconfig.domain.model.Value;

/**
 * Live view over the merged configuration of several sources.
 */
public interface Config extends AutoCloseable {

    /**
     * Loads every source, resolves the merged configuration and starts watching the sources.
     * Must be called once.
     *
     * @throws fr.lapetina.liveconfig.exception.ConfigException if a source cannot be loaded, merged
     *         or watched, or the merged configuration cannot be resolved
     * @throws IllegalStateException if already loaded
     */
    void load();

    /**
     * Returns the value of a key. Never throws for a missing key: a not-found value is
     * returned instead, whose accessors throw
     * {@link fr.lapetina.liveconfig.exception.KeyNotFoundException}.
     */
    Value value(String key);

    /**
     * Binds the whole configuration into each target independently.
     *
     * @throws fr.lapetina.liveconfig.exception.ConfigException if binding fails
     */
    void scan(Object... targets);

    /**
     * Binds the whole configuration into a new instance of {@code type}.
     *
     * @throws fr.lapetina.liveconfig.exception.ConfigException if binding fails
     */
    <T> T scan(Class<T> type);

    /**
     * Registers the observer of a key, replacing any previous one.
     *
     * @throws fr.lapetina.liveconfig.exception.KeyNotFoundException if the key does not currently resolve
     */
    void watch(String key, Observer observer);

    /**
     * Stops watching every source.
     *
     * @throws fr.lapetina.liveconfig.exception.ConfigException if a watcher fails to stop
     */
    @Override
    void close();
}
