package fr.lapetina.liveconfig.domain.reader;

import fr.lapetina.liveconfig.domain.model.KeyValue;
import fr.lapetina.liveconfig.domain.model.Value;

import java.util.List;
import java.util.Optional;

/**
 * Merged key space over every source.
 *
 * Implementations must serialize {@link #merge(List)} and {@link #resolve()} against
 * concurrent lookups so that a lookup never observes a partially merged tree. Merges may
 * arrive concurrently from the loops of distinct sources.
 */
public interface Reader {

    /**
     * Absorbs fragments into the merged key space. Later merges override earlier ones on
     * overlapping keys.
     *
     * @throws fr.lapetina.liveconfig.exception.ConfigException if a fragment cannot be decoded;
     *         the merged state is left untouched
     */
    void merge(List<KeyValue> fragments);

    /**
     * Expands cross-references over the merged tree. Idempotent.
     *
     * @throws fr.lapetina.liveconfig.exception.ConfigException if resolution fails; lookups keep
     *         answering from the previous resolved state
     */
    void resolve();

    /**
     * Point lookup into the resolved tree.
     *
     * @return A new live value, or empty when the key is absent
     */
    Optional<Value> value(String key);

    /**
     * Serializes the whole resolved tree as JSON.
     */
    byte[] source();
}
