package fr.lapetina.liveconfig.domain.reader;

import fr.lapetina.liveconfig.domain.model.KeyValue;

import java.util.Map;

/**
 * Decodes a raw fragment into a configuration tree.
 */
@FunctionalInterface
public interface Decoder {

    /**
     * Decodes {@code fragment} and puts its entries into {@code target}.
     *
     * @throws fr.lapetina.liveconfig.exception.ConfigException if the fragment cannot be decoded
     */
    void decode(KeyValue fragment, Map<String, Object> target);
}
