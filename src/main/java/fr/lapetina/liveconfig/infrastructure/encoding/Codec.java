package fr.lapetina.liveconfig.infrastructure.encoding;

import java.util.Map;

/**
 * Encoder/decoder for one configuration format.
 *
 * Implementations must be thread-safe as they are shared by every reader and
 * called from concurrent reconciliation loops.
 */
public interface Codec {

    /**
     * Returns the format name this codec is registered under.
     */
    String getName();

    /**
     * Encodes a configuration tree.
     *
     * @throws fr.lapetina.liveconfig.exception.ConfigException if the tree cannot be encoded
     */
    byte[] marshal(Object value);

    /**
     * Decodes a document whose root is a mapping.
     *
     * @return The decoded mapping, empty for an empty document
     * @throws fr.lapetina.liveconfig.exception.ConfigException if the document is malformed
     */
    Map<String, Object> unmarshal(byte[] data);
}
