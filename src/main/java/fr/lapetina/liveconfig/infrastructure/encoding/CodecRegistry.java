package fr.lapetina.liveconfig.infrastructure.encoding;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of codecs keyed by format name.
 *
 * Format names are case-insensitive. Custom codecs can be registered at runtime.
 */
public final class CodecRegistry {

    private static final Map<String, Codec> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(new JsonCodec());
        register(new YamlCodec());
        register(new YamlCodec("yml"));
        register(new PropertiesCodec());
    }

    private CodecRegistry() {
        // Utility class
    }

    /**
     * Registers a codec under its own name, replacing any codec with the same name.
     */
    public static void register(Codec codec) {
        REGISTRY.put(codec.getName().toLowerCase(Locale.ROOT), codec);
    }

    /**
     * Finds the codec for a format.
     *
     * @param format Format name, typically a file extension
     * @return Codec, or empty if none is registered
     */
    public static Optional<Codec> find(String format) {
        if (format == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(REGISTRY.get(format.toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns all registered format names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
