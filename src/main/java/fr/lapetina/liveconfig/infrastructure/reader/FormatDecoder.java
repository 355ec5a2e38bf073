package fr.lapetina.liveconfig.infrastructure.reader;

import fr.lapetina.liveconfig.domain.model.KeyValue;
import fr.lapetina.liveconfig.domain.reader.Decoder;
import fr.lapetina.liveconfig.exception.ConfigException;
import fr.lapetina.liveconfig.infrastructure.encoding.Codec;
import fr.lapetina.liveconfig.infrastructure.encoding.CodecRegistry;

import java.util.Map;

/**
 * Default decoder.
 *
 * A fragment without a format is a plain string placed at the path named by its key
 * ({@code server.port} becomes {@code {server: {port: ...}}}). Any other fragment is decoded
 * by the codec registered for its format.
 */
public final class FormatDecoder implements Decoder {

    @Override
    public void decode(KeyValue fragment, Map<String, Object> target) {
        if (!fragment.hasFormat()) {
            Trees.putPath(target, fragment.key(), fragment.valueAsString());
            return;
        }
        Codec codec = CodecRegistry.find(fragment.format())
                .orElseThrow(() -> new ConfigException(
                        "unsupported key: " + fragment.key() + " format: " + fragment.format()));
        target.putAll(codec.unmarshal(fragment.value()));
    }
}
