package fr.lapetina.liveconfig.infrastructure.encoding;

import fr.lapetina.liveconfig.exception.ConfigException;
import fr.lapetina.liveconfig.infrastructure.reader.Trees;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Java properties codec. Dotted keys are expanded into nested mappings.
 */
public final class PropertiesCodec implements Codec {

    public static final String NAME = "properties";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public byte[] marshal(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigException("Properties can only encode a mapping");
        }
        Map<String, String> flat = new TreeMap<>();
        flatten("", map, flat);
        Properties properties = new Properties();
        properties.putAll(flat);
        StringWriter writer = new StringWriter();
        try {
            properties.store(writer, null);
        } catch (IOException e) {
            throw new ConfigException("Failed to encode properties", e);
        }
        return writer.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Map<String, Object> unmarshal(byte[] data) {
        Properties properties = new Properties();
        try (InputStreamReader reader = new InputStreamReader(new ByteArrayInputStream(data), StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigException("Failed to decode properties: " + e.getMessage(), e);
        }
        // Sorted so that "a" is placed before "a.b" and the nested mapping wins deterministically
        Map<String, Object> result = new LinkedHashMap<>();
        new TreeMap<>(properties).forEach((k, v) -> Trees.putPath(result, String.valueOf(k), v));
        return result;
    }

    private static void flatten(String prefix, Map<?, ?> map, Map<String, String> target) {
        map.forEach((k, v) -> {
            String path = prefix.isEmpty() ? String.valueOf(k) : prefix + "." + k;
            if (v instanceof Map<?, ?> nested) {
                flatten(path, nested, target);
            } else if (v != null) {
                target.put(path, String.valueOf(v));
            }
        });
    }
}
