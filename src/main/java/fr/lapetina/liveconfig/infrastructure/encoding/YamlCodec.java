package fr.lapetina.liveconfig.infrastructure.encoding;

import fr.lapetina.liveconfig.exception.ConfigException;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * YAML codec backed by SnakeYAML.
 *
 * {@link Yaml} instances are not thread-safe, so one is created per call.
 */
public final class YamlCodec implements Codec {

    public static final String NAME = "yaml";

    private final String name;

    public YamlCodec() {
        this(NAME);
    }

    /**
     * Creates a codec registered under an alias such as {@code yml}.
     */
    public YamlCodec(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public byte[] marshal(Object value) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        try {
            return new Yaml(options).dump(value).getBytes(StandardCharsets.UTF_8);
        } catch (YAMLException e) {
            throw new ConfigException("Failed to encode YAML", e);
        }
    }

    @Override
    public Map<String, Object> unmarshal(byte[] data) {
        Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(new ByteArrayInputStream(data));
        } catch (YAMLException e) {
            throw new ConfigException("Failed to decode YAML: " + e.getMessage(), e);
        }
        if (loaded == null) {
            return new LinkedHashMap<>();
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new ConfigException("YAML document root must be a mapping, got: "
                    + loaded.getClass().getSimpleName());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
