package fr.lapetina.liveconfig.infrastructure.encoding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.liveconfig.exception.ConfigException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON codec backed by Jackson.
 */
public final class JsonCodec implements Codec {

    public static final String NAME = "json";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonCodec() {
        this(new ObjectMapper());
    }

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public byte[] marshal(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Failed to encode JSON", e);
        }
    }

    @Override
    public Map<String, Object> unmarshal(byte[] data) {
        if (data.length == 0) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> decoded = objectMapper.readValue(data, MAP_TYPE);
            return decoded == null ? new LinkedHashMap<>() : decoded;
        } catch (IOException e) {
            throw new ConfigException("Failed to decode JSON: " + e.getMessage(), e);
        }
    }
}
