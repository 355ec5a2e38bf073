package fr.lapetina.liveconfig.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable fragment of raw configuration emitted by a source.
 *
 * @param key    Identifier of the fragment (file name, variable name, ...)
 * @param value  Raw bytes, decoded according to {@code format}
 * @param format Codec name, or empty when the value is a plain string placed at {@code key}
 */
public record KeyValue(String key, byte[] value, String format) {

    public KeyValue {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(value, "value is required");
        value = value.clone();
        format = format == null ? "" : format;
    }

    /**
     * Creates a fragment holding a plain string, placed at {@code key} when decoded.
     */
    public static KeyValue ofString(String key, String value) {
        return new KeyValue(key, value.getBytes(StandardCharsets.UTF_8), "");
    }

    /**
     * Creates a fragment holding a document in the given format.
     */
    public static KeyValue ofDocument(String key, String content, String format) {
        return new KeyValue(key, content.getBytes(StandardCharsets.UTF_8), format);
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    public String valueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    public boolean hasFormat() {
        return !format.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyValue that)) return false;
        return key.equals(that.key) && Arrays.equals(value, that.value) && format.equals(that.format);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, Arrays.hashCode(value), format);
    }

    @Override
    public String toString() {
        return "KeyValue{" +
                "key='" + key + '\'' +
                ", format='" + format + '\'' +
                ", size=" + value.length +
                '}';
    }
}
