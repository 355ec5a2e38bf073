package fr.lapetina.liveconfig.domain.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.liveconfig.exception.ConfigException;
import fr.lapetina.liveconfig.exception.KeyNotFoundException;
import fr.lapetina.liveconfig.exception.TypeMismatchException;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Holder for one resolved configuration value.
 *
 * A value is either live or not-found for its entire life:
 * <ul>
 *   <li>live: the payload sits behind an {@link AtomicReference}; {@link #store(Object)} replaces it
 *       in place so every holder of this object observes updates without a new lookup</li>
 *   <li>not-found: immutable, {@link #load()} returns {@code null} and every typed accessor throws
 *       the {@link KeyNotFoundException} carried by the value</li>
 * </ul>
 *
 * Thread-safe: loads and stores are atomic.
 */
public final class Value {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final Pattern DURATION_PATTERN = Pattern.compile("^(-?\\d+)\\s*(ms|s|m|h|d)$");

    private final String key;
    private final AtomicReference<Object> payload;
    private final KeyNotFoundException error;

    private Value(String key, Object payload, KeyNotFoundException error) {
        this.key = Objects.requireNonNull(key, "key is required");
        this.payload = new AtomicReference<>(payload);
        this.error = error;
    }

    /**
     * Creates a live value.
     */
    public static Value of(String key, Object payload) {
        return new Value(key, Objects.requireNonNull(payload, "payload is required"), null);
    }

    /**
     * Creates a not-found value for the given key.
     */
    public static Value notFound(String key) {
        return new Value(key, null, new KeyNotFoundException(key));
    }

    public String getKey() {
        return key;
    }

    public boolean isPresent() {
        return error == null;
    }

    /**
     * Returns the lookup error of a not-found value, empty for a live one.
     */
    public Optional<ConfigException> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the current payload, or {@code null} for a not-found value.
     */
    public Object load() {
        return payload.get();
    }

    /**
     * Replaces the payload.
     *
     * @throws UnsupportedOperationException on a not-found value
     */
    public void store(Object newPayload) {
        if (error != null) {
            throw new UnsupportedOperationException("Cannot store into a not-found value: " + key);
        }
        payload.set(Objects.requireNonNull(newPayload, "payload is required"));
    }

    public boolean asBoolean() {
        Object current = require();
        if (current instanceof Boolean b) {
            return b;
        }
        if (current instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (current instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(s.trim())) {
                return false;
            }
        }
        throw new TypeMismatchException(key, Boolean.class, current);
    }

    public long asLong() {
        Object current = require();
        if (current instanceof Number n) {
            return n.longValue();
        }
        if (current instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new TypeMismatchException(key, Long.class, current, e);
            }
        }
        throw new TypeMismatchException(key, Long.class, current);
    }

    public int asInt() {
        long value = asLong();
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new TypeMismatchException(key, Integer.class, load());
        }
        return (int) value;
    }

    public double asDouble() {
        Object current = require();
        if (current instanceof Number n) {
            return n.doubleValue();
        }
        if (current instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new TypeMismatchException(key, Double.class, current, e);
            }
        }
        throw new TypeMismatchException(key, Double.class, current);
    }

    public String asString() {
        Object current = require();
        if (current instanceof String s) {
            return s;
        }
        if (current instanceof Number || current instanceof Boolean) {
            return String.valueOf(current);
        }
        throw new TypeMismatchException(key, String.class, current);
    }

    /**
     * Numbers are read as milliseconds; strings as ISO-8601 ({@code PT5S})
     * or a count with a unit suffix ({@code 250ms}, {@code 5s}, {@code 1m}, {@code 2h}, {@code 1d}).
     */
    public Duration asDuration() {
        Object current = require();
        if (current instanceof Number n) {
            return Duration.ofMillis(n.longValue());
        }
        if (current instanceof String s) {
            String text = s.trim();
            Matcher matcher = DURATION_PATTERN.matcher(text);
            if (matcher.matches()) {
                long amount = Long.parseLong(matcher.group(1));
                return switch (matcher.group(2)) {
                    case "ms" -> Duration.ofMillis(amount);
                    case "s" -> Duration.ofSeconds(amount);
                    case "m" -> Duration.ofMinutes(amount);
                    case "h" -> Duration.ofHours(amount);
                    default -> Duration.ofDays(amount);
                };
            }
            try {
                return Duration.parse(text);
            } catch (DateTimeParseException e) {
                throw new TypeMismatchException(key, Duration.class, current, e);
            }
        }
        throw new TypeMismatchException(key, Duration.class, current);
    }

    @SuppressWarnings("unchecked")
    public List<Object> asList() {
        Object current = require();
        if (current instanceof List<?> list) {
            return (List<Object>) list;
        }
        throw new TypeMismatchException(key, List.class, current);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> asMap() {
        Object current = require();
        if (current instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new TypeMismatchException(key, Map.class, current);
    }

    /**
     * Binds the payload to the given type.
     */
    public <T> T as(Class<T> type) {
        Object current = require();
        if (type.isInstance(current)) {
            return type.cast(current);
        }
        try {
            return MAPPER.convertValue(current, type);
        } catch (IllegalArgumentException e) {
            throw new TypeMismatchException(key, type, current, e);
        }
    }

    private Object require() {
        if (error != null) {
            throw error;
        }
        return payload.get();
    }

    @Override
    public String toString() {
        if (error != null) {
            return "Value{key='" + key + "', notFound}";
        }
        return "Value{" +
                "key='" + key + '\'' +
                ", payload=" + payload.get() +
                '}';
    }
}
