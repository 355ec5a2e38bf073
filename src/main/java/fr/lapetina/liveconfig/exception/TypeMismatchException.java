package fr.lapetina.liveconfig.exception;

/**
 * Thrown when a value cannot be converted to the requested type.
 */
public final class TypeMismatchException extends ConfigException {

    private final String key;
    private final Class<?> requestedType;

    public TypeMismatchException(String key, Class<?> requestedType, Object payload) {
        super("Type mismatch: key=" + key
                + ", requested=" + requestedType.getSimpleName()
                + ", actual=" + (payload == null ? "null" : payload.getClass().getSimpleName()));
        this.key = key;
        this.requestedType = requestedType;
    }

    public TypeMismatchException(String key, Class<?> requestedType, Object payload, Throwable cause) {
        this(key, requestedType, payload);
        initCause(cause);
    }

    public String getKey() {
        return key;
    }

    public Class<?> getRequestedType() {
        return requestedType;
    }
}
