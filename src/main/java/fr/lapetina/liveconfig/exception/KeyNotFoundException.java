package fr.lapetina.liveconfig.exception;

/**
 * Thrown when a key is absent from the resolved configuration.
 */
public final class KeyNotFoundException extends ConfigException {

    private final String key;

    public KeyNotFoundException(String key) {
        super("Key not found: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
