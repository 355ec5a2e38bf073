package fr.lapetina.liveconfig.exception;

/**
 * Base exception for configuration errors.
 *
 * Raised for decode, merge, resolve and source I/O failures. Subclasses
 * distinguish the conditions callers are expected to handle explicitly.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
