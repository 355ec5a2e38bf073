package fr.lapetina.liveconfig.exception;

/**
 * Signals that a watcher has been stopped.
 *
 * This is the only clean exit for a reconciliation loop: every other
 * exception thrown from {@code Watcher.next()} is treated as transient.
 */
public final class WatcherStoppedException extends ConfigException {

    public WatcherStoppedException(String source) {
        super("Watcher stopped: " + source);
    }

    public WatcherStoppedException(String source, Throwable cause) {
        super("Watcher stopped: " + source, cause);
    }
}
