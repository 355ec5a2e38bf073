/**
 * Contracts for configuration sources and their change streams.
 *
 * <p>A {@link fr.lapetina.liveconfig.domain.source.Source} loads its fragments once and then hands out a
 * {@link fr.lapetina.liveconfig.domain.source.Watcher}. Stopping the watcher is the cancellation signal
 * for the reconciliation loop that consumes it.
 */
package fr.lapetina.liveconfig.domain.source;
