/**
 * Exception types raised by the configuration aggregator.
 *
 * <p>All exceptions are unchecked and extend
 * {@link fr.lapetina.liveconfig.exception.ConfigException}.
 */
package fr.lapetina.liveconfig.exception;
