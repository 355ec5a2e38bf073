/**
 * Micrometer metrics for the reconciliation loops.
 *
 * <p>By default metrics are kept in a Prometheus registry and exposed through
 * {@link fr.lapetina.liveconfig.infrastructure.metrics.ConfigMetrics#scrape()}; an application
 * registry can be supplied instead.
 */
package fr.lapetina.liveconfig.infrastructure.metrics;
