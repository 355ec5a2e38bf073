package fr.lapetina.liveconfig.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Reconciliation metrics using Micrometer.
 *
 * Provides:
 * - Reconciliation cycle counters per source and outcome
 * - Reconciliation latency per source
 * - Observer notification and failure counters
 * - Cached key and active watcher gauges
 *
 * On close, meters registered into an application registry are removed from it so that
 * a later instance using the same registry and prefix registers its own.
 */
public final class ConfigMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigMetrics.class);

    public static final String DEFAULT_PREFIX = "live_config";

    /**
     * Outcome of one reconciliation cycle.
     */
    public enum Outcome {
        APPLIED,
        WATCH_ERROR,
        MERGE_ERROR,
        RESOLVE_ERROR;

        String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final MeterRegistry registry;
    private final String prefix;
    private final boolean ownsRegistry;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> reconcileCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> reconcileTimers = new ConcurrentHashMap<>();
    private final List<Meter> registered = new CopyOnWriteArrayList<>();

    private final Counter observerNotifications;
    private final Counter observerErrors;

    public ConfigMetrics(MeterRegistry registry, String prefix) {
        this(registry, prefix, false);
    }

    public ConfigMetrics(String prefix) {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), prefix, true);
    }

    public ConfigMetrics() {
        this(DEFAULT_PREFIX);
    }

    private ConfigMetrics(MeterRegistry registry, String prefix, boolean ownsRegistry) {
        this.registry = registry;
        this.prefix = prefix;
        this.ownsRegistry = ownsRegistry;

        this.observerNotifications = track(Counter.builder(prefix + "_observer_notifications_total")
                .description("Total number of observer notifications")
                .register(registry));
        this.observerErrors = track(Counter.builder(prefix + "_observer_errors_total")
                .description("Total number of observers that threw while being notified")
                .register(registry));

        log.debug("ConfigMetrics initialized with prefix: {}", prefix);
    }

    /**
     * Increments the reconciliation counter for a source/outcome combination.
     */
    public void recordReconcile(String source, Outcome outcome) {
        String key = source + ":" + outcome.name();
        reconcileCounters.computeIfAbsent(key, k -> track(
                Counter.builder(prefix + "_reconcile_total")
                        .description("Total number of reconciliation cycles")
                        .tag("source", source)
                        .tag("outcome", outcome.tag())
                        .register(registry))
        ).increment();
    }

    /**
     * Records the duration of a successful merge, resolve and propagate cycle.
     */
    public void recordReconcileLatency(String source, Duration latency) {
        reconcileTimers.computeIfAbsent(source, k -> track(
                Timer.builder(prefix + "_reconcile_latency")
                        .description("Reconciliation cycle latency")
                        .tag("source", source)
                        .register(registry))
        ).record(latency);
    }

    public void incrementObserverNotifications() {
        observerNotifications.increment();
    }

    public void incrementObserverErrors() {
        observerErrors.increment();
    }

    /**
     * Registers a gauge for the number of cached keys.
     */
    public void registerCachedKeys(Supplier<Number> cachedKeys) {
        track(Gauge.builder(prefix + "_cached_keys", cachedKeys, s -> s.get().doubleValue())
                .description("Number of cached configuration keys")
                .strongReference(true)
                .register(registry));
    }

    /**
     * Registers a gauge for the number of active watchers.
     */
    public void registerActiveWatchers(Supplier<Number> activeWatchers) {
        track(Gauge.builder(prefix + "_active_watchers", activeWatchers, s -> s.get().doubleValue())
                .description("Number of active source watchers")
                .strongReference(true)
                .register(registry));
    }

    /**
     * Returns the Prometheus scrape output.
     *
     * @throws IllegalStateException if the underlying registry is not a Prometheus registry
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        throw new IllegalStateException("Metrics registry does not support scraping: "
                + registry.getClass().getSimpleName());
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Closes the registry created by this instance, or removes this instance's meters
     * from an application registry.
     */
    @Override
    public void close() {
        if (ownsRegistry) {
            registry.close();
            return;
        }
        registered.forEach(registry::remove);
        log.debug("Removed {} meters with prefix: {}", registered.size(), prefix);
        registered.clear();
        reconcileCounters.clear();
        reconcileTimers.clear();
    }

    private <M extends Meter> M track(M meter) {
        registered.add(meter);
        return meter;
    }
}
