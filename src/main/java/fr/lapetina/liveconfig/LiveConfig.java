package fr.lapetina.liveconfig;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.liveconfig.domain.model.KeyValue;
import fr.lapetina.liveconfig.domain.model.Value;
import fr.lapetina.liveconfig.domain.reader.Decoder;
import fr.lapetina.liveconfig.domain.reader.Reader;
import fr.lapetina.liveconfig.domain.reader.Resolver;
import fr.lapetina.liveconfig.domain.source.Source;
import fr.lapetina.liveconfig.domain.source.Watcher;
import fr.lapetina.liveconfig.exception.ConfigException;
import fr.lapetina.liveconfig.exception.KeyNotFoundException;
import fr.lapetina.liveconfig.exception.WatcherStoppedException;
import fr.lapetina.liveconfig.infrastructure.metrics.ConfigMetrics;
import fr.lapetina.liveconfig.infrastructure.metrics.ConfigMetrics.Outcome;
import fr.lapetina.liveconfig.infrastructure.reader.FormatDecoder;
import fr.lapetina.liveconfig.infrastructure.reader.MapReader;
import fr.lapetina.liveconfig.infrastructure.reader.PlaceholderResolver;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration aggregated from several sources and kept current while they change.
 *
 * <p>{@link #load()} merges the initial content of every source into the {@link Reader}, resolves it
 * and starts one reconciliation loop per source. Each loop blocks on its {@link Watcher}, merges
 * the changed fragments, re-resolves and compares every cached key with the fresh state. A cached
 * {@link Value} keeps its identity: its payload is replaced in place, then the key's observer is
 * notified. A change that alters the payload type is ignored.
 *
 * <p>Usage:
 * <pre>{@code
 * try (LiveConfig config = LiveConfig.builder()
 *         .source(new FileSource("config/application.yaml"))
 *         .source(new EnvSource("APP"))
 *         .build()) {
 *     config.load();
 *     Value port = config.value("server.port");
 *     config.watch("server.port", (key, value) -> log.info("{} -> {}", key, value.asInt()));
 * }
 * }</pre>
 */
public final class LiveConfig implements Config {

    private static final Logger log = LoggerFactory.getLogger(LiveConfig.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final List<Source> sources;
    private final Reader reader;
    private final Duration watchRetryDelay;
    private final ConfigMetrics metrics;
    private final ObjectMapper objectMapper;

    private final Map<String, Value> cached = new ConcurrentHashMap<>();
    private final Map<String, Observer> observers = new ConcurrentHashMap<>();
    private final List<Watcher> watchers = new CopyOnWriteArrayList<>();
    private final ExecutorService watchExecutor;
    private final AtomicInteger activeLoops = new AtomicInteger(0);
    private final AtomicBoolean loaded = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private LiveConfig(Builder builder) {
        this.sources = List.copyOf(builder.sources);
        this.reader = builder.reader != null
                ? builder.reader
                : new MapReader(builder.decoder, builder.resolver);
        this.watchRetryDelay = builder.watchRetryDelay;
        this.metrics = builder.meterRegistry != null
                ? new ConfigMetrics(builder.meterRegistry, builder.metricsPrefix)
                : new ConfigMetrics(builder.metricsPrefix);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.watchExecutor = Executors.newCachedThreadPool(new WatcherThreadFactory());

        metrics.registerCachedKeys(cached::size);
        metrics.registerActiveWatchers(activeLoops::get);

        log.info("LiveConfig created: sources={}, watchRetryDelay={}", sources.size(), watchRetryDelay);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void load() {
        if (!loaded.compareAndSet(false, true)) {
            throw new IllegalStateException("Configuration already loaded");
        }

        for (Source source : sources) {
            List<KeyValue> fragments = source.load();
            for (KeyValue fragment : fragments) {
                log.debug("Config loaded: source={}, key={}, format={}",
                        source.getName(), fragment.key(), fragment.format());
            }

            try {
                reader.merge(fragments);
            } catch (RuntimeException e) {
                log.error("Failed to merge config source: source={}", source.getName(), e);
                throw e;
            }

            Watcher watcher;
            try {
                watcher = source.watch();
            } catch (RuntimeException e) {
                log.error("Failed to watch config source: source={}", source.getName(), e);
                throw e;
            }
            watchers.add(watcher);
            watchExecutor.execute(() -> reconcile(source, watcher));
        }

        try {
            reader.resolve();
        } catch (RuntimeException e) {
            log.error("Failed to resolve config sources", e);
            throw e;
        }
        log.info("Configuration loaded: sources={}", sources.size());
    }

    @Override
    public Value value(String key) {
        Value existing = cached.get(key);
        if (existing != null) {
            return existing;
        }
        Optional<Value> found = reader.value(key);
        if (found.isEmpty()) {
            return Value.notFound(key);
        }
        // First writer wins so that concurrent first lookups share one instance
        Value previous = cached.putIfAbsent(key, found.get());
        if (previous != null) {
            return previous;
        }
        // A cycle may have run between the lookup and caching
        refresh(key, found.get());
        return found.get();
    }

    @Override
    public void scan(Object... targets) {
        byte[] snapshot = reader.source();
        for (Object target : targets) {
            try {
                objectMapper.readerForUpdating(target).readValue(snapshot);
            } catch (IOException e) {
                throw new ConfigException("Failed to scan configuration into: "
                        + target.getClass().getSimpleName(), e);
            }
        }
    }

    @Override
    public <T> T scan(Class<T> type) {
        try {
            return objectMapper.readValue(reader.source(), type);
        } catch (IOException e) {
            throw new ConfigException("Failed to scan configuration into: " + type.getSimpleName(), e);
        }
    }

    @Override
    public void watch(String key, Observer observer) {
        Objects.requireNonNull(observer, "observer is required");
        if (value(key).load() == null) {
            throw new KeyNotFoundException(key);
        }
        Observer previous = observers.put(key, observer);
        if (previous != null) {
            log.debug("Observer replaced: key={}", key);
        }
    }

    /**
     * Stops every watcher, then waits for the reconciliation loops to exit.
     *
     * <p>Every watcher is stopped even when an earlier one fails; the first failure is rethrown
     * with later ones attached as suppressed exceptions.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down LiveConfig...");

        ConfigException failure = null;
        for (Watcher watcher : watchers) {
            try {
                watcher.stop();
            } catch (RuntimeException e) {
                log.error("Failed to stop watcher", e);
                if (failure == null) {
                    failure = e instanceof ConfigException configException
                            ? configException
                            : new ConfigException("Failed to stop watcher", e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        watchExecutor.shutdown();
        try {
            if (!watchExecutor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Reconciliation loops did not stop within {}, interrupting", SHUTDOWN_TIMEOUT);
                watchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            watchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        metrics.close();

        if (failure != null) {
            throw failure;
        }
        log.info("LiveConfig shut down");
    }

    public ConfigMetrics getMetrics() {
        return metrics;
    }

    private void reconcile(Source source, Watcher watcher) {
        String name = source.getName();
        activeLoops.incrementAndGet();
        log.info("Reconciliation started: source={}", name);
        try {
            while (true) {
                List<KeyValue> fragments;
                try {
                    fragments = watcher.next();
                } catch (WatcherStoppedException e) {
                    log.info("Watcher stopped: source={}", name);
                    return;
                } catch (RuntimeException e) {
                    log.error("Failed to watch next config: source={}", name, e);
                    metrics.recordReconcile(name, Outcome.WATCH_ERROR);
                    if (!pauseBeforeRetry(name)) {
                        return;
                    }
                    continue;
                }

                long start = System.nanoTime();
                try {
                    reader.merge(fragments);
                } catch (RuntimeException e) {
                    log.error("Failed to merge next config: source={}", name, e);
                    metrics.recordReconcile(name, Outcome.MERGE_ERROR);
                    continue;
                }
                try {
                    reader.resolve();
                } catch (RuntimeException e) {
                    log.error("Failed to resolve next config: source={}", name, e);
                    metrics.recordReconcile(name, Outcome.RESOLVE_ERROR);
                    continue;
                }

                int changed = propagate();
                metrics.recordReconcile(name, Outcome.APPLIED);
                metrics.recordReconcileLatency(name, Duration.ofNanos(System.nanoTime() - start));
                log.debug("Reconciled: source={}, fragments={}, changedKeys={}", name, fragments.size(), changed);
            }
        } finally {
            activeLoops.decrementAndGet();
        }
    }

    /**
     * Compares every cached key with the reader and applies type-stable changes.
     *
     * @return Number of keys whose payload changed
     */
    private int propagate() {
        List<String> changedKeys = new ArrayList<>();
        cached.forEach((key, current) -> {
            if (!refresh(key, current)) {
                return;
            }
            changedKeys.add(key);
            Observer observer = observers.get(key);
            if (observer != null) {
                notifyObserver(observer, key, current);
            }
        });
        return changedKeys.size();
    }

    /**
     * Stores the reader's payload for {@code key} into {@code current} when it differs and keeps its type.
     * Lookup and store happen under the value's monitor, so the last caller always stores the newest payload.
     *
     * @return {@code true} if the payload changed
     */
    private boolean refresh(String key, Value current) {
        synchronized (current) {
            Optional<Value> fresh = reader.value(key);
            if (fresh.isEmpty()) {
                return false;
            }
            Object next = fresh.get().load();
            Object previous = current.load();
            if (next.getClass() != previous.getClass()) {
                log.debug("Ignoring type change: key={}, from={}, to={}",
                        key, previous.getClass().getSimpleName(), next.getClass().getSimpleName());
                return false;
            }
            if (Objects.deepEquals(next, previous)) {
                return false;
            }
            current.store(next);
            return true;
        }
    }

    private void notifyObserver(Observer observer, String key, Value value) {
        try {
            observer.onChange(key, value);
            metrics.incrementObserverNotifications();
        } catch (Exception e) {
            metrics.incrementObserverErrors();
            log.error("Error notifying config observer: key={}", key, e);
        }
    }

    private boolean pauseBeforeRetry(String source) {
        try {
            Thread.sleep(watchRetryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Reconciliation interrupted: source={}", source);
            return false;
        }
    }

    /**
     * Daemon threads named after the reconciliation loops they run.
     */
    private static final class WatcherThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "config-watcher-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    public static final class Builder {
        private final List<Source> sources = new ArrayList<>();
        private Decoder decoder = new FormatDecoder();
        private Resolver resolver = new PlaceholderResolver();
        private Reader reader;
        private Duration watchRetryDelay = Duration.ofSeconds(1);
        private MeterRegistry meterRegistry;
        private String metricsPrefix = ConfigMetrics.DEFAULT_PREFIX;

        /**
         * Adds a source. Sources added later take precedence on conflicting keys.
         */
        public Builder source(Source source) {
            this.sources.add(Objects.requireNonNull(source, "source is required"));
            return this;
        }

        public Builder sources(List<? extends Source> sources) {
            sources.forEach(this::source);
            return this;
        }

        public Builder decoder(Decoder decoder) {
            this.decoder = Objects.requireNonNull(decoder, "decoder is required");
            return this;
        }

        public Builder resolver(Resolver resolver) {
            this.resolver = Objects.requireNonNull(resolver, "resolver is required");
            return this;
        }

        /**
         * Uses the given reader instead of a {@link MapReader}; the decoder and resolver are then unused.
         */
        public Builder reader(Reader reader) {
            this.reader = Objects.requireNonNull(reader, "reader is required");
            return this;
        }

        /**
         * Delay before calling a failed watcher again. Defaults to one second.
         */
        public Builder watchRetryDelay(Duration watchRetryDelay) {
            if (watchRetryDelay.isNegative()) {
                throw new IllegalArgumentException("watchRetryDelay must not be negative");
            }
            this.watchRetryDelay = watchRetryDelay;
            return this;
        }

        /**
         * Records metrics into an application registry instead of a private Prometheus registry.
         */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
            return this;
        }

        public Builder metricsPrefix(String metricsPrefix) {
            this.metricsPrefix = Objects.requireNonNull(metricsPrefix, "metricsPrefix is required");
            return this;
        }

        public LiveConfig build() {
            return new LiveConfig(this);
        }
    }
}
