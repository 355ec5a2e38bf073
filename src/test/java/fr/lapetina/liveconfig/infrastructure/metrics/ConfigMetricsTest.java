package fr.lapetina.liveconfig.infrastructure.metrics;

import fr.lapetina.liveconfig.infrastructure.metrics.ConfigMetrics.Outcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigMetricsTest {

    @Test
    @DisplayName("should count reconciliations per source and outcome")
    void shouldCountReconciliations() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ConfigMetrics metrics = new ConfigMetrics(registry, "test");

        metrics.recordReconcile("file", Outcome.APPLIED);
        metrics.recordReconcile("file", Outcome.APPLIED);
        metrics.recordReconcile("file", Outcome.WATCH_ERROR);

        assertThat(registry.get("test_reconcile_total").tags("source", "file", "outcome", "applied")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("test_reconcile_total").tags("source", "file", "outcome", "watch_error")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should track gauges and latency")
    void shouldTrackGaugesAndLatency() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ConfigMetrics metrics = new ConfigMetrics(registry, "test");
        AtomicInteger cachedKeys = new AtomicInteger(3);

        metrics.registerCachedKeys(cachedKeys::get);
        metrics.recordReconcileLatency("env", Duration.ofMillis(12));
        cachedKeys.set(5);

        assertThat(registry.get("test_cached_keys").gauge().value()).isEqualTo(5.0);
        assertThat(registry.get("test_reconcile_latency").tag("source", "env").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("should expose Prometheus output from its own registry")
    void shouldScrapeOwnRegistry() {
        ConfigMetrics metrics = new ConfigMetrics("scrape_test");
        try {
            metrics.recordReconcile("file", Outcome.MERGE_ERROR);
            metrics.incrementObserverNotifications();

            String output = metrics.scrape();

            assertThat(output).contains("scrape_test_reconcile_total");
            assertThat(output).contains("outcome=\"merge_error\"");
            assertThat(output).contains("scrape_test_observer_notifications_total");
        } finally {
            metrics.close();
        }
    }

    @Test
    @DisplayName("should refuse to scrape a non-Prometheus registry")
    void shouldRefuseScrapeOfForeignRegistry() {
        ConfigMetrics metrics = new ConfigMetrics(new SimpleMeterRegistry(), "test");

        assertThatThrownBy(metrics::scrape).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should leave an application registry open on close")
    void shouldLeaveApplicationRegistryOpen() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ConfigMetrics metrics = new ConfigMetrics(registry, "test");

        metrics.close();

        assertThat(registry.isClosed()).isFalse();
    }

    @Test
    @DisplayName("should remove its meters from an application registry on close")
    void shouldRemoveMetersOnClose() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ConfigMetrics first = new ConfigMetrics(registry, "test");
        first.registerActiveWatchers(() -> 7);
        first.recordReconcile("file", Outcome.APPLIED);
        first.recordReconcileLatency("file", Duration.ofMillis(3));

        first.close();

        assertThat(registry.getMeters()).isEmpty();

        ConfigMetrics second = new ConfigMetrics(registry, "test");
        second.registerActiveWatchers(() -> 2);
        second.recordReconcile("file", Outcome.APPLIED);

        assertThat(registry.get("test_active_watchers").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("test_reconcile_total").tags("source", "file", "outcome", "applied")
                .counter().count()).isEqualTo(1.0);
    }
}
