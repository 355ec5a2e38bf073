package fr.lapetina.liveconfig.domain.model;

import fr.lapetina.liveconfig.exception.KeyNotFoundException;
import fr.lapetina.liveconfig.exception.TypeMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueTest {

    @Nested
    @DisplayName("live value")
    class LiveValueTests {

        @Test
        @DisplayName("should expose its key and payload")
        void shouldExposeKeyAndPayload() {
            Value value = Value.of("server.port", 8080L);

            assertThat(value.getKey()).isEqualTo("server.port");
            assertThat(value.isPresent()).isTrue();
            assertThat(value.error()).isEmpty();
            assertThat(value.load()).isEqualTo(8080L);
        }

        @Test
        @DisplayName("should replace its payload in place")
        void shouldReplacePayloadInPlace() {
            Value value = Value.of("level", "info");

            value.store("debug");

            assertThat(value.load()).isEqualTo("debug");
            assertThat(value.asString()).isEqualTo("debug");
        }

        @Test
        @DisplayName("should reject a null payload")
        void shouldRejectNullPayload() {
            assertThatThrownBy(() -> Value.of("level", null)).isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> Value.of("level", "info").store(null))
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("should publish stores to concurrent readers")
        void shouldPublishStoresToConcurrentReaders() throws InterruptedException {
            Value value = Value.of("counter", 0L);
            int threads = 4;
            CountDownLatch latch = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);

            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    try {
                        for (long i = 1; i <= 1000; i++) {
                            value.store(i);
                            assertThat(value.load()).isInstanceOf(Long.class);
                        }
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();
            assertThat(value.asLong()).isEqualTo(1000L);
        }
    }

    @Nested
    @DisplayName("not-found value")
    class NotFoundTests {

        @Test
        @DisplayName("should carry a key-not-found error")
        void shouldCarryError() {
            Value value = Value.notFound("missing");

            assertThat(value.isPresent()).isFalse();
            assertThat(value.load()).isNull();
            assertThat(value.error()).get()
                    .isInstanceOf(KeyNotFoundException.class)
                    .hasFieldOrPropertyWithValue("key", "missing");
        }

        @Test
        @DisplayName("should fail every typed accessor with the same error")
        void shouldFailTypedAccessors() {
            Value value = Value.notFound("missing");
            KeyNotFoundException error = (KeyNotFoundException) value.error().orElseThrow();

            assertThatThrownBy(value::asString).isSameAs(error);
            assertThatThrownBy(value::asLong).isSameAs(error);
            assertThatThrownBy(value::asBoolean).isSameAs(error);
            assertThatThrownBy(value::asDuration).isSameAs(error);
            assertThatThrownBy(() -> value.as(Map.class)).isSameAs(error);
        }

        @Test
        @DisplayName("should reject stores")
        void shouldRejectStores() {
            assertThatThrownBy(() -> Value.notFound("missing").store("x"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("conversions")
    class ConversionTests {

        @Test
        @DisplayName("should convert numbers and numeric strings")
        void shouldConvertNumbers() {
            assertThat(Value.of("a", 42L).asInt()).isEqualTo(42);
            assertThat(Value.of("a", "42").asLong()).isEqualTo(42L);
            assertThat(Value.of("a", 1.5d).asDouble()).isEqualTo(1.5d);
            assertThat(Value.of("a", "2.5").asDouble()).isEqualTo(2.5d);
            assertThat(Value.of("a", 42L).asString()).isEqualTo("42");
        }

        @Test
        @DisplayName("should convert booleans")
        void shouldConvertBooleans() {
            assertThat(Value.of("a", true).asBoolean()).isTrue();
            assertThat(Value.of("a", "FALSE").asBoolean()).isFalse();
            assertThat(Value.of("a", 1L).asBoolean()).isTrue();
        }

        @Test
        @DisplayName("should parse durations")
        void shouldParseDurations() {
            assertThat(Value.of("a", 250L).asDuration()).isEqualTo(Duration.ofMillis(250));
            assertThat(Value.of("a", "250ms").asDuration()).isEqualTo(Duration.ofMillis(250));
            assertThat(Value.of("a", "5s").asDuration()).isEqualTo(Duration.ofSeconds(5));
            assertThat(Value.of("a", "2h").asDuration()).isEqualTo(Duration.ofHours(2));
            assertThat(Value.of("a", "PT1M").asDuration()).isEqualTo(Duration.ofMinutes(1));
        }

        @Test
        @DisplayName("should expose lists and maps")
        void shouldExposeCollections() {
            assertThat(Value.of("a", List.of("x", "y")).asList()).containsExactly("x", "y");
            assertThat(Value.of("a", Map.of("host", "db")).asMap()).containsEntry("host", "db");
        }

        @Test
        @DisplayName("should bind a mapping to a type")
        void shouldBindToType() {
            Value value = Value.of("server", Map.of("host", "db.local", "port", 5432L, "extra", true));

            Server server = value.as(Server.class);

            assertThat(server.host()).isEqualTo("db.local");
            assertThat(server.port()).isEqualTo(5432);
        }

        @Test
        @DisplayName("should report type mismatches")
        void shouldReportTypeMismatches() {
            assertThatThrownBy(() -> Value.of("port", "eighty").asLong())
                    .isInstanceOf(TypeMismatchException.class)
                    .hasMessageContaining("key=port")
                    .hasMessageContaining("requested=Long");
            assertThatThrownBy(() -> Value.of("level", "maybe").asBoolean())
                    .isInstanceOf(TypeMismatchException.class);
            assertThatThrownBy(() -> Value.of("tags", "x").asList())
                    .isInstanceOf(TypeMismatchException.class);
            assertThatThrownBy(() -> Value.of("timeout", "soon").asDuration())
                    .isInstanceOf(TypeMismatchException.class);
            assertThatThrownBy(() -> Value.of("big", Long.MAX_VALUE).asInt())
                    .isInstanceOf(TypeMismatchException.class);
        }
    }

    record Server(String host, int port) {
    }
}
