package fr.lapetina.liveconfig.infrastructure.reader;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TreesTest {

    @Test
    @DisplayName("should normalize scalar types and drop nulls")
    void shouldNormalize() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("int", 1);
        raw.put("float", 1.5f);
        raw.put("decimal", new BigDecimal("2.5"));
        raw.put("none", null);
        raw.put("list", List.of(1, "a"));

        Map<String, Object> normalized = Trees.normalize(raw);

        assertThat(normalized)
                .containsEntry("int", 1L)
                .containsEntry("float", 1.5d)
                .containsEntry("decimal", 2.5d)
                .containsEntry("list", List.of(1L, "a"))
                .doesNotContainKey("none");
    }

    @Test
    @DisplayName("should merge mappings recursively without aliasing the source")
    void shouldDeepMerge() {
        Map<String, Object> target = new LinkedHashMap<>();
        Trees.putPath(target, "server.host", "a");
        Map<String, Object> source = new LinkedHashMap<>();
        Trees.putPath(source, "server.port", 1L);

        Trees.deepMerge(target, source);
        Trees.putPath(source, "server.port", 2L);

        assertThat(Trees.lookup(target, "server.host")).contains("a");
        assertThat(Trees.lookup(target, "server.port")).contains(1L);
    }

    @Test
    @DisplayName("should replace a scalar with a mapping when placing a path")
    void shouldReplaceScalarOnPutPath() {
        Map<String, Object> target = new LinkedHashMap<>();
        target.put("a", "scalar");

        Trees.putPath(target, "a.b", "nested");

        assertThat(Trees.lookup(target, "a.b")).contains("nested");
    }
}
