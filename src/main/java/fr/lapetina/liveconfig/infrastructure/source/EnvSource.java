package fr.lapetina.liveconfig.infrastructure.source;

import fr.lapetina.liveconfig.domain.model.KeyValue;
import fr.lapetina.liveconfig.domain.source.Source;
import fr.lapetina.liveconfig.domain.source.Watcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Source exposing environment variables.
 *
 * With prefixes, only matching variables are exposed and the prefix plus a leading {@code _}
 * is stripped from the key: with prefix {@code APP}, {@code APP_PORT=8080} becomes {@code PORT}.
 * Values are plain strings.
 */
public final class EnvSource implements Source {

    private final Supplier<Map<String, String>> environment;
    private final List<String> prefixes;

    public EnvSource(String... prefixes) {
        this(System::getenv, prefixes);
    }

    public EnvSource(Supplier<Map<String, String>> environment, String... prefixes) {
        this.environment = Objects.requireNonNull(environment, "environment is required");
        this.prefixes = List.of(prefixes);
    }

    @Override
    public String getName() {
        return prefixes.isEmpty() ? "env" : "env:" + String.join(",", prefixes);
    }

    @Override
    public List<KeyValue> load() {
        List<KeyValue> fragments = new ArrayList<>();
        new TreeMap<>(environment.get()).forEach((name, value) ->
                keyFor(name).ifPresent(key -> fragments.add(KeyValue.ofString(key, value == null ? "" : value))));
        return fragments;
    }

    @Override
    public Watcher watch() {
        return new EnvWatcher(getName());
    }

    private Optional<String> keyFor(String name) {
        String key = name;
        if (!prefixes.isEmpty()) {
            Optional<String> prefix = prefixes.stream().filter(name::startsWith).findFirst();
            if (prefix.isEmpty() || prefix.get().length() == name.length()) {
                return Optional.empty();
            }
            key = name.substring(prefix.get().length());
            if (key.startsWith("_")) {
                key = key.substring(1);
            }
        }
        return key.isEmpty() ? Optional.empty() : Optional.of(key);
    }
}
