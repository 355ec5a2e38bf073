package fr.lapetina.liveconfig;

import fr.lapetina.liveconfig.domain.model.KeyValue;
import fr.lapetina.liveconfig.domain.source.Source;
import fr.lapetina.liveconfig.domain.source.Watcher;

import java.util.List;

/**
 * Source stub serving fixed initial fragments and a scriptable {@link StubWatcher}.
 */
final class StubSource implements Source {

    private final String name;
    private final List<KeyValue> initial;
    private final StubWatcher watcher = new StubWatcher();

    private RuntimeException loadFailure;
    private RuntimeException watchFailure;

    StubSource(String name, KeyValue... initial) {
        this.name = name;
        this.initial = List.of(initial);
    }

    /**
     * Creates a source whose initial content is a single JSON document.
     */
    static StubSource json(String name, String json) {
        return new StubSource(name, KeyValue.ofDocument(name + ".json", json, "json"));
    }

    void failLoad(RuntimeException failure) {
        this.loadFailure = failure;
    }

    void failWatch(RuntimeException failure) {
        this.watchFailure = failure;
    }

    StubWatcher getWatcher() {
        return watcher;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<KeyValue> load() {
        if (loadFailure != null) {
            throw loadFailure;
        }
        return initial;
    }

    @Override
    public Watcher watch() {
        if (watchFailure != null) {
            throw watchFailure;
        }
        return watcher;
    }

    /**
     * Publishes a JSON document as the next change batch.
     */
    void publishJson(String json) {
        watcher.publish(KeyValue.ofDocument(name + ".json", json, "json"));
    }
}
