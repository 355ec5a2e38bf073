package fr.lapetina.liveconfig.infrastructure.reader;

import fr.lapetina.liveconfig.domain.model.KeyValue;
import fr.lapetina.liveconfig.domain.model.Value;
import fr.lapetina.liveconfig.domain.reader.Decoder;
import fr.lapetina.liveconfig.domain.reader.Reader;
import fr.lapetina.liveconfig.domain.reader.Resolver;
import fr.lapetina.liveconfig.exception.ConfigException;
import fr.lapetina.liveconfig.infrastructure.encoding.Codec;
import fr.lapetina.liveconfig.infrastructure.encoding.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Reader backed by nested maps.
 *
 * Two trees are kept: the merged tree, which still holds placeholders, and the resolved tree that
 * lookups are answered from. Both are replaced wholesale under a write lock, so a lookup sees either
 * the previous or the next resolved tree and never a partial one.
 */
public final class MapReader implements Reader {

    private static final Logger log = LoggerFactory.getLogger(MapReader.class);

    private final Decoder decoder;
    private final Resolver resolver;
    private final Codec snapshotCodec;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private Map<String, Object> merged = new LinkedHashMap<>();
    private Map<String, Object> resolved = new LinkedHashMap<>();

    public MapReader(Decoder decoder, Resolver resolver) {
        this.decoder = Objects.requireNonNull(decoder, "decoder is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.snapshotCodec = new JsonCodec();
    }

    public MapReader() {
        this(new FormatDecoder(), new PlaceholderResolver());
    }

    @Override
    public void merge(List<KeyValue> fragments) {
        // Decode outside the lock; a failing fragment rejects the whole batch
        Map<String, Object> incoming = new LinkedHashMap<>();
        for (KeyValue fragment : fragments) {
            Map<String, Object> decoded = new LinkedHashMap<>();
            try {
                decoder.decode(fragment, decoded);
            } catch (ConfigException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ConfigException("Failed to decode fragment: " + fragment.key(), e);
            }
            Trees.deepMerge(incoming, Trees.normalize(decoded));
        }

        lock.writeLock().lock();
        try {
            Map<String, Object> next = Trees.deepCopy(merged);
            Trees.deepMerge(next, incoming);
            merged = next;
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Merged fragments: count={}", fragments.size());
    }

    @Override
    public void resolve() {
        lock.writeLock().lock();
        try {
            Map<String, Object> next = Trees.deepCopy(merged);
            try {
                resolver.resolve(next);
            } catch (ConfigException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ConfigException("Failed to resolve configuration", e);
            }
            resolved = Trees.normalize(next);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Value> value(String key) {
        lock.readLock().lock();
        try {
            return Trees.lookup(resolved, key).map(v -> Value.of(key, Trees.freeze(v)));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public byte[] source() {
        lock.readLock().lock();
        try {
            return snapshotCodec.marshal(resolved);
        } finally {
            lock.readLock().unlock();
        }
    }
}
