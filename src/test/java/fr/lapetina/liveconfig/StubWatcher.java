package fr.lapetina.liveconfig;

import fr.lapetina.liveconfig.domain.model.KeyValue;
import fr.lapetina.liveconfig.domain.source.Watcher;
import fr.lapetina.liveconfig.exception.WatcherStoppedException;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Watcher stub fed through a queue of change batches and failures.
 */
final class StubWatcher implements Watcher {

    private static final Object STOP = new Object();

    private final BlockingQueue<Object> events = new LinkedBlockingQueue<>();
    private final List<Long> nextCalls = new CopyOnWriteArrayList<>();
    private final AtomicInteger stopCalls = new AtomicInteger(0);
    private volatile RuntimeException stopFailure;

    void publish(KeyValue... fragments) {
        events.add(List.of(fragments));
    }

    void fail(RuntimeException failure) {
        events.add(failure);
    }

    void failStop(RuntimeException failure) {
        this.stopFailure = failure;
    }

    /**
     * Returns the {@link System#nanoTime()} of every call to {@link #next()}.
     */
    List<Long> getNextCalls() {
        return nextCalls;
    }

    int getStopCalls() {
        return stopCalls.get();
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<KeyValue> next() {
        nextCalls.add(System.nanoTime());
        Object event;
        try {
            event = events.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WatcherStoppedException("stub", e);
        }
        if (event == STOP) {
            events.add(STOP);
            throw new WatcherStoppedException("stub");
        }
        if (event instanceof RuntimeException failure) {
            throw failure;
        }
        return (List<KeyValue>) event;
    }

    @Override
    public void stop() {
        stopCalls.incrementAndGet();
        events.add(STOP);
        if (stopFailure != null) {
            throw stopFailure;
        }
    }
}
