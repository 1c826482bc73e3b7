package com.questrail.telemetry.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HandoffChannel
 * -----------------------------------------------------------------------------
 * Non-blocking hand-off from the decoding pipeline to a slower consumer
 * (graph rendering, CSV capture).
 *
 * <h2>Backpressure policy</h2>
 * {@link #offer(Object)} never blocks and never drops: a lost sample would
 * corrupt the plotted record. The configured capacity is a soft bound; when
 * the backlog first crosses it a warning is logged, and the queue keeps
 * growing. Memory, not data, absorbs a consumer that cannot keep up.
 *
 * <p>Safe for one producer and any number of consumers.</p>
 */
public final class HandoffChannel<T>
{
    private static final Logger log = LoggerFactory.getLogger(HandoffChannel.class);

    private final String name;
    private final int softCapacity;
    private final ConcurrentLinkedQueue<T> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger size = new AtomicInteger();

    private volatile boolean overCapacity;

    public HandoffChannel(String name, int softCapacity) {
        this.name = Objects.requireNonNull(name, "name");
        if (softCapacity < 1) {
            throw new IllegalArgumentException("softCapacity must be >= 1");
        }
        this.softCapacity = softCapacity;
    }

    public void offer(T element) {
        Objects.requireNonNull(element, "element");
        queue.add(element);
        int n = size.incrementAndGet();
        if (n > softCapacity && !overCapacity) {
            overCapacity = true;
            log.warn("{} channel backlog {} exceeds capacity {}; consumer is falling behind", name, n, softCapacity);
        }
    }

    public Optional<T> poll() {
        T element = queue.poll();
        if (element == null) {
            return Optional.empty();
        }
        afterRemove(1);
        return Optional.of(element);
    }

    /**
     * Removes and returns everything currently queued, in offer order.
     */
    public List<T> drain() {
        List<T> drained = new ArrayList<>();
        T element;
        while ((element = queue.poll()) != null) {
            drained.add(element);
        }
        if (!drained.isEmpty()) {
            afterRemove(drained.size());
        }
        return drained;
    }

    public int size() {
        return size.get();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int softCapacity() {
        return softCapacity;
    }

    /**
     * Discards every queued element.
     */
    public void clear() {
        drain();
    }

    private void afterRemove(int count) {
        int n = size.addAndGet(-count);
        if (overCapacity && n <= softCapacity) {
            overCapacity = false;
            log.info("{} channel backlog back under capacity ({})", name, n);
        }
    }
}
