package com.presencebridge.common.channel;

import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Unbounded FIFO hand-off between producers and a single consuming loop.
 *
 * <p>
 * Any number of threads may {@link #send}; one thread {@link #receive}s.
 * Once {@link #close closed}, events already queued are still delivered, after
 * which {@code receive} returns empty and the consumer is expected to stop.
 *
 * @param <T> event type
 */
public class EventChannel<T> {

    private static final Object CLOSED = new Object();

    private final String name;
    private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public EventChannel(String name) {
        this.name = name;
    }

    /**
     * Queue an event.
     *
     * @return false if the channel is closed or the event is null
     */
    public boolean send(T event) {
        if (event == null || closed.get()) {
            return false;
        }
        return queue.offer(event);
    }

    /**
     * Block until the next event arrives.
     *
     * @return the event, or empty once the channel is closed and drained
     */
    public Optional<T> receive() throws InterruptedException {
        return unwrap(queue.take());
    }

    /**
     * Like {@link #receive()} but gives up after the timeout.
     *
     * @return the event, or empty on timeout or closure
     */
    public Optional<T> receive(long timeout, TimeUnit unit) throws InterruptedException {
        Object next = queue.poll(timeout, unit);
        return next == null ? Optional.empty() : unwrap(next);
    }

    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.offer(CLOSED);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    int pending() {
        int size = queue.size();
        return closed.get() && size > 0 ? size - 1 : size;
    }

    public String getName() {
        return name;
    }

    @SuppressWarnings("unchecked")
    private Optional<T> unwrap(Object next) {
        if (next == CLOSED) {
            // leave the marker for any later receive call
            queue.offer(CLOSED);
            return Optional.empty();
        }
        return Optional.of((T) next);
    }

    @Override
    public String toString() {
        return "EventChannel[" + name + ", pending=" + pending() + (closed.get() ? ", closed" : "") + "]";
    }
}
