package com.sandkev.chatscrape.source;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Unbounded buffer between an event producer and the tail consumer. Messages
 * published before the consumer starts are kept, so a subscription can be opened
 * ahead of catch-up without losing anything in between.
 */
@Slf4j
public class QueueMessageSubscription implements MessageSubscription {

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Runnable onClose;
    private volatile SourceException failure;

    public QueueMessageSubscription() {
        this(() -> {});
    }

    public QueueMessageSubscription(Runnable onClose) {
        this.onClose = onClose;
    }

    public void publish(RawMessage message) {
        if (!closed.get()) queue.add(message);
    }

    /** Upstream finished; already buffered messages are still handed out. */
    public void complete() {
        queue.add(END);
    }

    public void fail(Throwable error) {
        failure = error instanceof SourceException se ? se : new SourceException("Live stream failed", error);
        queue.add(END);
    }

    @Override
    public Optional<RawMessage> next() throws InterruptedException {
        if (closed.get()) return Optional.empty();
        Object item = queue.take();
        if (item == END || closed.get()) {
            queue.add(END);
            SourceException f = failure;
            if (f != null && !closed.get()) {
                failure = null;
                throw f;
            }
            return Optional.empty();
        }
        return Optional.of((RawMessage) item);
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        queue.add(END);
        try {
            onClose.run();
        } catch (RuntimeException e) {
            log.warn("Error releasing live subscription: {}", e.getMessage(), e);
        }
    }
}
