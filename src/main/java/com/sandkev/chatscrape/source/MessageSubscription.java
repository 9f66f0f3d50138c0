package com.sandkev.chatscrape.source;

import java.util.Optional;

/**
 * Channel of live messages. {@link #next()} blocks until a message arrives and
 * returns empty once the channel is closed or the upstream stream ends.
 * Closing is how the consumer is cancelled.
 */
public interface MessageSubscription extends AutoCloseable {

    Optional<RawMessage> next() throws InterruptedException;

    boolean isClosed();

    @Override
    void close();
}
