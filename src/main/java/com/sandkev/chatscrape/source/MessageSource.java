package com.sandkev.chatscrape.source;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * Remote chat source. Connection, auth and session handling live behind this seam.
 * Failures surface as {@link SourceException}.
 */
public interface MessageSource {

    PeerIdentity resolve(String target);

    /**
     * Backlog with {@code id > minId} sent at or after {@code since}, oldest first.
     * The stream is lazy, finite and must be closed; each call starts over.
     */
    Stream<RawMessage> fetchMessagesSince(PeerIdentity peer, long minId, Instant since);

    /** Live notifications for one peer. One subscription per run; not restartable. */
    MessageSubscription subscribeNewMessages(PeerIdentity peer);

    List<DialogInfo> listDialogs();
}
