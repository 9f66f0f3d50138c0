package com.sandkev.chatscrape.ingest;

import com.sandkev.chatscrape.domain.MessageRecord;
import com.sandkev.chatscrape.normalize.MessageNormalizer;
import com.sandkev.chatscrape.sink.RecordSink;
import com.sandkev.chatscrape.source.MessageSource;
import com.sandkev.chatscrape.source.PeerIdentity;
import com.sandkev.chatscrape.source.RawMessage;
import com.sandkev.chatscrape.source.SourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Iterator;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Replays the backlog after a cursor into the sink, oldest first.
 * <p>
 * Both bounds apply: a message is delivered only if {@code id > lastId} and it was
 * sent at or after {@code since}. The source is asked for both, and the filter is
 * repeated here so a source that honours only one of them still yields the same
 * set. Ids at or below the running maximum are dropped, which also removes
 * duplicates across page boundaries.
 * <p>
 * The pass is restart-safe rather than atomic: on a fetch or sink failure it stops
 * and reports what was delivered so far.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatchUpFetcher {

    private final MessageSource source;
    private final MessageNormalizer normalizer;
    private final RecordSink sink;

    public CatchUpResult fetch(PeerIdentity peer, long lastId, Instant since) {
        return fetch(peer, lastId, since, () -> false);
    }

    public CatchUpResult fetch(PeerIdentity peer, long lastId, Instant since, BooleanSupplier cancelled) {
        long maxId = lastId;
        int count = 0;

        try (Stream<RawMessage> backlog = source.fetchMessagesSince(peer, lastId, since)) {
            Iterator<RawMessage> it = backlog.iterator();
            while (it.hasNext()) {
                if (cancelled.getAsBoolean()) {
                    log.info("Catch-up cancelled after {} messages, last id {}", count, maxId);
                    return new CatchUpResult(maxId, count, CatchUpResult.Outcome.CANCELLED);
                }
                RawMessage msg = it.next();
                if (msg.id() <= maxId) {
                    log.debug("Skipping message {} at or below {}", msg.id(), maxId);
                    continue;
                }
                if (msg.date() != null && msg.date().isBefore(since)) {
                    log.debug("Skipping message {} sent {} before lookback {}", msg.id(), msg.date(), since);
                    continue;
                }

                MessageRecord record = normalizer.toRecord(peer.peerId(), msg);
                if (!sink.write(peer.peerId(), record)) {
                    log.warn("Catch-up stopped: message {} was not written; resuming from {} next run", msg.id(), maxId);
                    return new CatchUpResult(maxId, count, CatchUpResult.Outcome.SINK_FAILED);
                }
                maxId = msg.id();
                count++;
            }
        } catch (SourceException e) {
            log.warn("Catch-up fetch failed after {} messages (last id {}): {}", count, maxId, e.getMessage());
            return new CatchUpResult(maxId, count, CatchUpResult.Outcome.FETCH_FAILED);
        }
        return new CatchUpResult(maxId, count, CatchUpResult.Outcome.COMPLETE);
    }
}
