package com.sandkev.chatscrape.ingest;

import com.sandkev.chatscrape.checkpoint.CheckpointStore;
import com.sandkev.chatscrape.normalize.MessageNormalizer;
import com.sandkev.chatscrape.sink.RecordSink;
import com.sandkev.chatscrape.source.MessageSource;
import com.sandkev.chatscrape.source.MessageSubscription;
import com.sandkev.chatscrape.source.PeerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one ingestion: resolve, load cursor, catch up, optionally tail, checkpoint.
 * <p>
 * The cursor only ever moves to an id that has reached the sink, and the highest
 * such id is saved on every way out of {@link #run}, including cancellation.
 * {@link #cancel()} may be called from any thread (a shutdown hook); it stops
 * catch-up between messages and closes the live channel so the tail loop drains.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionOrchestrator {

    private final MessageSource source;
    private final CheckpointStore checkpoints;
    private final RecordSink sink;
    private final MessageNormalizer normalizer;
    private final CatchUpFetcher fetcher;
    private final Clock clock;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile MessageSubscription activeSubscription;
    private volatile LiveTailController activeTail;

    public IngestionReport run(IngestionRequest request) {
        PeerIdentity peer = source.resolve(request.target());
        log.info("Scraping: {} [{} | {}]", peer.displayName(), peer.peerId(), request.target());

        Instant since = clock.instant().minus(request.lookback());
        long startCursor;
        if (request.reset()) {
            log.info("[reset] Ignoring saved cursor, starting from 0");
            startCursor = 0L;
        } else {
            startCursor = checkpoints.load(peer.peerId());
        }

        MessageSubscription subscription = null;
        try {
            if (request.tail()) {
                // opened ahead of catch-up so nothing sent in between is missed
                subscription = source.subscribeNewMessages(peer);
                activeSubscription = subscription;
                if (cancelled.get()) subscription.close();
            }

            log.info("[{}] Fetching since ID {} or {}", sink.mode(), startCursor, since);
            CatchUpResult catchUp = fetcher.fetch(peer, startCursor, since, cancelled::get);

            long cursor = catchUp.maxId();
            long persisted = startCursor;
            if (cursor > startCursor && checkpoints.save(peer.peerId(), cursor)) {
                persisted = cursor;
            }
            log.info("Processed {} messages. Last ID: {}", catchUp.count(), cursor);
            if (!catchUp.complete()) {
                log.warn("Catch-up ended early ({}); cursor held at {}", catchUp.outcome(), cursor);
            }

            int tailProcessed = 0;
            if (subscription != null && !cancelled.get()) {
                LiveTailController tail = new LiveTailController(
                        peer, normalizer, sink, checkpoints, cursor, persisted, catchUp.complete());
                activeTail = tail;
                tail.run(subscription);
                cursor = tail.checkpointableId();
                persisted = tail.lastSavedId();
                tailProcessed = tail.processed();
            }

            if (cursor > persisted) {
                log.info("Saving final state: {}", cursor);
                if (checkpoints.save(peer.peerId(), cursor)) {
                    persisted = cursor;
                } else {
                    log.warn("Final checkpoint {} not saved; next run resumes from {}", cursor, persisted);
                }
            }
            return new IngestionReport(peer, startCursor, catchUp, tailProcessed, cursor, persisted, cancelled.get());
        } finally {
            if (subscription != null) subscription.close();
            activeSubscription = null;
        }
    }

    /** Idempotent. Safe to call before, during or after {@link #run}. */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        LiveTailController tail = activeTail;
        log.info("[signal] Stopping{}", tail == null ? "" : " after id " + tail.lastDeliveredId());
        MessageSubscription subscription = activeSubscription;
        if (subscription != null) subscription.close();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Tail of the current run, if it got that far. */
    public LiveTailController activeTail() {
        return activeTail;
    }
}
