package com.sandkev.chatscrape.ingest;

import com.sandkev.chatscrape.checkpoint.CheckpointStore;
import com.sandkev.chatscrape.domain.MessageRecord;
import com.sandkev.chatscrape.normalize.MessageNormalizer;
import com.sandkev.chatscrape.sink.RecordSink;
import com.sandkev.chatscrape.source.MessageSubscription;
import com.sandkev.chatscrape.source.PeerIdentity;
import com.sandkev.chatscrape.source.RawMessage;
import com.sandkev.chatscrape.source.SourceException;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Consumes live notifications for one peer after catch-up.
 * <p>
 * Each message above the last delivered id is written to the sink and then
 * checkpointed on its own; anything at or below that id is a replay (catch-up
 * overlap or duplicate delivery) and is dropped. Messages are handled on the
 * calling thread, so cancelling by closing the subscription lets the current
 * message finish its write-then-checkpoint before the loop exits.
 * <p>
 * Checkpointing freezes once a gap is possible: when the preceding catch-up did
 * not complete, or a sink write fails here. Delivery carries on, but the cursor
 * stays at the last contiguous id so the next run re-fetches what may be missing.
 * <p>
 * One instance per run.
 */
@Slf4j
public class LiveTailController {

    private final PeerIdentity peer;
    private final MessageNormalizer normalizer;
    private final RecordSink sink;
    private final CheckpointStore checkpoints;

    private volatile TailState state = TailState.INACTIVE;
    private volatile long lastDeliveredId;
    private volatile long checkpointableId;
    private volatile long lastSavedId;
    private volatile boolean checkpointFrozen;
    private volatile int processed;

    /**
     * @param startId     highest id already delivered (catch-up max)
     * @param savedId     cursor value known to be durably stored
     * @param checkpointing false to start with checkpointing frozen at {@code startId}
     */
    public LiveTailController(PeerIdentity peer,
                              MessageNormalizer normalizer,
                              RecordSink sink,
                              CheckpointStore checkpoints,
                              long startId,
                              long savedId,
                              boolean checkpointing) {
        this.peer = peer;
        this.normalizer = normalizer;
        this.sink = sink;
        this.checkpoints = checkpoints;
        this.lastDeliveredId = startId;
        this.checkpointableId = startId;
        this.lastSavedId = savedId;
        this.checkpointFrozen = !checkpointing;
    }

    /** Blocks until the subscription is closed or ends, then writes the final checkpoint. */
    public void run(MessageSubscription subscription) {
        if (state != TailState.INACTIVE) {
            throw new IllegalStateException("Tail already " + state);
        }
        state = TailState.ACTIVE;
        log.info("--- Listening for new messages on {} after id {} ---", peer.displayName(), lastDeliveredId);
        try {
            while (state == TailState.ACTIVE) {
                Optional<RawMessage> next = subscription.next();
                if (next.isEmpty()) break;
                onMessage(next.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Tail interrupted");
        } catch (SourceException e) {
            log.warn("Live stream ended with error: {}", e.getMessage());
        } finally {
            state = TailState.STOPPED;
            flushFinalCheckpoint();
        }
    }

    void onMessage(RawMessage msg) {
        long id = msg.id();
        if (id <= lastDeliveredId) {
            log.debug("Discarding message {} at or below {}", id, lastDeliveredId);
            return;
        }
        MessageRecord record = normalizer.toRecord(peer.peerId(), msg);
        if (!sink.write(peer.peerId(), record)) {
            if (!checkpointFrozen) {
                log.warn("Message {} was not written; holding checkpoint at {} for the rest of this run", id, checkpointableId);
            }
            checkpointFrozen = true;
            return;
        }
        lastDeliveredId = id;
        processed++;

        if (!checkpointFrozen) {
            checkpointableId = id;
            if (checkpoints.save(peer.peerId(), id)) {
                lastSavedId = id;
            }
        }
    }

    private void flushFinalCheckpoint() {
        long target = checkpointableId;
        if (target > lastSavedId) {
            log.info("Saving final state: {}", target);
            if (checkpoints.save(peer.peerId(), target)) {
                lastSavedId = target;
            }
        }
    }

    public TailState state() {
        return state;
    }

    /** Highest id written to the sink; the de-duplication boundary. */
    public long lastDeliveredId() {
        return lastDeliveredId;
    }

    /** Highest id that may be checkpointed without skipping an unwritten message. */
    public long checkpointableId() {
        return checkpointableId;
    }

    public long lastSavedId() {
        return lastSavedId;
    }

    public boolean checkpointFrozen() {
        return checkpointFrozen;
    }

    public int processed() {
        return processed;
    }
}
