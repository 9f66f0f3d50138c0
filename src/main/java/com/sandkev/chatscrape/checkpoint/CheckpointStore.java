package com.sandkev.chatscrape.checkpoint;

/**
 * Durable "highest processed message id" per peer.
 * <p>
 * Neither operation throws for storage problems: a failed load reads as {@code 0}
 * (replay from the lookback window) and a failed save is logged and reported as
 * {@code false}. The caller's in-memory cursor stays authoritative for the rest of
 * the run either way.
 */
public interface CheckpointStore {

    /** @return the saved cursor, or 0 when none exists or it cannot be read */
    long load(long peerId);

    /** @return true once the value is durably stored */
    boolean save(long peerId, long cursor);
}
